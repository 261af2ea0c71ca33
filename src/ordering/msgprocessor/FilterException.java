/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import ordering.util.OrdererCommon.OrdererException;

/**
 * Rejection of an envelope by one of the ingress rules. A rejected envelope is
 * dropped; it is never retried.
 *
 * @author joao
 */
public class FilterException extends OrdererException {

    public enum Kind {

        EMPTY_MESSAGE,
        MESSAGE_TOO_LARGE,
        IDENTITY_EXPIRED,

        // structure of the wrapped channel creation transaction
        MALFORMED_PAYLOAD,
        MISSING_HEADER,
        BAD_CHANNEL_HEADER,
        BAD_CONFIG_TX,
        BAD_CONFIG_TX_PAYLOAD,
        MISSING_CONFIG_TX_HEADER,
        BAD_CONFIG_TX_CHANNEL_HEADER,
        NOT_CONFIG_TRANSACTION,
        BAD_CONFIG_ENVELOPE,
        MISSING_LAST_UPDATE,

        // policy
        CHANNEL_CREATION_FORBIDDEN,
        TOO_MANY_CHANNELS,

        // candidate channel configuration
        CONFIG_MISMATCH,
        BAD_BUNDLE,
        MISSING_ORDERER_CONFIG,
        UNSUPPORTED_CAPABILITIES,
        INVALID_CONSENSUS_METADATA
    }

    private final Kind kind;

    public FilterException(Kind kind, String msg) {

        super(msg);
        this.kind = kind;
    }

    public FilterException(Kind kind, String msg, Throwable cause) {

        super(msg, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
