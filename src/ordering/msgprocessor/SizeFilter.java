/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import org.hyperledger.fabric.protos.common.Common;

/**
 * Rejects envelopes whose payload and signature together exceed the channel's
 * absolute maximum batch size. The limit is read from the live configuration
 * on every call.
 *
 * @author joao
 */
public class SizeFilter implements Rule {

    private final SystemChannelSupport support;

    public SizeFilter(SystemChannelSupport support) {

        this.support = support;
    }

    @Override
    public void apply(Common.Envelope env) throws FilterException {

        OrdererConfig ordererConfig = support.getOrdererConfig()
                .orElseThrow(() -> new IllegalStateException("System channel does not have orderer config"));

        long maxBytes = ordererConfig.getAbsoluteMaxBytes();
        long size = (long) env.getPayload().size() + env.getSignature().size();

        if (size > maxBytes) {
            throw new FilterException(FilterException.Kind.MESSAGE_TOO_LARGE,
                    "message payload is " + size + " bytes and exceeds maximum allowed " + maxBytes + " bytes");
        }
    }
}
