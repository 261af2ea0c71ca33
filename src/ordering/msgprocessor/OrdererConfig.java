/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import ordering.util.OrdererCommon.OrdererException;

/**
 * Orderer section of a channel configuration.
 *
 * @author joao
 */
public interface OrdererConfig {

    ConsensusState getConsensusState();

    byte[] getConsensusMetadata();

    /**
     * Maximum number of channels the ordering service may host, read as an
     * unsigned value. Zero means unlimited.
     */
    long getMaxChannelsCount();

    /**
     * Largest envelope (payload plus signature) the ordering service accepts, in bytes.
     */
    long getAbsoluteMaxBytes();

    /**
     * Fails when the orderer group requires a capability this node does not have.
     */
    void checkCapabilitiesSupported() throws OrdererException;
}
