/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Common;
import org.hyperledger.fabric.protos.common.Configtx;

/**
 * Owner of the set of channels hosted by the ordering service.
 *
 * @author joao
 */
public interface ChainCreator {

    /** Number of channels currently hosted, system channel included. */
    int channelsCount();

    /**
     * Materialises the resources a new channel would start from, given the
     * config update envelope that requests its creation.
     */
    ChannelResources newChannelConfig(Common.Envelope envConfigUpdate) throws OrdererException;

    ChannelResources createBundle(String channelID, Configtx.Config config) throws OrdererException;

    /**
     * Instantiates a channel whose configuration passed admission. Must reject
     * a second creation of the same channel.
     */
    void createChannel(ChannelResources bundle) throws OrdererException;
}
