/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import java.util.Optional;
import ordering.util.OrdererCommon.OrdererException;

/**
 * Parsed configuration of one channel.
 *
 * @author joao
 */
public interface ChannelResources {

    ConfigtxValidator getConfigtxValidator();

    Optional<OrdererConfig> getOrdererConfig();

    /**
     * Checks that {@code newResources} is a legal successor of these resources.
     */
    void validateNew(ChannelResources newResources) throws OrdererException;

    /**
     * Fails when the channel group requires a capability this node does not have.
     * See {@link Capabilities#checkChannelSupported}.
     */
    void checkChannelCapabilitiesSupported() throws OrdererException;
}
