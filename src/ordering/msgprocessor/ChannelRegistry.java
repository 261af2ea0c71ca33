/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import ordering.util.OrdererCommon.OrdererException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channels hosted by the ordering service. Creation is serialised here: a
 * channel id is created at most once and the channel limit is checked again
 * under the registry lock, whatever the admission filter saw earlier.
 *
 * <p>Subclasses supply the config machinery ({@link #newChannelConfig} and
 * {@link #createBundle}).
 *
 * @author joao
 */
public abstract class ChannelRegistry implements ChainCreator {

    private static final Logger logger = LoggerFactory.getLogger(ChannelRegistry.class);

    private final SystemChannelSupport support;
    private final Map<String,ChannelResources> channels = new TreeMap<>();
    private final Lock lock = new ReentrantLock();

    protected ChannelRegistry(SystemChannelSupport support, String sysChannel, ChannelResources sysResources) {

        this.support = support;
        this.channels.put(sysChannel, sysResources);
    }

    @Override
    public int channelsCount() {

        lock.lock();
        try {
            return channels.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void createChannel(ChannelResources bundle) throws OrdererException {

        String channelID = bundle.getConfigtxValidator().getChannelID();

        lock.lock();
        try {

            if (channels.containsKey(channelID)) {
                logger.debug("Refusing to create channel " + channelID + ": already exists");
                throw new OrdererException("channel " + channelID + " already exists");
            }

            long maxChannels = support.getOrdererConfig().map(OrdererConfig::getMaxChannelsCount).orElse(0L);

            if (maxChannels != 0 && Long.compareUnsigned(channels.size(), maxChannels) >= 0) {
                logger.debug("Refusing to create channel " + channelID + ": limit of " + Long.toUnsignedString(maxChannels) + " reached");
                throw new FilterException(FilterException.Kind.TOO_MANY_CHANNELS,
                        "channel creation would exceed maximimum number of channels: " + Long.toUnsignedString(maxChannels));
            }

            channels.put(channelID, bundle);

        } finally {
            lock.unlock();
        }

        logger.info("Created channel " + channelID);
    }

    public ChannelResources getChannel(String channelID) {

        lock.lock();
        try {
            return channels.get(channelID);
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getChannelIDs() {

        lock.lock();
        try {
            return new TreeSet<>(channels.keySet());
        } finally {
            lock.unlock();
        }
    }
}
