/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Configtx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Current orderer configuration of the system channel. Readers always see a
 * complete configuration; {@link #update(Configtx.Config)} replaces it in one
 * step once a reconfiguration of the system channel is committed.
 *
 * @author joao
 */
public class LiveSystemChannelSupport implements SystemChannelSupport {

    private static final Logger logger = LoggerFactory.getLogger(LiveSystemChannelSupport.class);

    private final String sysChannel;
    private final AtomicReference<OrdererConfig> current = new AtomicReference<>();

    public LiveSystemChannelSupport(String sysChannel, Configtx.Config genesisConfig) throws OrdererException {

        this.sysChannel = sysChannel;
        update(genesisConfig);
    }

    public void update(Configtx.Config config) throws OrdererException {

        ConfigOrdererConfig oc = ConfigOrdererConfig.fromConfig(config);
        current.set(oc);

        logger.info("System channel " + sysChannel + " orderer config at sequence " + config.getSequence()
                + ": consensus " + oc.getConsensusType() + " (" + oc.getConsensusState() + "), max channels "
                + Long.toUnsignedString(oc.getMaxChannelsCount()));
    }

    @Override
    public Optional<OrdererConfig> getOrdererConfig() {
        return Optional.ofNullable(current.get());
    }

    public String getSysChannel() {
        return sysChannel;
    }
}
