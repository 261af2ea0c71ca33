/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import com.google.protobuf.InvalidProtocolBufferException;
import java.util.Map;
import java.util.Set;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Configtx;
import org.hyperledger.fabric.protos.orderer.Configuration;

/**
 * {@link OrdererConfig} read from the Orderer group of a channel configuration.
 *
 * @author joao
 */
public class ConfigOrdererConfig implements OrdererConfig {

    public static final String ORDERER_GROUP_KEY = "Orderer";
    public static final String CONSENSUS_TYPE_KEY = "ConsensusType";
    public static final String BATCH_SIZE_KEY = "BatchSize";
    public static final String CHANNEL_RESTRICTIONS_KEY = "ChannelRestrictions";

    private final String consensusType;
    private final ConsensusState consensusState;
    private final byte[] consensusMetadata;
    private final long absoluteMaxBytes;
    private final long maxChannelsCount;
    private final Set<String> capabilities;

    private ConfigOrdererConfig(Configuration.ConsensusType consensus, Configuration.BatchSize batchSize,
            Configuration.ChannelRestrictions restrictions, Set<String> capabilities) throws OrdererException {

        if (batchSize.getAbsoluteMaxBytes() == 0)
            throw new OrdererException("Attempted to set the batch size absolute max bytes to an invalid value: 0");

        this.consensusType = consensus.getType();
        this.consensusMetadata = consensus.getMetadata().toByteArray();
        this.absoluteMaxBytes = Integer.toUnsignedLong(batchSize.getAbsoluteMaxBytes());
        this.maxChannelsCount = restrictions.getMaxCount();
        this.capabilities = capabilities;

        try {
            this.consensusState = ConsensusState.fromValue(consensus.getStateValue());
        } catch (IllegalArgumentException ex) {
            throw new OrdererException("Invalid consensus type state: " + ex.getMessage(), ex);
        }
    }

    public static ConfigOrdererConfig fromConfig(Configtx.Config config) throws OrdererException {

        Configtx.ConfigGroup orderer = config.getChannelGroup().getGroupsMap().get(ORDERER_GROUP_KEY);

        if (orderer == null) throw new OrdererException("config is missing orderer group");

        Map<String,Configtx.ConfigValue> values = orderer.getValuesMap();

        try {

            Configtx.ConfigValue consensus = values.get(CONSENSUS_TYPE_KEY);
            if (consensus == null) throw new OrdererException("orderer group is missing " + CONSENSUS_TYPE_KEY);

            Configtx.ConfigValue batchSize = values.get(BATCH_SIZE_KEY);
            if (batchSize == null) throw new OrdererException("orderer group is missing " + BATCH_SIZE_KEY);

            Configtx.ConfigValue restrictions = values.get(CHANNEL_RESTRICTIONS_KEY);

            return new ConfigOrdererConfig(
                    Configuration.ConsensusType.parseFrom(consensus.getValue()),
                    Configuration.BatchSize.parseFrom(batchSize.getValue()),
                    restrictions != null ? Configuration.ChannelRestrictions.parseFrom(restrictions.getValue())
                            : Configuration.ChannelRestrictions.getDefaultInstance(),
                    Capabilities.requiredBy(orderer));

        } catch (InvalidProtocolBufferException ex) {

            throw new OrdererException("Failed to parse orderer config: " + ex.getMessage(), ex);
        }
    }

    public String getConsensusType() {
        return consensusType;
    }

    @Override
    public ConsensusState getConsensusState() {
        return consensusState;
    }

    @Override
    public byte[] getConsensusMetadata() {
        return consensusMetadata.clone();
    }

    @Override
    public long getMaxChannelsCount() {
        return maxChannelsCount;
    }

    @Override
    public long getAbsoluteMaxBytes() {
        return absoluteMaxBytes;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    @Override
    public void checkCapabilitiesSupported() throws OrdererException {

        Capabilities.checkSupported("Orderer", Capabilities.SUPPORTED_ORDERER, capabilities);
    }
}
