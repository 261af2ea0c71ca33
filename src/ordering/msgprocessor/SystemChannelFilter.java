/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import com.google.protobuf.InvalidProtocolBufferException;
import ordering.msgprocessor.FilterException.Kind;
import ordering.util.OrdererCommon;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Common;
import org.hyperledger.fabric.protos.common.Configtx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission rule of the system channel. Envelopes of type ORDERER_TRANSACTION
 * wrap a CONFIG transaction that creates a new channel; this rule checks the
 * wrapped transaction, the maintenance state and the channel limit, then the new
 * channel's capabilities and consensus metadata, before handing the new channel to the
 * {@link ChainCreator}. Every other envelope passes untouched.
 *
 * <p>The channel limit check reads {@link ChainCreator#channelsCount()} before
 * the candidate is materialised, so two concurrent proposals may both pass it.
 * The chain creator has the final word when the channel is created.
 *
 * @author joao
 */
public class SystemChannelFilter implements Rule {

    public static final String ERR_MAINTENANCE_MODE = "maintenance mode";

    private static final Logger logger = LoggerFactory.getLogger(SystemChannelFilter.class);

    private final SystemChannelSupport support;
    private final ChainCreator cc;
    private final MetadataValidator validator;

    public SystemChannelFilter(SystemChannelSupport support, ChainCreator cc, MetadataValidator validator) {

        this.support = support;
        this.cc = cc;
        this.validator = validator;
    }

    @Override
    public void apply(Common.Envelope env) throws OrdererException {

        Common.Payload msgData = parse(Kind.MALFORMED_PAYLOAD, "bad payload", () -> OrdererCommon.unmarshalPayload(env.getPayload()));

        if (!msgData.hasHeader()) throw new FilterException(Kind.MISSING_HEADER, "missing payload header");

        Common.ChannelHeader chdr = parse(Kind.BAD_CHANNEL_HEADER, "bad channel header",
                () -> OrdererCommon.unmarshalChannelHeader(msgData.getHeader().getChannelHeader()));

        if (chdr.getType() != Common.HeaderType.ORDERER_TRANSACTION_VALUE) return;

        Common.Envelope configTx = parse(Kind.BAD_CONFIG_TX, "payload data error unmarshaling to envelope",
                () -> OrdererCommon.unmarshalEnvelope(msgData.getData()));

        authorizeAndInspect(configTx);
    }

    private void authorizeAndInspect(Common.Envelope configTx) throws OrdererException {

        Configtx.ConfigEnvelope configEnvelope = unwrapConfigEnvelope(configTx);

        // one snapshot of the system channel config for the whole proposal
        OrdererConfig ordererConfig = support.getOrdererConfig()
                .orElseThrow(() -> new IllegalStateException("System channel does not have orderer config"));

        ChannelResources bundle;
        String channelID;

        try {

            checkAdmissible(ordererConfig);

            ChannelResources res = cc.newChannelConfig(configEnvelope.getLastUpdate());
            channelID = res.getConfigtxValidator().getChannelID();

            bundle = inspectCandidate(res, configEnvelope);

            checkCandidateOrderer(ordererConfig, bundle);

        } catch (OrdererException ex) {

            logger.debug("Rejecting channel creation request: " + ex.getMessage());
            throw ex;
        }

        logger.info("Channel creation request for " + channelID + " admitted");

        cc.createChannel(bundle);
    }

    private void checkCandidateOrderer(OrdererConfig ordererConfig, ChannelResources bundle) throws OrdererException {

        OrdererConfig oc = bundle.getOrdererConfig()
                .orElseThrow(() -> new FilterException(Kind.MISSING_ORDERER_CONFIG, "config is missing orderer group"));

        try {

            oc.checkCapabilitiesSupported();
            bundle.checkChannelCapabilitiesSupported();

        } catch (OrdererException ex) {

            throw new FilterException(Kind.UNSUPPORTED_CAPABILITIES, "config update is not compatible: " + ex.getMessage(), ex);
        }

        try {

            validator.validateConsensusMetadata(ordererConfig.getConsensusMetadata(), oc.getConsensusMetadata(), true);

        } catch (OrdererException ex) {

            throw new FilterException(Kind.INVALID_CONSENSUS_METADATA,
                    "consensus metadata update for channel creation is invalid: " + ex.getMessage(), ex);
        }
    }

    private Configtx.ConfigEnvelope unwrapConfigEnvelope(Common.Envelope configTx) throws FilterException {

        Common.Payload configTxPayload = parse(Kind.BAD_CONFIG_TX_PAYLOAD, "error unmarshaling wrapped configtx envelope payload",
                () -> OrdererCommon.unmarshalPayload(configTx.getPayload()));

        if (!configTxPayload.hasHeader())
            throw new FilterException(Kind.MISSING_CONFIG_TX_HEADER, "wrapped configtx envelope missing header");

        Common.ChannelHeader configTxChannelHeader = parse(Kind.BAD_CONFIG_TX_CHANNEL_HEADER,
                "error unmarshaling wrapped configtx envelope channel header",
                () -> OrdererCommon.unmarshalChannelHeader(configTxPayload.getHeader().getChannelHeader()));

        if (configTxChannelHeader.getType() != Common.HeaderType.CONFIG_VALUE)
            throw new FilterException(Kind.NOT_CONFIG_TRANSACTION, "wrapped configtx envelope not a config transaction");

        Configtx.ConfigEnvelope configEnvelope = parse(Kind.BAD_CONFIG_ENVELOPE,
                "error unmarshalling wrapped configtx config envelope from payload",
                () -> OrdererCommon.unmarshalConfigEnvelope(configTxPayload.getData()));

        if (!configEnvelope.hasLastUpdate())
            throw new FilterException(Kind.MISSING_LAST_UPDATE, "updated config does not include a config update");

        return configEnvelope;
    }

    private void checkAdmissible(OrdererConfig ordererConfig) throws FilterException {

        if (ordererConfig.getConsensusState() != ConsensusState.NORMAL) {
            throw new FilterException(Kind.CHANNEL_CREATION_FORBIDDEN, "channel creation is not permitted: " + ERR_MAINTENANCE_MODE);
        }

        long maxChannels = ordererConfig.getMaxChannelsCount();

        if (maxChannels != 0 && Long.compareUnsigned(cc.channelsCount(), maxChannels) >= 0) {
            throw new FilterException(Kind.TOO_MANY_CHANNELS,
                    "channel creation would exceed maximimum number of channels: " + Long.toUnsignedString(maxChannels));
        }
    }

    private ChannelResources inspectCandidate(ChannelResources res, Configtx.ConfigEnvelope configEnvelope) throws OrdererException {

        ConfigtxValidator configtxValidator = res.getConfigtxValidator();

        Configtx.ConfigEnvelope newChannelConfigEnv = configtxValidator.proposeConfigUpdate(configEnvelope.getLastUpdate());

        if (!newChannelConfigEnv.equals(configEnvelope)) {
            throw new FilterException(Kind.CONFIG_MISMATCH,
                    "config proposed by the channel creation request did not match the config received with the channel creation request");
        }

        ChannelResources bundle;

        try {

            bundle = cc.createBundle(configtxValidator.getChannelID(), newChannelConfigEnv.getConfig());

        } catch (OrdererException ex) {

            throw new FilterException(Kind.BAD_BUNDLE, "config does not validly parse: " + ex.getMessage(), ex);
        }

        try {

            res.validateNew(bundle);

        } catch (OrdererException ex) {

            throw new FilterException(Kind.BAD_BUNDLE, "new bundle invalid: " + ex.getMessage(), ex);
        }

        return bundle;
    }

    private interface ParseStep<T> {

        T parse() throws InvalidProtocolBufferException;
    }

    private static <T> T parse(Kind kind, String msg, ParseStep<T> step) throws FilterException {

        try {

            return step.parse();

        } catch (InvalidProtocolBufferException ex) {

            logger.debug("Rejecting envelope: " + msg, ex);
            throw new FilterException(kind, msg + ": " + ex.getMessage(), ex);
        }
    }
}
