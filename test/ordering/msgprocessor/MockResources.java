/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import java.util.Optional;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Common;
import org.hyperledger.fabric.protos.common.Configtx;

/**
 * Settable {@link ChannelResources} with an embedded {@link ConfigtxValidator}.
 */
public class MockResources implements ChannelResources, ConfigtxValidator {

    public String channelIDVal;
    public Configtx.ConfigEnvelope proposeConfigUpdateVal;
    public OrdererException proposeConfigUpdateErr;
    public OrdererConfig ordererConfigVal;
    public OrdererException validateNewErr;
    public OrdererException channelCapabilitiesErr;

    public MockResources(String channelID) {
        this.channelIDVal = channelID;
    }

    @Override
    public ConfigtxValidator getConfigtxValidator() {
        return this;
    }

    @Override
    public Optional<OrdererConfig> getOrdererConfig() {
        return Optional.ofNullable(ordererConfigVal);
    }

    @Override
    public void validateNew(ChannelResources newResources) throws OrdererException {
        if (validateNewErr != null) throw validateNewErr;
    }

    @Override
    public void checkChannelCapabilitiesSupported() throws OrdererException {
        if (channelCapabilitiesErr != null) throw channelCapabilitiesErr;
    }

    @Override
    public String getChannelID() {
        return channelIDVal;
    }

    @Override
    public Configtx.ConfigEnvelope proposeConfigUpdate(Common.Envelope configUpdate) throws OrdererException {
        if (proposeConfigUpdateErr != null) throw proposeConfigUpdateErr;
        return proposeConfigUpdateVal;
    }
}
