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
 * Applies config updates against one channel's configuration.
 *
 * @author joao
 */
public interface ConfigtxValidator {

    String getChannelID();

    /**
     * Computes the config envelope that results from applying {@code configUpdate}.
     */
    Configtx.ConfigEnvelope proposeConfigUpdate(Common.Envelope configUpdate) throws OrdererException;
}
