/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.deliver;

import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Common;

/**
 * Client side of a deliver stream. Closing it fails any in-flight send.
 *
 * @author joao
 */
public interface BlocksDeliverer extends AutoCloseable {

    void send(Common.Envelope env) throws OrdererException;

    @Override
    void close();
}
