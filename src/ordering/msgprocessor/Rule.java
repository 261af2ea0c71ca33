/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Common;

/**
 * A check applied to every envelope before it is ordered. Returning normally
 * means the envelope is accepted by this rule.
 *
 * @author joao
 */
public interface Rule {

    void apply(Common.Envelope env) throws OrdererException;
}
