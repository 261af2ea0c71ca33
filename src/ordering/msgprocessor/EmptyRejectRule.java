/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import org.hyperledger.fabric.protos.common.Common;

/**
 *
 * @author joao
 */
public class EmptyRejectRule implements Rule {

    @Override
    public void apply(Common.Envelope env) throws FilterException {

        if (env == null || env.getPayload().isEmpty()) {
            throw new FilterException(FilterException.Kind.EMPTY_MESSAGE, "message was empty");
        }
    }
}
