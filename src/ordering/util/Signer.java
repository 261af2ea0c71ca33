/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.util;

import ordering.util.OrdererCommon.OrdererException;

/**
 * Signs messages on behalf of the local identity. Implementations must be safe
 * for concurrent use, since one signer is shared by every channel.
 *
 * @author joao
 */
public interface Signer {

    byte[] sign(byte[] message) throws OrdererException;

    /**
     * Marshalled {@code SerializedIdentity} of the signing identity.
     */
    byte[] serialize();
}
