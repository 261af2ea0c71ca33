/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import ordering.util.OrdererCommon.OrdererException;

/**
 * Consensus specific check of a change in consensus metadata.
 *
 * @author joao
 */
public interface MetadataValidator {

    void validateConsensusMetadata(byte[] oldMetadata, byte[] newMetadata, boolean newChannel) throws OrdererException;
}
