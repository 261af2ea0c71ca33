/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

/**
 * Validator for consensus types that keep no metadata of their own.
 *
 * @author joao
 */
public class PermissiveMetadataValidator implements MetadataValidator {

    @Override
    public void validateConsensusMetadata(byte[] oldMetadata, byte[] newMetadata, boolean newChannel) {
    }
}
