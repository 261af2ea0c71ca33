/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.util;

import java.io.IOException;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.msp.Identities;
import org.hyperledger.fabric.sdk.exception.CryptoException;
import org.hyperledger.fabric.sdk.security.CryptoPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signer backed by the node's own MSP artifacts (PEM private key and certificate).
 *
 * @author joao
 */
public class LocalSigner implements Signer {

    private static final Logger logger = LoggerFactory.getLogger(LocalSigner.class);

    private final CryptoPrimitives crypto;
    private final PrivateKey privKey;
    private final byte[] identity;

    // CryptoPrimitives is shared by every channel's requester
    private final Lock signLock = new ReentrantLock();

    public LocalSigner(CryptoPrimitives crypto, String mspid, PrivateKey privKey, X509Certificate certificate) throws OrdererException {

        this.crypto = crypto;
        this.privKey = privKey;

        try {

            byte[] serializedCert = OrdererCommon.getSerializedCertificate(certificate);
            Identities.SerializedIdentity ident = OrdererCommon.getSerializedIdentity(mspid, serializedCert);
            this.identity = ident.toByteArray();

        } catch (IOException | CertificateException ex) {

            throw new OrdererException("Failed to serialize certificate for MSP " + mspid, ex);
        }

        logger.debug("Loaded signing identity for MSP " + mspid + " (" + certificate.getSubjectX500Principal().getName() + ")");
    }

    public static LocalSigner fromConfig(NodeConfig config) throws OrdererException {

        ECDSAKeyLoader loader = new ECDSAKeyLoader(config);

        try {

            CryptoPrimitives crypto = new CryptoPrimitives();
            crypto.init();

            return new LocalSigner(crypto, config.getMspid(), loader.loadPrivateKey(), loader.loadCertificate());

        } catch (OrdererException ex) {

            throw ex;

        } catch (Exception ex) {

            throw new OrdererException("Failed to load signing identity from " + config.getConfigDir() + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public byte[] sign(byte[] message) throws OrdererException {

        signLock.lock();
        try {

            return crypto.sign(privKey, message);

        } catch (CryptoException ex) {

            throw new OrdererException("Failed to sign message: " + ex.getMessage(), ex);

        } finally {
            signLock.unlock();
        }
    }

    @Override
    public byte[] serialize() {

        return identity.clone();
    }

}
