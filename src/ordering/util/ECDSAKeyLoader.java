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

/**
 *
 * @author joao
 */
public class ECDSAKeyLoader {

    private final String keystore;
    private final String certificate;

    public ECDSAKeyLoader(NodeConfig config) {

        this(config.getKeystore(), config.getCertificate());
    }

    public ECDSAKeyLoader(String keystore, String certificate) {

        this.keystore = keystore;
        this.certificate = certificate;

    }

    public X509Certificate loadCertificate() throws IOException, CertificateException {

        return OrdererCommon.getCertificate(certificate);

    }

    public PrivateKey loadPrivateKey() throws IOException {

        return OrdererCommon.getPemPrivateKey(keystore);
    }

}
