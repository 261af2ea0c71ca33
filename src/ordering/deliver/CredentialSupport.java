/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.deliver;

import java.io.IOException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import ordering.util.OrdererCommon;
import ordering.util.OrdererCommon.OrdererException;

/**
 * Holds the client certificate presented in the TLS handshake with the ordering service.
 *
 * @author joao
 */
public class CredentialSupport {

    private final X509Certificate clientCertificate;

    public CredentialSupport(X509Certificate clientCertificate) {

        this.clientCertificate = clientCertificate;
    }

    public static CredentialSupport fromFile(String filename) throws OrdererException {

        try {

            return new CredentialSupport(OrdererCommon.getCertificate(filename));

        } catch (IOException | CertificateException ex) {

            throw new OrdererException("Failed to load TLS client certificate " + filename, ex);
        }
    }

    public X509Certificate getClientCertificate() {
        return clientCertificate;
    }
}
