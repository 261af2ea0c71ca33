/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.util;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Timestamp;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.IOUtils;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;
import org.hyperledger.fabric.protos.common.Common;
import org.hyperledger.fabric.protos.common.Configtx;
import org.hyperledger.fabric.protos.msp.Identities;

/**
 * Envelope, certificate and key helpers shared by the admission filters and the
 * block requester.
 *
 * @author joao
 */
public class OrdererCommon {

    public final static String DEFAULT_CONFIG_DIR = "./config/";

    public final static int NONCE_SIZE = 24;

    private static final SecureRandom random = new SecureRandom();

    public static class OrdererException extends Exception {

        public OrdererException(String msg) {

            super(msg);
        }

        public OrdererException(String msg, Throwable cause) {

            super(msg, cause);
        }

    }

    public static String getConfigDir(String envVar) {

        String configDir = OrdererCommon.DEFAULT_CONFIG_DIR;

        String envDir = System.getenv(envVar);

        if (envDir != null) {

            File path = new File(envDir);
            if (path.exists() && path.isDirectory()) configDir = envDir;
        }

        if (!configDir.endsWith("/")) configDir = configDir + "/";

        return configDir;

    }

    public static Common.Payload unmarshalPayload(ByteString bytes) throws InvalidProtocolBufferException {

        return Common.Payload.parseFrom(bytes);
    }

    public static Common.ChannelHeader unmarshalChannelHeader(ByteString bytes) throws InvalidProtocolBufferException {

        return Common.ChannelHeader.parseFrom(bytes);
    }

    public static Common.Envelope unmarshalEnvelope(ByteString bytes) throws InvalidProtocolBufferException {

        return Common.Envelope.parseFrom(bytes);
    }

    public static Configtx.ConfigEnvelope unmarshalConfigEnvelope(ByteString bytes) throws InvalidProtocolBufferException {

        return Configtx.ConfigEnvelope.parseFrom(bytes);
    }

    public static Common.ChannelHeader makeChannelHeader(Common.HeaderType headerType, int version, String chainID, long epoch, long timestamp) {

        Timestamp.Builder ts = Timestamp.newBuilder();
        ts.setSeconds(timestamp / 1000);
        ts.setNanos((int) ((timestamp % 1000) * 1000000));

        Common.ChannelHeader.Builder result = Common.ChannelHeader.newBuilder();
        result.setType(headerType.getNumber());
        result.setVersion(version);
        result.setEpoch(epoch);
        result.setChannelId(chainID);
        result.setTimestamp(ts);
        result.setTlsCertHash(ByteString.EMPTY);

        return result.build();
    }

    public static Common.SignatureHeader createSignatureHeader(byte[] creator, byte[] nonce) {

        Common.SignatureHeader.Builder signatureHeaderBuilder = Common.SignatureHeader.newBuilder();

        signatureHeaderBuilder.setCreator(ByteString.copyFrom(creator));
        signatureHeaderBuilder.setNonce(ByteString.copyFrom(nonce));

        return signatureHeaderBuilder.build();
    }

    public static byte[] createNonce() {

        byte[] nonce = new byte[NONCE_SIZE];
        random.nextBytes(nonce);
        return nonce;
    }

    /**
     * Builds an envelope of the given type carrying {@code dataMsg} as payload data.
     * The channel header carries {@code tlsCertHash} (may be null). When a signer is
     * supplied the signature header names the signer's identity and the payload
     * bytes are signed; otherwise both are left empty.
     */
    public static Common.Envelope createSignedEnvelopeWithTLSBinding(Common.HeaderType headerType, String channelID, Signer signer,
            Message dataMsg, int msgVersion, long epoch, byte[] tlsCertHash) throws OrdererException {

        Common.ChannelHeader chanHeader = makeChannelHeader(headerType, msgVersion, channelID, epoch, System.currentTimeMillis());

        if (tlsCertHash != null) {
            chanHeader = chanHeader.toBuilder().setTlsCertHash(ByteString.copyFrom(tlsCertHash)).build();
        }

        ByteString sigHeader = ByteString.EMPTY;
        if (signer != null) {
            sigHeader = createSignatureHeader(signer.serialize(), createNonce()).toByteString();
        }

        Common.Header.Builder header = Common.Header.newBuilder();
        header.setChannelHeader(chanHeader.toByteString());
        header.setSignatureHeader(sigHeader);

        Common.Payload.Builder payload = Common.Payload.newBuilder();
        payload.setHeader(header);
        payload.setData(dataMsg.toByteString());

        byte[] bytes = payload.build().toByteArray();

        Common.Envelope.Builder env = Common.Envelope.newBuilder();
        env.setPayload(ByteString.copyFrom(bytes));
        env.setSignature(signer != null ? ByteString.copyFrom(signer.sign(bytes)) : ByteString.EMPTY);

        return env.build();
    }

    public static Common.Envelope createSignedEnvelope(Common.HeaderType headerType, String channelID, Signer signer,
            Message dataMsg, int msgVersion, long epoch) throws OrdererException {

        return createSignedEnvelopeWithTLSBinding(headerType, channelID, signer, dataMsg, msgVersion, epoch, null);
    }

    public static byte[] computeSHA256(byte[] data) {

        return DigestUtils.sha256(data);
    }

    public static PrivateKey getPemPrivateKey(String filename) throws IOException {

        Object obj;

        try (PEMParser pp = new PEMParser(new BufferedReader(new FileReader(filename)))) {

            obj = pp.readObject();
        }

        if (obj instanceof PrivateKeyInfo) {

            PrivateKeyInfo keyInfo = (PrivateKeyInfo) obj;
            return (new JcaPEMKeyConverter().getPrivateKey(keyInfo));

        } else if (obj instanceof PEMKeyPair) {

            PEMKeyPair pemKeyPair = (PEMKeyPair) obj;

            KeyPair kp = new JcaPEMKeyConverter().getKeyPair(pemKeyPair);
            return kp.getPrivate();

        } else {

            throw new IOException("No private key found in " + filename);
        }

    }

    public static X509Certificate getCertificate(String filename) throws IOException, CertificateException {

        try (InputStream is = new FileInputStream(new File(filename))) {

            return getCertificate(IOUtils.toByteArray(is));
        }
    }

    public static X509Certificate getCertificate(byte[] serializedCert) throws IOException, CertificateException {

        CertificateFactory certFactory = CertificateFactory.getInstance("X.509");
        InputStream in = new ByteArrayInputStream(serializedCert);

        X509Certificate ret = (X509Certificate) certFactory.generateCertificate(in);
        in.close();

        return ret;
    }

    public static byte[] getSerializedCertificate(X509Certificate certificate) throws IOException, CertificateEncodingException {

        PemObject pemObj = (new PemObject("CERTIFICATE", certificate.getEncoded()));

        StringWriter strWriter = new StringWriter();
        PemWriter writer = new PemWriter(strWriter);
        writer.writeObject(pemObj);

        writer.close();
        strWriter.close();

        return strWriter.toString().getBytes();
    }

    public static Identities.SerializedIdentity getSerializedIdentity(String Mspid, byte[] serializedCert) {

        Identities.SerializedIdentity.Builder ident = Identities.SerializedIdentity.newBuilder();
        ident.setMspid(Mspid);
        ident.setIdBytes(ByteString.copyFrom(serializedCert));
        return ident.build();
    }

    /**
     * Returns the certificate of the identity that created the envelope, or null
     * when the envelope carries no parseable creator.
     */
    public static X509Certificate extractCreatorCertificate(Common.Envelope env) {

        try {
            Common.Payload payload = Common.Payload.parseFrom(env.getPayload());
            Common.SignatureHeader sigHeader = Common.SignatureHeader.parseFrom(payload.getHeader().getSignatureHeader());
            Identities.SerializedIdentity ident = Identities.SerializedIdentity.parseFrom(sigHeader.getCreator());

            if (ident.getIdBytes().isEmpty()) return null;

            return getCertificate(ident.getIdBytes().toByteArray());

        } catch (IOException | CertificateException ex) {

            return null;
        }

    }

}
