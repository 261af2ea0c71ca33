/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.deliver;

import java.security.cert.CertificateEncodingException;
import ordering.util.LocalSigner;
import ordering.util.NodeConfig;
import ordering.util.OrdererCommon;
import ordering.util.OrdererCommon.OrdererException;
import ordering.util.Signer;
import org.hyperledger.fabric.protos.common.Common;
import org.hyperledger.fabric.protos.orderer.Ab;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues the seek request that (re)opens a channel's deliver stream, starting
 * right after the last block already in the local ledger.
 *
 * <p>One request is sent per call. Retrying, backoff and cancellation belong
 * to whoever owns the connection; closing the {@link BlocksDeliverer} is how a
 * pending request is aborted.
 *
 * @author joao
 */
public class BlocksRequester {

    // reserved by the protocol, not yet negotiated
    private static final int MSG_VERSION = 0;
    private static final long EPOCH = 0;

    private static final Logger logger = LoggerFactory.getLogger(BlocksRequester.class);

    private final boolean tls;
    private final String chainID;
    private final BlocksDeliverer client;
    private final Signer signer;
    private final CredentialSupport credSupport;

    public BlocksRequester(boolean tls, String chainID, BlocksDeliverer client, Signer signer, CredentialSupport credSupport) {

        if (tls && credSupport == null) throw new IllegalArgumentException("TLS is enabled but no client credentials were supplied");

        this.tls = tls;
        this.chainID = chainID;
        this.client = client;
        this.signer = signer;
        this.credSupport = credSupport;
    }

    /**
     * Builds a requester from the node configuration found through
     * {@code NODE_CONFIG_DIR}, or {@code ./config/}.
     */
    public static BlocksRequester create(String chainID, BlocksDeliverer client) throws OrdererException {

        return create(NodeConfig.fromEnvironment(), chainID, client);
    }

    public static BlocksRequester create(NodeConfig config, String chainID, BlocksDeliverer client) throws OrdererException {

        Signer signer = LocalSigner.fromConfig(config);
        CredentialSupport credSupport = config.isTlsEnabled() ? CredentialSupport.fromFile(config.getTlsClientCert()) : null;

        return new BlocksRequester(config.isTlsEnabled(), chainID, client, signer, credSupport);
    }

    public void requestBlocks(LedgerInfo ledgerInfoProvider) throws OrdererException {

        long height;

        try {

            height = ledgerInfoProvider.getLedgerHeight();

        } catch (OrdererException ex) {

            logger.error("Can't get ledger height for channel " + chainID + " from committer", ex);
            throw ex;
        }

        SeekPosition start;

        if (height != 0) {

            logger.debug("Starting deliver with block [" + Long.toUnsignedString(height) + "] for channel " + chainID);
            start = SeekPosition.specified(height);

        } else {

            logger.debug("Starting deliver with oldest block for channel " + chainID);
            start = SeekPosition.oldest();
        }

        try {

            seek(start);

        } catch (OrdererException ex) {

            logger.error("Failed to send seek request for channel " + chainID + " starting at " + start, ex);
            throw ex;
        }
    }

    byte[] getTLSCertHash() throws OrdererException {

        if (!tls) return null;

        try {

            return OrdererCommon.computeSHA256(credSupport.getClientCertificate().getEncoded());

        } catch (CertificateEncodingException ex) {

            throw new OrdererException("Failed to encode TLS client certificate", ex);
        }
    }

    private void seek(SeekPosition start) throws OrdererException {

        Ab.SeekInfo seekInfo = Ab.SeekInfo.newBuilder()
                .setStart(start.toProto())
                .setStop(SeekPosition.specified(SeekPosition.MAX_BLOCK_NUMBER).toProto())
                .setBehavior(Ab.SeekInfo.SeekBehavior.BLOCK_UNTIL_READY)
                .build();

        Common.Envelope env = OrdererCommon.createSignedEnvelopeWithTLSBinding(Common.HeaderType.DELIVER_SEEK_INFO, chainID, signer,
                seekInfo, MSG_VERSION, EPOCH, getTLSCertHash());

        client.send(env);
    }

    public String getChainID() {
        return chainID;
    }
}
