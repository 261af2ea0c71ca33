/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import ordering.util.OrdererCommon.OrdererException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NodeConfigTest {

    @TempDir
    Path tempDir;

    private String logbackConfig;

    @BeforeEach
    void saveLogbackProperty() {
        logbackConfig = System.getProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY);
        System.clearProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY);
    }

    @AfterEach
    void restoreLogbackProperty() {
        if (logbackConfig != null) System.setProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY, logbackConfig);
        else System.clearProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY);
    }

    private void writeConfig(String... lines) throws IOException {
        Files.write(tempDir.resolve(NodeConfig.CONFIG_FILE), String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void defaultsAreResolvedAgainstConfigDir() throws Exception {

        writeConfig("# orderer node", "MSPID=OrdererMSP");

        NodeConfig config = NodeConfig.load(tempDir.toString());

        assertEquals(tempDir + "/", config.getConfigDir());
        assertEquals("OrdererMSP", config.getMspid());
        assertEquals(tempDir + "/keys/keystore.pem", config.getKeystore());
        assertEquals(tempDir + "/keys/cert.pem", config.getCertificate());
        assertFalse(config.isTlsEnabled());
        assertNull(config.getTlsClientCert());
    }

    @Test
    void explicitValuesOverrideDefaults() throws Exception {

        writeConfig("MSPID = Org1MSP", "KEYSTORE=/etc/orderer/key.pem", "CERTIFICATE=msp/cert.pem",
                "TLS_ENABLED=true", "TLS_CLIENT_CERT=tls/client.crt");

        NodeConfig config = NodeConfig.load(tempDir + "/");

        assertEquals("Org1MSP", config.getMspid());
        assertEquals("/etc/orderer/key.pem", config.getKeystore());
        assertEquals(tempDir + "/msp/cert.pem", config.getCertificate());
        assertTrue(config.isTlsEnabled());
        assertEquals(tempDir + "/tls/client.crt", config.getTlsClientCert());
    }

    @Test
    void missingMspidIsRejected() throws Exception {

        writeConfig("#MSPID=OrdererMSP");

        OrdererException ex = assertThrows(OrdererException.class, () -> NodeConfig.load(tempDir.toString()));
        assertTrue(ex.getMessage().contains("MSPID"));
    }

    @Test
    void tlsRequiresClientCertificate() throws Exception {

        writeConfig("MSPID=OrdererMSP", "TLS_ENABLED=true");

        OrdererException ex = assertThrows(OrdererException.class, () -> NodeConfig.load(tempDir.toString()));
        assertTrue(ex.getMessage().contains("TLS_CLIENT_CERT"));
    }

    @Test
    void missingFileIsReported() {

        OrdererException ex = assertThrows(OrdererException.class, () -> NodeConfig.load(tempDir.resolve("absent").toString()));
        assertTrue(ex.getCause() instanceof IOException);
    }

    @Test
    void directoryPointsLogbackAtItsLogbackXml() throws Exception {

        writeConfig("MSPID=OrdererMSP");

        NodeConfig.fromDirectory(tempDir + "/");

        assertEquals(tempDir + "/logback.xml", System.getProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY));
    }

    @Test
    void explicitLogbackConfigIsKept() throws Exception {

        writeConfig("MSPID=OrdererMSP");
        System.setProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY, "/etc/orderer/logback.xml");

        NodeConfig.fromDirectory(tempDir + "/");

        assertEquals("/etc/orderer/logback.xml", System.getProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY));
    }

    @Test
    void environmentDefaultsToConfigDirectory() throws Exception {

        Assumptions.assumeTrue(System.getenv(NodeConfig.CONFIG_DIR_ENV) == null);

        NodeConfig config = NodeConfig.fromEnvironment();

        assertEquals(OrdererCommon.DEFAULT_CONFIG_DIR, config.getConfigDir());
        assertEquals("OrdererMSP", config.getMspid());
        assertEquals(OrdererCommon.DEFAULT_CONFIG_DIR + "keys/keystore.pem", config.getKeystore());
        assertEquals(OrdererCommon.DEFAULT_CONFIG_DIR + "logback.xml", System.getProperty(NodeConfig.LOGBACK_CONFIG_PROPERTY));
    }
}
