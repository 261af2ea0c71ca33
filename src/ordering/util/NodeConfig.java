/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.util;

import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;
import ordering.util.OrdererCommon.OrdererException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.LineIterator;

/**
 * Settings read from {@code node.config} in the node's configuration directory.
 *
 * @author joao
 */
public class NodeConfig {

    public static final String CONFIG_FILE = "node.config";
    public static final String CONFIG_DIR_ENV = "NODE_CONFIG_DIR";
    public static final String LOGBACK_CONFIG_PROPERTY = "logback.configurationFile";

    private final String configDir;
    private final String mspid;
    private final String keystore;
    private final String certificate;
    private final boolean tlsEnabled;
    private final String tlsClientCert;

    private NodeConfig(String configDir, Map<String,String> configs) throws OrdererException {

        this.configDir = configDir;

        this.mspid = configs.get("MSPID");
        if (mspid == null || mspid.isEmpty()) throw new OrdererException("MSPID is missing from " + configDir + CONFIG_FILE);

        this.keystore = resolve(configs.getOrDefault("KEYSTORE", "keys/keystore.pem"));
        this.certificate = resolve(configs.getOrDefault("CERTIFICATE", "keys/cert.pem"));
        this.tlsEnabled = Boolean.parseBoolean(configs.getOrDefault("TLS_ENABLED", "false"));

        String tlsCert = configs.get("TLS_CLIENT_CERT");
        if (tlsEnabled && (tlsCert == null || tlsCert.isEmpty()))
            throw new OrdererException("TLS_CLIENT_CERT must be set when TLS_ENABLED is true");

        this.tlsClientCert = (tlsCert != null ? resolve(tlsCert) : null);
    }

    /**
     * Loads the configuration from the directory named by {@code NODE_CONFIG_DIR},
     * or {@code ./config/}. Must run before the first logger is created so that
     * the directory's {@code logback.xml} is picked up.
     */
    public static NodeConfig fromEnvironment() throws OrdererException {

        return fromDirectory(OrdererCommon.getConfigDir(CONFIG_DIR_ENV));
    }

    static NodeConfig fromDirectory(String configDir) throws OrdererException {

        if (System.getProperty(LOGBACK_CONFIG_PROPERTY) == null)
            System.setProperty(LOGBACK_CONFIG_PROPERTY, configDir + "logback.xml");

        return load(configDir);
    }

    public static NodeConfig load(String configDir) throws OrdererException {

        if (!configDir.endsWith("/")) configDir = configDir + "/";

        Map<String,String> configs = new TreeMap<>();

        try {

            LineIterator it = FileUtils.lineIterator(new File(configDir + CONFIG_FILE), "UTF-8");

            try {

                while (it.hasNext()) {

                    String line = it.nextLine().trim();

                    if (!line.startsWith("#") && line.contains("=")) {

                        String[] params = line.split("\\=", 2);

                        configs.put(params[0].trim(), params[1].trim());

                    }
                }

            } finally {
                it.close();
            }

        } catch (IOException ex) {

            throw new OrdererException("Failed to read " + configDir + CONFIG_FILE, ex);
        }

        return new NodeConfig(configDir, configs);
    }

    private String resolve(String path) {

        if (new File(path).isAbsolute()) return path;
        return configDir + path;
    }

    public String getConfigDir() {
        return configDir;
    }

    public String getMspid() {
        return mspid;
    }

    public String getKeystore() {
        return keystore;
    }

    public String getCertificate() {
        return certificate;
    }

    public boolean isTlsEnabled() {
        return tlsEnabled;
    }

    public String getTlsClientCert() {
        return tlsClientCert;
    }
}
