/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import com.google.protobuf.InvalidProtocolBufferException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Configtx;

/**
 * Capabilities named in the {@code Capabilities} value of a config group, and
 * the ones this node implements.
 *
 * @author joao
 */
public class Capabilities {

    public static final String CAPABILITIES_KEY = "Capabilities";

    public static final Set<String> SUPPORTED_ORDERER = Collections.unmodifiableSet(
            new TreeSet<>(Arrays.asList("V1_1", "V1_4_2", "V2_0")));

    public static final Set<String> SUPPORTED_CHANNEL = Collections.unmodifiableSet(
            new TreeSet<>(Arrays.asList("V1_1", "V1_3", "V1_4_2", "V1_4_3", "V2_0")));

    private Capabilities() {
    }

    /**
     * Capabilities required by {@code group}; empty when the group has no
     * {@code Capabilities} value.
     */
    public static Set<String> requiredBy(Configtx.ConfigGroup group) throws OrdererException {

        Configtx.ConfigValue value = group.getValuesMap().get(CAPABILITIES_KEY);

        if (value == null) return Collections.emptySet();

        try {

            org.hyperledger.fabric.protos.common.Configuration.Capabilities caps =
                    org.hyperledger.fabric.protos.common.Configuration.Capabilities.parseFrom(value.getValue());

            return Collections.unmodifiableSet(new TreeSet<>(caps.getCapabilitiesMap().keySet()));

        } catch (InvalidProtocolBufferException ex) {

            throw new OrdererException("Failed to parse capabilities: " + ex.getMessage(), ex);
        }
    }

    public static void checkSupported(String type, Set<String> supported, Set<String> required) throws OrdererException {

        for (String capability : required) {

            if (!supported.contains(capability))
                throw new OrdererException(type + " capability " + capability + " is required but not supported");
        }
    }

    /**
     * Checks the capabilities of a channel's top-level group, for use by
     * {@link ChannelResources#checkChannelCapabilitiesSupported()}.
     */
    public static void checkChannelSupported(Configtx.Config config) throws OrdererException {

        checkSupported("Channel", SUPPORTED_CHANNEL, requiredBy(config.getChannelGroup()));
    }
}
