/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.protobuf.ByteString;
import java.util.Arrays;
import java.util.TreeSet;
import ordering.util.OrdererCommon.OrdererException;
import org.hyperledger.fabric.protos.common.Configtx;
import org.hyperledger.fabric.protos.common.Configuration;
import org.junit.jupiter.api.Test;

class CapabilitiesTest {

    static Configtx.ConfigValue capabilities(String... names) {

        Configuration.Capabilities.Builder caps = Configuration.Capabilities.newBuilder();
        for (String name : names) {
            caps.putCapabilities(name, Configuration.Capability.getDefaultInstance());
        }
        return Configtx.ConfigValue.newBuilder().setValue(caps.build().toByteString()).build();
    }

    static Configtx.Config withCapabilities(Configtx.Config config, Configtx.ConfigValue channelCaps, Configtx.ConfigValue ordererCaps) {

        Configtx.ConfigGroup.Builder channel = config.getChannelGroup().toBuilder();
        if (channelCaps != null) channel.putValues(Capabilities.CAPABILITIES_KEY, channelCaps);

        if (ordererCaps != null) {
            Configtx.ConfigGroup orderer = channel.getGroupsOrThrow(ConfigOrdererConfig.ORDERER_GROUP_KEY).toBuilder()
                    .putValues(Capabilities.CAPABILITIES_KEY, ordererCaps)
                    .build();
            channel.putGroups(ConfigOrdererConfig.ORDERER_GROUP_KEY, orderer);
        }

        return config.toBuilder().setChannelGroup(channel).build();
    }

    @Test
    void groupWithoutCapabilitiesRequiresNothing() throws Exception {

        assertTrue(Capabilities.requiredBy(Configtx.ConfigGroup.getDefaultInstance()).isEmpty());
        assertDoesNotThrow(() -> Capabilities.checkChannelSupported(SystemChannelFilterTest.validConfig()));
    }

    @Test
    void readsRequiredCapabilities() throws Exception {

        Configtx.ConfigGroup group = Configtx.ConfigGroup.newBuilder()
                .putValues(Capabilities.CAPABILITIES_KEY, capabilities("V2_0", "V1_4_2"))
                .build();

        assertEquals(new TreeSet<>(Arrays.asList("V1_4_2", "V2_0")), Capabilities.requiredBy(group));
    }

    @Test
    void unknownChannelCapabilityIsNotSupported() {

        Configtx.Config config = withCapabilities(SystemChannelFilterTest.validConfig(), capabilities("V2_0", "V3_0"), null);

        OrdererException ex = assertThrows(OrdererException.class, () -> Capabilities.checkChannelSupported(config));

        assertEquals("Channel capability V3_0 is required but not supported", ex.getMessage());
    }

    @Test
    void knownChannelCapabilitiesAreSupported() {

        Configtx.Config config = withCapabilities(SystemChannelFilterTest.validConfig(), capabilities("V1_4_3", "V2_0"), null);

        assertDoesNotThrow(() -> Capabilities.checkChannelSupported(config));
    }

    @Test
    void ordererCapabilitiesComeFromOrdererGroup() throws Exception {

        ConfigOrdererConfig supported = ConfigOrdererConfig.fromConfig(
                withCapabilities(SystemChannelFilterTest.validConfig(), null, capabilities("V2_0")));
        ConfigOrdererConfig unsupported = ConfigOrdererConfig.fromConfig(
                withCapabilities(SystemChannelFilterTest.validConfig(), null, capabilities("V1_3")));

        supported.checkCapabilitiesSupported();
        OrdererException ex = assertThrows(OrdererException.class, unsupported::checkCapabilitiesSupported);

        assertEquals("Orderer capability V1_3 is required but not supported", ex.getMessage());
    }

    @Test
    void malformedCapabilitiesAreRejected() {

        Configtx.ConfigGroup group = Configtx.ConfigGroup.newBuilder()
                .putValues(Capabilities.CAPABILITIES_KEY, Configtx.ConfigValue.newBuilder().setValue(ByteString.copyFromUtf8("garbage")).build())
                .build();

        OrdererException ex = assertThrows(OrdererException.class, () -> Capabilities.requiredBy(group));

        assertTrue(ex.getMessage().startsWith("Failed to parse capabilities"), ex.getMessage());
    }
}
