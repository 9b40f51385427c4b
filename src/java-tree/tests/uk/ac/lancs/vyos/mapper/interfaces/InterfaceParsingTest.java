/*
 * Copyright 2017, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */
package uk.ac.lancs.vyos.mapper.interfaces;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.record.ConfigParseException;
import uk.ac.lancs.vyos.record.ConfigTree;
import uk.ac.lancs.vyos.record.InterfaceRecord;
import uk.ac.lancs.vyos.record.InterfaceSummary;
import uk.ac.lancs.vyos.record.VifSRecord;

class InterfaceParsingTest {
    private static Map<?, ?> tree;

    @BeforeAll
    static void loadTree() throws IOException, ConfigParseException {
        try (InputStream in = InterfaceParsingTest.class
            .getResourceAsStream("/config-tree.json")) {
            tree = ConfigTree
                .parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    private static InterfaceSummary ethernet(String version)
        throws ConfigParseException {
        return new EthernetInterfaceMapper(version).parseInterfacesOfType(
            ConfigTree.slice(tree, "interfaces", "ethernet"));
    }

    @Test
    void singleAddressBecomesList() throws ConfigParseException {
        InterfaceRecord eth0 = ethernet("1.5").interfaces.get(0);
        assertEquals("eth0", eth0.name);
        assertEquals(Collections.singletonList("192.0.2.1/24"),
                     eth0.addresses);
        InterfaceRecord eth1 = ethernet("1.5").interfaces.get(1);
        assertEquals(Arrays.asList("198.51.100.1/24", "2001:db8::1/64"),
                     eth1.addresses);
    }

    @Test
    void interfacesKeepDeviceOrder() throws ConfigParseException {
        InterfaceSummary summary = ethernet("1.5");
        assertEquals(3, summary.total);
        assertEquals("eth0", summary.interfaces.get(0).name);
        assertEquals("eth1", summary.interfaces.get(1).name);
        assertEquals("eth2", summary.interfaces.get(2).name);
    }

    @Test
    void vrfHistogramCountsOnlyAssignedInterfaces()
        throws ConfigParseException {
        InterfaceSummary summary = ethernet("1.5");
        assertEquals(Collections.singletonMap("red", 2), summary.byVrf);
        assertEquals(Collections.singletonMap("ethernet", 3), summary.byType);
    }

    @Test
    void disabledIsTrueOrAbsent() throws ConfigParseException {
        InterfaceSummary summary = ethernet("1.5");
        assertNull(summary.interfaces.get(0).disabled);
        assertEquals(Boolean.TRUE, summary.interfaces.get(1).disabled);
    }

    @Test
    void ethernetSpecificBlocksAreParsed() throws ConfigParseException {
        InterfaceRecord eth0 = ethernet("1.5").interfaces.get(0);
        assertEquals("00:11:22:33:44:55", eth0.hwId);
        assertTrue(eth0.offload.gro);
        assertFalse(eth0.offload.lro);
        assertEquals("4096", eth0.ringBuffer.rx);
        assertEquals("1400", eth0.ip.adjustMss);
        assertNull(eth0.dhcpOptions);
    }

    @Test
    void directedBroadcastIsOmittedOnOlderVersion()
        throws ConfigParseException {
        assertEquals(Boolean.TRUE,
                     ethernet("1.5").interfaces.get(0).ip
                         .enableDirectedBroadcast);
        assertNull(ethernet("1.4").interfaces.get(0).ip
            .enableDirectedBroadcast);
    }

    @Test
    void vlansAreParsed() throws ConfigParseException {
        InterfaceRecord eth1 = ethernet("1.5").interfaces.get(1);
        assertEquals(2, eth1.vifs.size());
        assertEquals("10", eth1.vifs.get(0).id);
        assertEquals("v10", eth1.vifs.get(0).description);
        assertEquals("blue", eth1.vifs.get(1).vrf);
        VifSRecord svlan = eth1.vifS.get(0);
        assertEquals("100", svlan.id);
        assertEquals("802.1ad", svlan.protocol);
        assertEquals("200", svlan.vifC.get(0).id);
        assertEquals(Collections.singletonList("10.1.0.1/24"),
                     svlan.vifC.get(0).addresses);
    }

    @Test
    void dummyInterfacesParseCommonFields() throws ConfigParseException {
        InterfaceSummary summary = new DummyInterfaceMapper("1.4")
            .parseInterfacesOfType(ConfigTree.slice(tree, "interfaces",
                                                    "dummy"));
        assertEquals(2, summary.total);
        assertEquals("dummy", summary.interfaces.get(0).type);
        assertTrue(summary.interfaces.get(1).addresses.isEmpty());
        assertTrue(summary.byVrf.isEmpty());
    }

    @Test
    void nonNodeEntriesAreSkipped() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("dum0", new LinkedHashMap<>());
        raw.put("junk", "text");
        assertEquals(1, new DummyInterfaceMapper("1.5")
            .parseInterfacesOfType(raw).total);
    }

    @Test
    void recordSerializesWithSnakeCaseKeys() throws ConfigParseException {
        InterfaceRecord eth0 = ethernet("1.5").interfaces.get(0);
        Map<?, ?> json = eth0.toJSON();
        assertEquals("00:11:22:33:44:55", json.get("hw_id"));
        assertTrue(json.containsKey("vrf"));
        assertNull(json.get("vrf"));
        assertTrue(json.containsKey("ring_buffer"));
    }

    private static Map<String, Object> node(Object... pairs) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2)
            result.put((String) pairs[i], pairs[i + 1]);
        return result;
    }

    @Test
    void absentVlanBlocksAreNotPresent() {
        InterfaceRecord rec = new EthernetInterfaceMapper("1.5")
            .parseSingleInterface("eth0", node("address", "10.0.0.1/24"));
        assertNull(rec.vifs);
        assertNull(rec.vifS);
        Map<?, ?> json = rec.toJSON();
        assertTrue(json.containsKey("vif"));
        assertNull(json.get("vif"));
        assertTrue(json.containsKey("vif_s"));
        assertNull(json.get("vif_s"));
    }

    @Test
    void emptyVlanBlockIsPresentButEmpty() {
        InterfaceRecord rec = new EthernetInterfaceMapper("1.5")
            .parseSingleInterface("eth0", node("vif", node()));
        assertEquals(Collections.emptyList(), rec.vifs);
        assertNull(rec.vifS);
        assertEquals(Collections.emptyList(), rec.toJSON().get("vif"));
    }

    @Test
    void dummyRecordsHaveNoVlanBlocks() throws ConfigParseException {
        InterfaceSummary summary = new DummyInterfaceMapper("1.5")
            .parseInterfacesOfType(ConfigTree.slice(tree, "interfaces",
                                                    "dummy"));
        for (InterfaceRecord rec : summary.interfaces) {
            assertNull(rec.vifs);
            assertNull(rec.vifS);
        }
    }

    @Test
    void serviceVlanWithoutCustomersHasNoCustomerBlock()
        throws ConfigParseException {
        InterfaceRecord eth1 = ethernet("1.5").interfaces.get(1);
        VifSRecord bare = eth1.vifS.get(1);
        assertEquals("101", bare.id);
        assertNull(bare.vifC);
        assertTrue(bare.toJSON().containsKey("vif_c"));
        assertNull(bare.toJSON().get("vif_c"));
        assertNotNull(eth1.vifS.get(0).vifC);
    }

    @Test
    void ipv6BlockIsParsed() throws ConfigParseException {
        InterfaceRecord eth2 = ethernet("1.5").interfaces.get(2);
        assertTrue(eth2.ipv6.autoconf);
        assertEquals(List.of("2001:db8:2::/64"), eth2.ipv6.eui64);
        assertFalse(eth2.ipv6.noDefaultLinkLocal);
        assertEquals("1380", eth2.ipv6.adjustMss);
        assertTrue(eth2.ipv6.disableForwarding);
        assertEquals("2", eth2.ipv6.dupAddrDetectTransmits);
        assertNull(ethernet("1.5").interfaces.get(0).ipv6);
    }

    @Test
    void dhcpBlocksAreParsed() throws ConfigParseException {
        InterfaceRecord eth2 = ethernet("1.5").interfaces.get(2);
        assertEquals("edge1-eth2", eth2.dhcpOptions.clientId);
        assertNull(eth2.dhcpOptions.hostName);
        assertEquals("210", eth2.dhcpOptions.defaultRouteDistance);
        assertTrue(eth2.dhcpOptions.noDefaultRoute);
        assertEquals(List.of("192.0.2.66", "192.0.2.67"),
                     eth2.dhcpOptions.reject);
        assertEquals("00:01:00:01", eth2.dhcpv6Options.duid);
        assertTrue(eth2.dhcpv6Options.rapidCommit);
        assertFalse(eth2.dhcpv6Options.temporary);

        InterfaceRecord eth0 = ethernet("1.5").interfaces.get(0);
        assertNull(eth0.dhcpv6Options);
        assertNull(eth0.toJSON().get("dhcpv6_options"));
    }

    @Test
    void mirrorBlockIsParsed() throws ConfigParseException {
        InterfaceRecord eth2 = ethernet("1.5").interfaces.get(2);
        assertEquals("eth0", eth2.mirror.ingress);
        assertEquals("eth1", eth2.mirror.egress);
        assertNull(ethernet("1.5").interfaces.get(0).mirror);
    }

    @Test
    void portSecurityBlocksAreParsed() throws ConfigParseException {
        InterfaceRecord eth2 = ethernet("1.5").interfaces.get(2);
        assertEquals("edge1", eth2.eapol.certificate);
        assertEquals("lab-ca", eth2.eapol.caCertificate);
        assertTrue(eth2.eapol.passphraseSet);
        assertTrue(eth2.evpn.uplink);

        InterfaceRecord eth0 = ethernet("1.5").interfaces.get(0);
        assertNull(eth0.eapol);
        assertNull(eth0.evpn);
        assertTrue(eth0.toJSON().containsKey("evpn"));
    }
}
