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

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.mapper.OverrideTable;
import uk.ac.lancs.vyos.mapper.UnsupportedFeatureException;
import uk.ac.lancs.vyos.path.CommandPath;

class EthernetInterfaceMapperTest {
    private final EthernetInterfaceMapper v14 =
        new EthernetInterfaceMapper("1.4");

    private final EthernetInterfaceMapper v15 =
        new EthernetInterfaceMapper("1.5");

    @Test
    void pathsAreDeterministic() {
        assertEquals(v15.address("eth0", "192.0.2.1/24"),
                     v15.address("eth0", "192.0.2.1/24"));
        assertEquals(Arrays.asList("interfaces", "ethernet", "eth0",
                                   "address", "192.0.2.1/24"),
                     v15.address("eth0", "192.0.2.1/24").segments());
    }

    @Test
    void propertyPathIsStrictPrefixOfValuePath() {
        CommandPath prop = v14.descriptionPath("eth1");
        CommandPath value = v14.description("eth1", "core link");
        assertTrue(prop.isStrictPrefixOf(value));
        assertFalse(value.isStrictPrefixOf(prop));
        assertTrue(v14.mtuPath("eth1").isStrictPrefixOf(v14.mtu("eth1",
                                                                "9000")));
    }

    @Test
    void directedBroadcastNeedsNewerVersion() {
        UnsupportedFeatureException ex =
            assertThrows(UnsupportedFeatureException.class,
                         () -> v14.ipEnableDirectedBroadcast("eth0"));
        assertEquals("1.4", ex.getVersion());

        CommandPath path = v15.ipEnableDirectedBroadcast("eth0");
        assertEquals(CommandPath.of("interfaces", "ethernet", "eth0", "ip",
                                    "enable-directed-broadcast"),
                     path);
    }

    @Test
    void unknownVersionActsAsNewest() {
        EthernetInterfaceMapper later = new EthernetInterfaceMapper("1.6");
        assertEquals("1.6", later.version());
        assertEquals("enable-directed-broadcast",
                     later.ipEnableDirectedBroadcast("eth0").leaf());
    }

    @Test
    void explicitOverridesReplaceDefaults() {
        EthernetInterfaceMapper m =
            new EthernetInterfaceMapper("1.5", OverrideTable.builder()
                .put(InterfaceMapper.DIRECTED_BROADCAST,
                     i -> CommandPath.of("legacy", i))
                .build());
        assertEquals(CommandPath.of("legacy", "eth3"),
                     m.ipEnableDirectedBroadcast("eth3"));
    }

    @Test
    void customerVlanNestsUnderServiceVlan() {
        assertEquals(Arrays.asList("interfaces", "ethernet", "eth0", "vif-s",
                                   "100", "vif-c", "200", "address",
                                   "10.0.0.1/24"),
                     v15.vifCAddress("eth0", "100", "200", "10.0.0.1/24")
                         .segments());
        assertTrue(v15.vifS("eth0", "100")
            .isStrictPrefixOf(v15.vifC("eth0", "100", "200")));
    }

    @Test
    void linkSettingsUseExpectedNodes() {
        assertEquals("interfaces ethernet eth0 offload gro",
                     v15.offload("eth0", Offload.GRO).toString());
        assertEquals("interfaces ethernet eth0 ring-buffer rx 4096",
                     v15.ringBufferRx("eth0", "4096").toString());
        assertEquals("interfaces ethernet eth0 ip disable-arp-filter",
                     v15.ipFlag("eth0", IpFlag.DISABLE_ARP_FILTER)
                         .toString());
        assertEquals("interfaces ethernet eth0 vif 10 vrf red",
                     v15.vifVrf("eth0", "10", "red").toString());
    }

    @Test
    void mapperDescribesItself() {
        assertEquals(InterfaceModule.ETHERNET, v15.family());
        assertEquals("ethernet", v15.type());
        assertEquals("interface_ethernet@1.5", v15.toString());
    }
}
