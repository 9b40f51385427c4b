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

import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.path.CommandPath;

class InterfacePathTest {
    private final EthernetInterfaceMapper eth =
        new EthernetInterfaceMapper("1.5");

    private final DummyInterfaceMapper dummy =
        new DummyInterfaceMapper("1.4");

    private static CommandPath eth0(String... more) {
        return CommandPath.of("interfaces", "ethernet", "eth0").append(more);
    }

    @Test
    void commonSettings() {
        assertEquals(eth0("disable"), eth.disable("eth0"));
        assertEquals(eth0("vrf", "red"), eth.vrf("eth0", "red"));
        assertEquals(eth0("vrf"), eth.vrfPath("eth0"));
        assertEquals(CommandPath.of("interfaces", "dummy", "dum0", "address",
                                    "203.0.113.1/32"),
                     dummy.address("dum0", "203.0.113.1/32"));
        assertEquals(CommandPath.of("interfaces", "dummy", "dum0", "mtu",
                                    "1400"),
                     dummy.mtu("dum0", "1400"));
    }

    @Test
    void ipSettings() {
        assertEquals(eth0("ip", "adjust-mss", "1400"),
                     eth.ipAdjustMss("eth0", "1400"));
        assertEquals(eth0("ip", "arp-cache-timeout", "60"),
                     eth.ipArpCacheTimeout("eth0", "60"));
        assertEquals(eth0("ip", "source-validation", "strict"),
                     eth.ipSourceValidation("eth0", "strict"));
        assertEquals(eth0("ip", "source-validation"),
                     eth.ipSourceValidationPath("eth0"));
        assertEquals(eth0("ip", "disable-arp-filter"),
                     eth.ipFlag("eth0", IpFlag.DISABLE_ARP_FILTER));
        assertEquals(eth0("ip", "disable-forwarding"),
                     eth.ipFlag("eth0", IpFlag.DISABLE_FORWARDING));
        assertEquals(eth0("ip", "enable-arp-accept"),
                     eth.ipFlag("eth0", IpFlag.ENABLE_ARP_ACCEPT));
        assertEquals(eth0("ip", "enable-arp-announce"),
                     eth.ipFlag("eth0", IpFlag.ENABLE_ARP_ANNOUNCE));
        assertEquals(eth0("ip", "enable-arp-ignore"),
                     eth.ipFlag("eth0", IpFlag.ENABLE_ARP_IGNORE));
        assertEquals(eth0("ip", "enable-proxy-arp"),
                     eth.ipFlag("eth0", IpFlag.ENABLE_PROXY_ARP));
        assertEquals(eth0("ip", "proxy-arp-pvlan"),
                     eth.ipFlag("eth0", IpFlag.PROXY_ARP_PVLAN));
    }

    @Test
    void ipv6Settings() {
        assertEquals(eth0("ipv6", "address", "autoconf"),
                     eth.ipv6Autoconf("eth0"));
        assertEquals(eth0("ipv6", "address", "eui64", "2001:db8::/64"),
                     eth.ipv6Eui64("eth0", "2001:db8::/64"));
        assertEquals(eth0("ipv6", "address", "no-default-link-local"),
                     eth.ipv6NoDefaultLinkLocal("eth0"));
        assertEquals(eth0("ipv6", "adjust-mss", "1380"),
                     eth.ipv6AdjustMss("eth0", "1380"));
        assertEquals(eth0("ipv6", "disable-forwarding"),
                     eth.ipv6DisableForwarding("eth0"));
        assertEquals(eth0("ipv6", "dup-addr-detect-transmits", "3"),
                     eth.ipv6DupAddrDetectTransmits("eth0", "3"));
    }

    @Test
    void mirrorSettings() {
        assertEquals(eth0("mirror", "ingress", "eth1"),
                     eth.mirrorIngress("eth0", "eth1"));
        assertEquals(eth0("mirror", "egress", "eth2"),
                     eth.mirrorEgress("eth0", "eth2"));
        assertEquals(eth0("mirror", "egress"), eth.mirrorEgressPath("eth0"));
    }

    @Test
    void linkSettings() {
        assertEquals(eth0("duplex", "full"), eth.duplex("eth0", "full"));
        assertEquals(eth0("speed", "1000"), eth.speed("eth0", "1000"));
        assertEquals(eth0("hw-id", "00:11:22:33:44:55"),
                     eth.hwId("eth0", "00:11:22:33:44:55"));
        assertEquals(eth0("ring-buffer", "tx", "512"),
                     eth.ringBufferTx("eth0", "512"));
    }

    @Test
    void dhcpOptions() {
        assertEquals(eth0("dhcp-options", "client-id", "c1"),
                     eth.dhcpClientId("eth0", "c1"));
        assertEquals(eth0("dhcp-options", "host-name", "edge1"),
                     eth.dhcpHostName("eth0", "edge1"));
        assertEquals(eth0("dhcp-options", "vendor-class-id", "vyos"),
                     eth.dhcpVendorClassId("eth0", "vyos"));
        assertEquals(eth0("dhcp-options", "default-route-distance", "210"),
                     eth.dhcpDefaultRouteDistance("eth0", "210"));
        assertEquals(eth0("dhcp-options", "no-default-route"),
                     eth.dhcpNoDefaultRoute("eth0"));
        assertEquals(eth0("dhcp-options", "reject", "192.0.2.66"),
                     eth.dhcpReject("eth0", "192.0.2.66"));
    }

    @Test
    void dhcpv6Options() {
        assertEquals(eth0("dhcpv6-options", "duid", "00:01"),
                     eth.dhcpv6Duid("eth0", "00:01"));
        assertEquals(eth0("dhcpv6-options", "rapid-commit"),
                     eth.dhcpv6RapidCommit("eth0"));
        assertEquals(eth0("dhcpv6-options", "parameters-only"),
                     eth.dhcpv6ParametersOnly("eth0"));
        assertEquals(eth0("dhcpv6-options", "temporary"),
                     eth.dhcpv6Temporary("eth0"));
    }

    @Test
    void singleTaggedVlans() {
        assertEquals(eth0("vif", "10"), eth.vif("eth0", "10"));
        assertEquals(eth0("vif", "10", "address", "10.0.10.1/24"),
                     eth.vifAddress("eth0", "10", "10.0.10.1/24"));
        assertEquals(eth0("vif", "10", "description", "voice"),
                     eth.vifDescription("eth0", "10", "voice"));
        assertEquals(eth0("vif", "10", "mtu", "1500"),
                     eth.vifMtu("eth0", "10", "1500"));
        assertEquals(eth0("vif", "10", "disable"),
                     eth.vifDisable("eth0", "10"));
        assertEquals(eth0("vif", "10", "vrf"), eth.vifVrfPath("eth0", "10"));
    }

    @Test
    void serviceVlans() {
        assertEquals(eth0("vif-s", "100", "address", "10.2.0.1/24"),
                     eth.vifSAddress("eth0", "100", "10.2.0.1/24"));
        assertEquals(eth0("vif-s", "100", "description", "carrier"),
                     eth.vifSDescription("eth0", "100", "carrier"));
        assertEquals(eth0("vif-s", "100", "mtu", "1508"),
                     eth.vifSMtu("eth0", "100", "1508"));
        assertEquals(eth0("vif-s", "100", "protocol", "802.1q"),
                     eth.vifSProtocol("eth0", "100", "802.1q"));
    }

    @Test
    void customerVlans() {
        assertEquals(eth0("vif-s", "100", "vif-c", "200", "description",
                          "tenant"),
                     eth.vifCDescription("eth0", "100", "200", "tenant"));
        assertEquals(eth0("vif-s", "100", "vif-c", "200", "mtu", "1500"),
                     eth.vifCMtu("eth0", "100", "200", "1500"));
    }

    @Test
    void portSecurity() {
        assertEquals(eth0("eapol", "certificate", "edge1"),
                     eth.eapolCertificate("eth0", "edge1"));
        assertEquals(eth0("eapol", "ca-certificate", "lab-ca"),
                     eth.eapolCaCertificate("eth0", "lab-ca"));
        assertEquals(eth0("eapol", "passphrase", "secret"),
                     eth.eapolPassphrase("eth0", "secret"));
        assertEquals(eth0("evpn", "uplink"), eth.evpnUplink("eth0"));
    }
}
