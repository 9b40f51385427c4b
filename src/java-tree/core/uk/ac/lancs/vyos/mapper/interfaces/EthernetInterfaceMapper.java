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

import java.util.Map;

import uk.ac.lancs.vyos.mapper.OverrideTable;
import uk.ac.lancs.vyos.mapper.VersionPolicy;
import uk.ac.lancs.vyos.path.CommandPath;
import uk.ac.lancs.vyos.record.DhcpOptions;
import uk.ac.lancs.vyos.record.Dhcpv6Options;
import uk.ac.lancs.vyos.record.EapolSettings;
import uk.ac.lancs.vyos.record.EvpnSettings;
import uk.ac.lancs.vyos.record.InterfaceRecord;
import uk.ac.lancs.vyos.record.OffloadSettings;
import uk.ac.lancs.vyos.record.RawValues;
import uk.ac.lancs.vyos.record.RingBufferSettings;
import uk.ac.lancs.vyos.record.VifRecord;
import uk.ac.lancs.vyos.record.VifSRecord;

/**
 * Maps ethernet interface attributes to configuration paths. Besides
 * the attributes of all interfaces, ethernet interfaces have link
 * properties, NIC tuning, DHCP client options, VLAN sub-interfaces,
 * 802.1X and EVPN settings.
 * 
 * <p>
 * QinQ customer-VLAN paths always nest the customer VLAN inside the
 * service VLAN: <samp>... vif-s <var>svid</var> vif-c <var>cvid</var>
 * ...</samp>.
 * 
 * @author simpsons
 */
public class EthernetInterfaceMapper extends InterfaceMapper {
    /**
     * Create an ethernet mapper for a version, treating unrecognized
     * versions as the newest.
     * 
     * @param version the device-software version
     */
    public EthernetInterfaceMapper(String version) {
        this(version, InterfaceVersions.overrides(version,
                                                  VersionPolicy.LATEST));
    }

    /**
     * Create an ethernet mapper with explicit overrides.
     * 
     * @param version the device-software version
     * 
     * @param overrides the overrides for the version
     */
    public EthernetInterfaceMapper(String version, OverrideTable overrides) {
        super("ethernet", version, overrides);
    }

    @Override
    public String family() {
        return InterfaceModule.ETHERNET;
    }

    public CommandPath duplex(String iface, String duplex) {
        return duplexPath(iface).append(duplex);
    }

    public CommandPath duplexPath(String iface) {
        return interfacePath(iface).append("duplex");
    }

    public CommandPath speed(String iface, String speed) {
        return speedPath(iface).append(speed);
    }

    public CommandPath speedPath(String iface) {
        return interfacePath(iface).append("speed");
    }

    /**
     * Get the path to an interface's hardware address.
     * 
     * @param iface the interface name
     * 
     * @param mac the MAC address
     * 
     * @return the path to the value
     */
    public CommandPath hwId(String iface, String mac) {
        return hwIdPath(iface).append(mac);
    }

    public CommandPath hwIdPath(String iface) {
        return interfacePath(iface).append("hw-id");
    }

    /**
     * Get the path enabling a NIC offload.
     * 
     * @param iface the interface name
     * 
     * @param offload the offload
     * 
     * @return the path to the flag
     */
    public CommandPath offload(String iface, Offload offload) {
        return interfacePath(iface).append("offload", offload.segment());
    }

    public CommandPath ringBufferRx(String iface, String size) {
        return ringBufferRxPath(iface).append(size);
    }

    public CommandPath ringBufferRxPath(String iface) {
        return interfacePath(iface).append("ring-buffer", "rx");
    }

    public CommandPath ringBufferTx(String iface, String size) {
        return ringBufferTxPath(iface).append(size);
    }

    public CommandPath ringBufferTxPath(String iface) {
        return interfacePath(iface).append("ring-buffer", "tx");
    }

    private CommandPath dhcp(String iface, String... more) {
        return interfacePath(iface).append("dhcp-options").append(more);
    }

    public CommandPath dhcpClientId(String iface, String id) {
        return dhcpClientIdPath(iface).append(id);
    }

    public CommandPath dhcpClientIdPath(String iface) {
        return dhcp(iface, "client-id");
    }

    public CommandPath dhcpHostName(String iface, String name) {
        return dhcpHostNamePath(iface).append(name);
    }

    public CommandPath dhcpHostNamePath(String iface) {
        return dhcp(iface, "host-name");
    }

    public CommandPath dhcpVendorClassId(String iface, String id) {
        return dhcpVendorClassIdPath(iface).append(id);
    }

    public CommandPath dhcpVendorClassIdPath(String iface) {
        return dhcp(iface, "vendor-class-id");
    }

    public CommandPath dhcpDefaultRouteDistance(String iface,
                                                String distance) {
        return dhcpDefaultRouteDistancePath(iface).append(distance);
    }

    public CommandPath dhcpDefaultRouteDistancePath(String iface) {
        return dhcp(iface, "default-route-distance");
    }

    public CommandPath dhcpNoDefaultRoute(String iface) {
        return dhcp(iface, "no-default-route");
    }

    /**
     * Get the path rejecting offers from a DHCP server.
     * 
     * @param iface the interface name
     * 
     * @param server the server address or prefix
     * 
     * @return the path to the value
     */
    public CommandPath dhcpReject(String iface, String server) {
        return dhcp(iface, "reject", server);
    }

    private CommandPath dhcpv6(String iface, String... more) {
        return interfacePath(iface).append("dhcpv6-options").append(more);
    }

    public CommandPath dhcpv6Duid(String iface, String duid) {
        return dhcpv6DuidPath(iface).append(duid);
    }

    public CommandPath dhcpv6DuidPath(String iface) {
        return dhcpv6(iface, "duid");
    }

    public CommandPath dhcpv6RapidCommit(String iface) {
        return dhcpv6(iface, "rapid-commit");
    }

    public CommandPath dhcpv6ParametersOnly(String iface) {
        return dhcpv6(iface, "parameters-only");
    }

    public CommandPath dhcpv6Temporary(String iface) {
        return dhcpv6(iface, "temporary");
    }

    /**
     * Get the path to a single-tagged VLAN sub-interface.
     * 
     * @param iface the parent interface name
     * 
     * @param vlan the VLAN id
     * 
     * @return the path to the sub-interface
     */
    public CommandPath vif(String iface, String vlan) {
        return interfacePath(iface).append("vif", vlan);
    }

    public CommandPath vifAddress(String iface, String vlan,
                                  String address) {
        return vif(iface, vlan).append("address", address);
    }

    public CommandPath vifDescription(String iface, String vlan,
                                      String description) {
        return vifDescriptionPath(iface, vlan).append(description);
    }

    public CommandPath vifDescriptionPath(String iface, String vlan) {
        return vif(iface, vlan).append("description");
    }

    public CommandPath vifMtu(String iface, String vlan, String mtu) {
        return vifMtuPath(iface, vlan).append(mtu);
    }

    public CommandPath vifMtuPath(String iface, String vlan) {
        return vif(iface, vlan).append("mtu");
    }

    public CommandPath vifDisable(String iface, String vlan) {
        return vif(iface, vlan).append("disable");
    }

    public CommandPath vifVrf(String iface, String vlan, String vrf) {
        return vifVrfPath(iface, vlan).append(vrf);
    }

    public CommandPath vifVrfPath(String iface, String vlan) {
        return vif(iface, vlan).append("vrf");
    }

    /**
     * Get the path to a QinQ service VLAN.
     * 
     * @param iface the parent interface name
     * 
     * @param serviceVlan the service VLAN id
     * 
     * @return the path to the sub-interface
     */
    public CommandPath vifS(String iface, String serviceVlan) {
        return interfacePath(iface).append("vif-s", serviceVlan);
    }

    public CommandPath vifSAddress(String iface, String serviceVlan,
                                   String address) {
        return vifS(iface, serviceVlan).append("address", address);
    }

    public CommandPath vifSDescription(String iface, String serviceVlan,
                                       String description) {
        return vifSDescriptionPath(iface, serviceVlan).append(description);
    }

    public CommandPath vifSDescriptionPath(String iface,
                                           String serviceVlan) {
        return vifS(iface, serviceVlan).append("description");
    }

    public CommandPath vifSMtu(String iface, String serviceVlan,
                               String mtu) {
        return vifSMtuPath(iface, serviceVlan).append(mtu);
    }

    public CommandPath vifSMtuPath(String iface, String serviceVlan) {
        return vifS(iface, serviceVlan).append("mtu");
    }

    /**
     * Get the path to the outer tag protocol of a service VLAN.
     * 
     * @param iface the parent interface name
     * 
     * @param serviceVlan the service VLAN id
     * 
     * @param protocol <samp>802.1ad</samp> or <samp>802.1q</samp>
     * 
     * @return the path to the value
     */
    public CommandPath vifSProtocol(String iface, String serviceVlan,
                                    String protocol) {
        return vifSProtocolPath(iface, serviceVlan).append(protocol);
    }

    public CommandPath vifSProtocolPath(String iface, String serviceVlan) {
        return vifS(iface, serviceVlan).append("protocol");
    }

    /**
     * Get the path to a QinQ customer VLAN.
     * 
     * @param iface the parent interface name
     * 
     * @param serviceVlan the outer service VLAN id
     * 
     * @param customerVlan the inner customer VLAN id
     * 
     * @return the path to the sub-interface
     */
    public CommandPath vifC(String iface, String serviceVlan,
                            String customerVlan) {
        return vifS(iface, serviceVlan).append("vif-c", customerVlan);
    }

    public CommandPath vifCAddress(String iface, String serviceVlan,
                                   String customerVlan, String address) {
        return vifC(iface, serviceVlan, customerVlan).append("address",
                                                             address);
    }

    public CommandPath vifCDescription(String iface, String serviceVlan,
                                       String customerVlan,
                                       String description) {
        return vifCDescriptionPath(iface, serviceVlan, customerVlan)
            .append(description);
    }

    public CommandPath vifCDescriptionPath(String iface, String serviceVlan,
                                           String customerVlan) {
        return vifC(iface, serviceVlan, customerVlan).append("description");
    }

    public CommandPath vifCMtu(String iface, String serviceVlan,
                               String customerVlan, String mtu) {
        return vifCMtuPath(iface, serviceVlan, customerVlan).append(mtu);
    }

    public CommandPath vifCMtuPath(String iface, String serviceVlan,
                                   String customerVlan) {
        return vifC(iface, serviceVlan, customerVlan).append("mtu");
    }

    private CommandPath eapol(String iface, String... more) {
        return interfacePath(iface).append("eapol").append(more);
    }

    public CommandPath eapolCertificate(String iface, String name) {
        return eapolCertificatePath(iface).append(name);
    }

    public CommandPath eapolCertificatePath(String iface) {
        return eapol(iface, "certificate");
    }

    public CommandPath eapolCaCertificate(String iface, String name) {
        return eapolCaCertificatePath(iface).append(name);
    }

    public CommandPath eapolCaCertificatePath(String iface) {
        return eapol(iface, "ca-certificate");
    }

    public CommandPath eapolPassphrase(String iface, String passphrase) {
        return eapolPassphrasePath(iface).append(passphrase);
    }

    public CommandPath eapolPassphrasePath(String iface) {
        return eapol(iface, "passphrase");
    }

    /**
     * Get the path marking an interface as an EVPN multihoming uplink.
     * 
     * @param iface the interface name
     * 
     * @return the path to the flag
     */
    public CommandPath evpnUplink(String iface) {
        return interfacePath(iface).append("evpn", "uplink");
    }

    @Override
    protected void parseTypeSpecific(Map<?, ?> raw,
                                     InterfaceRecord.Builder builder) {
        builder.hwId(RawValues.string(raw, "hw-id"))
            .duplex(RawValues.string(raw, "duplex"))
            .speed(RawValues.string(raw, "speed"))
            .offload(OffloadSettings.of(raw))
            .ringBuffer(RingBufferSettings.of(raw))
            .dhcpOptions(DhcpOptions.of(raw))
            .dhcpv6Options(Dhcpv6Options.of(raw))
            .vifs(VifRecord.listOf(raw, "vif")).vifS(VifSRecord.listOf(raw))
            .eapol(EapolSettings.of(raw)).evpn(EvpnSettings.of(raw));
    }
}
