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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import uk.ac.lancs.vyos.mapper.FeatureMapper;
import uk.ac.lancs.vyos.mapper.OverrideKey;
import uk.ac.lancs.vyos.mapper.OverrideTable;
import uk.ac.lancs.vyos.path.CommandPath;
import uk.ac.lancs.vyos.record.InterfaceRecord;
import uk.ac.lancs.vyos.record.InterfaceSummary;
import uk.ac.lancs.vyos.record.IpSettings;
import uk.ac.lancs.vyos.record.Ipv6Settings;
import uk.ac.lancs.vyos.record.MirrorSettings;
import uk.ac.lancs.vyos.record.RawValues;

/**
 * Maps the attributes shared by all interface types to configuration
 * paths under <samp>interfaces <var>type</var> <var>name</var></samp>,
 * and parses interfaces of one type from a raw tree.
 * 
 * <p>
 * Methods named after an attribute return the path to a value instance,
 * ending in the value. Methods suffixed <code>Path</code> return the
 * path to the property itself, for deleting it whatever its value.
 * 
 * <p>
 * Behaviour that differs between device versions is looked up in an
 * {@link OverrideTable} under the keys declared here, falling back to
 * this class's base behaviour.
 * 
 * @author simpsons
 */
public abstract class InterfaceMapper implements FeatureMapper {
    /**
     * Yields the path enabling directed broadcast on an interface.
     */
    public static final OverrideKey<Function<String, CommandPath>> DIRECTED_BROADCAST =
        OverrideKey.of("ip enable-directed-broadcast");

    /**
     * Parses the <samp>ip</samp> block of a raw interface node.
     */
    public static final OverrideKey<Function<Map<?, ?>, IpSettings>> IP_PARSER =
        OverrideKey.of("ip parser");

    private final String type;
    private final String version;

    /**
     * The overrides applying to this mapper's version
     */
    protected final OverrideTable overrides;

    /**
     * Create a mapper for a type of interface.
     * 
     * @param type the type segment, e.g., <samp>ethernet</samp>
     * 
     * @param version the device-software version
     * 
     * @param overrides the overrides for the version
     */
    protected InterfaceMapper(String type, String version,
                              OverrideTable overrides) {
        this.type = type;
        this.version = version;
        this.overrides = overrides;
    }

    /**
     * Get the interface type.
     * 
     * @return the type segment
     */
    public String type() {
        return type;
    }

    @Override
    public String version() {
        return version;
    }

    /**
     * Get the path to an interface.
     * 
     * @param iface the interface name
     * 
     * @return the path to the interface
     */
    public CommandPath interfacePath(String iface) {
        return CommandPath.of("interfaces", type, iface);
    }

    /**
     * Get the path to an interface's description.
     * 
     * @param iface the interface name
     * 
     * @param description the description
     * 
     * @return the path to the value
     */
    public CommandPath description(String iface, String description) {
        return descriptionPath(iface).append(description);
    }

    /**
     * Get the path to an interface's description property.
     * 
     * @param iface the interface name
     * 
     * @return the path to the property
     */
    public CommandPath descriptionPath(String iface) {
        return interfacePath(iface).append("description");
    }

    /**
     * Get the path to one of an interface's addresses.
     * 
     * @param iface the interface name
     * 
     * @param address the address with prefix length, or
     * <samp>dhcp</samp> or <samp>dhcpv6</samp>
     * 
     * @return the path to the value
     */
    public CommandPath address(String iface, String address) {
        return interfacePath(iface).append("address", address);
    }

    /**
     * Get the path to an interface's MTU.
     * 
     * @param iface the interface name
     * 
     * @param mtu the MTU
     * 
     * @return the path to the value
     */
    public CommandPath mtu(String iface, String mtu) {
        return mtuPath(iface).append(mtu);
    }

    /**
     * Get the path to an interface's MTU property.
     * 
     * @param iface the interface name
     * 
     * @return the path to the property
     */
    public CommandPath mtuPath(String iface) {
        return interfacePath(iface).append("mtu");
    }

    /**
     * Get the path that disables an interface.
     * 
     * @param iface the interface name
     * 
     * @return the path to the flag
     */
    public CommandPath disable(String iface) {
        return interfacePath(iface).append("disable");
    }

    /**
     * Get the path to an interface's VRF.
     * 
     * @param iface the interface name
     * 
     * @param vrf the VRF name
     * 
     * @return the path to the value
     */
    public CommandPath vrf(String iface, String vrf) {
        return vrfPath(iface).append(vrf);
    }

    /**
     * Get the path to an interface's VRF property.
     * 
     * @param iface the interface name
     * 
     * @return the path to the property
     */
    public CommandPath vrfPath(String iface) {
        return interfacePath(iface).append("vrf");
    }

    private CommandPath ip(String iface, String... more) {
        return interfacePath(iface).append("ip").append(more);
    }

    public CommandPath ipAdjustMss(String iface, String mss) {
        return ipAdjustMssPath(iface).append(mss);
    }

    public CommandPath ipAdjustMssPath(String iface) {
        return ip(iface, "adjust-mss");
    }

    public CommandPath ipArpCacheTimeout(String iface, String seconds) {
        return ipArpCacheTimeoutPath(iface).append(seconds);
    }

    public CommandPath ipArpCacheTimeoutPath(String iface) {
        return ip(iface, "arp-cache-timeout");
    }

    /**
     * Get the path to a valueless IPv4 setting.
     * 
     * @param iface the interface name
     * 
     * @param flag the setting
     * 
     * @return the path to the flag
     */
    public CommandPath ipFlag(String iface, IpFlag flag) {
        return ip(iface, flag.segment());
    }

    public CommandPath ipSourceValidation(String iface, String mode) {
        return ipSourceValidationPath(iface).append(mode);
    }

    public CommandPath ipSourceValidationPath(String iface) {
        return ip(iface, "source-validation");
    }

    /**
     * Get the path that enables forwarding of directed broadcasts.
     * 
     * @param iface the interface name
     * 
     * @return the path to the flag
     * 
     * @throws uk.ac.lancs.vyos.mapper.UnsupportedFeatureException if
     * the mapper's version lacks the setting
     */
    public CommandPath ipEnableDirectedBroadcast(String iface) {
        return overrides.dispatch(DIRECTED_BROADCAST,
                                  i -> ip(i, "enable-directed-broadcast"))
            .apply(iface);
    }

    private CommandPath ipv6(String iface, String... more) {
        return interfacePath(iface).append("ipv6").append(more);
    }

    public CommandPath ipv6Autoconf(String iface) {
        return ipv6(iface, "address", "autoconf");
    }

    public CommandPath ipv6Eui64(String iface, String prefix) {
        return ipv6(iface, "address", "eui64", prefix);
    }

    public CommandPath ipv6NoDefaultLinkLocal(String iface) {
        return ipv6(iface, "address", "no-default-link-local");
    }

    public CommandPath ipv6AdjustMss(String iface, String mss) {
        return ipv6AdjustMssPath(iface).append(mss);
    }

    public CommandPath ipv6AdjustMssPath(String iface) {
        return ipv6(iface, "adjust-mss");
    }

    public CommandPath ipv6DisableForwarding(String iface) {
        return ipv6(iface, "disable-forwarding");
    }

    public CommandPath ipv6DupAddrDetectTransmits(String iface,
                                                  String count) {
        return ipv6DupAddrDetectTransmitsPath(iface).append(count);
    }

    public CommandPath ipv6DupAddrDetectTransmitsPath(String iface) {
        return ipv6(iface, "dup-addr-detect-transmits");
    }

    /**
     * Get the path mirroring an interface's ingress traffic to another.
     * 
     * @param iface the interface name
     * 
     * @param target the interface receiving the copies
     * 
     * @return the path to the value
     */
    public CommandPath mirrorIngress(String iface, String target) {
        return mirrorIngressPath(iface).append(target);
    }

    public CommandPath mirrorIngressPath(String iface) {
        return interfacePath(iface).append("mirror", "ingress");
    }

    /**
     * Get the path mirroring an interface's egress traffic to another.
     * 
     * @param iface the interface name
     * 
     * @param target the interface receiving the copies
     * 
     * @return the path to the value
     */
    public CommandPath mirrorEgress(String iface, String target) {
        return mirrorEgressPath(iface).append(target);
    }

    public CommandPath mirrorEgressPath(String iface) {
        return interfacePath(iface).append("mirror", "egress");
    }

    /**
     * Parse one interface from its raw node.
     * 
     * @param name the interface name
     * 
     * @param raw the interface's raw node
     * 
     * @return the normalized record
     */
    public InterfaceRecord parseSingleInterface(String name, Map<?, ?> raw) {
        InterfaceRecord.Builder builder = InterfaceRecord.builder(name, type)
            .addresses(RawValues.strings(raw, "address"))
            .description(RawValues.string(raw, "description"))
            .vrf(RawValues.string(raw, "vrf"))
            .mtu(RawValues.string(raw, "mtu"))
            .disabled(RawValues.flag(raw, "disable"))
            .ip(overrides.dispatch(IP_PARSER, IpSettings::of).apply(raw))
            .ipv6(Ipv6Settings.of(raw)).mirror(MirrorSettings.of(raw));
        parseTypeSpecific(raw, builder);
        return builder.build();
    }

    /**
     * Parse the parts of a raw interface node that only this type of
     * interface has. The default does nothing.
     * 
     * @param raw the interface's raw node
     * 
     * @param builder the record under construction
     */
    protected void parseTypeSpecific(Map<?, ?> raw,
                                     InterfaceRecord.Builder builder) {}

    /**
     * Parse all interfaces of this type. Entries that are not nodes
     * are skipped.
     * 
     * @param raw the raw node holding the interfaces of this type, as
     * found under <samp>interfaces <var>type</var></samp>
     * 
     * @return a summary of the interfaces
     */
    public InterfaceSummary parseInterfacesOfType(Map<?, ?> raw) {
        List<InterfaceRecord> result = new ArrayList<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof Map)) continue;
            result.add(parseSingleInterface(entry.getKey().toString(),
                                            (Map<?, ?>) entry.getValue()));
        }
        return new InterfaceSummary(type, result);
    }

    @Override
    public String toString() {
        return family() + "@" + version;
    }
}
