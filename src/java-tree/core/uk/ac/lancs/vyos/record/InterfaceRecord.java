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
package uk.ac.lancs.vyos.record;

import java.util.Collections;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Describes one configured interface in a form independent of the
 * device's software version. Every attribute is always present in the
 * JSON form; an attribute that is not configured, or that the device's
 * version does not support, is {@code null} there.
 * 
 * @author simpsons
 */
public final class InterfaceRecord {
    /**
     * The interface name, e.g., <samp>eth0</samp>
     */
    public final String name;

    /**
     * The interface type, e.g., <samp>ethernet</samp>
     */
    public final String type;

    /**
     * The configured addresses; never {@code null}
     */
    public final List<String> addresses;

    /**
     * The description, or {@code null}
     */
    public final String description;

    /**
     * The VRF, or {@code null}
     */
    public final String vrf;

    /**
     * The MTU, or {@code null}
     */
    public final String mtu;

    /**
     * The hardware address, or {@code null}
     */
    public final String hwId;

    /**
     * The duplex mode, or {@code null}
     */
    public final String duplex;

    /**
     * The link speed, or {@code null}
     */
    public final String speed;

    /**
     * {@link Boolean#TRUE} if the interface is administratively
     * disabled, or {@code null} otherwise
     */
    public final Boolean disabled;

    /**
     * NIC offloads, or {@code null}
     */
    public final OffloadSettings offload;

    /**
     * NIC ring sizes, or {@code null}
     */
    public final RingBufferSettings ringBuffer;

    /**
     * IPv4 settings, or {@code null}
     */
    public final IpSettings ip;

    /**
     * IPv6 settings, or {@code null}
     */
    public final Ipv6Settings ipv6;

    /**
     * DHCP client options, or {@code null}
     */
    public final DhcpOptions dhcpOptions;

    /**
     * DHCPv6 client options, or {@code null}
     */
    public final Dhcpv6Options dhcpv6Options;

    /**
     * Single-tagged VLAN sub-interfaces, or {@code null} if there is no
     * <samp>vif</samp> node
     */
    public final List<VifRecord> vifs;

    /**
     * QinQ service VLANs, or {@code null} if there is no
     * <samp>vif-s</samp> node
     */
    public final List<VifSRecord> vifS;

    /**
     * Port mirroring, or {@code null}
     */
    public final MirrorSettings mirror;

    /**
     * 802.1X authentication, or {@code null}
     */
    public final EapolSettings eapol;

    /**
     * EVPN settings, or {@code null}
     */
    public final EvpnSettings evpn;

    private InterfaceRecord(Builder b) {
        this.name = b.name;
        this.type = b.type;
        this.addresses = b.addresses;
        this.description = b.description;
        this.vrf = b.vrf;
        this.mtu = b.mtu;
        this.hwId = b.hwId;
        this.duplex = b.duplex;
        this.speed = b.speed;
        this.disabled = b.disabled ? Boolean.TRUE : null;
        this.offload = b.offload;
        this.ringBuffer = b.ringBuffer;
        this.ip = b.ip;
        this.ipv6 = b.ipv6;
        this.dhcpOptions = b.dhcpOptions;
        this.dhcpv6Options = b.dhcpv6Options;
        this.vifs = b.vifs;
        this.vifS = b.vifS;
        this.mirror = b.mirror;
        this.eapol = b.eapol;
        this.evpn = b.evpn;
    }

    /**
     * Start describing an interface.
     * 
     * @param name the interface name
     * 
     * @param type the interface type
     * 
     * @return a fresh builder
     */
    public static Builder builder(String name, String type) {
        return new Builder(name, type);
    }

    /**
     * Convert this record into JSON.
     * 
     * @return the JSON representation, with every attribute present
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        JSONArray addrs = new JSONArray();
        addrs.addAll(addresses);
        result.put("name", name);
        result.put("type", type);
        result.put("addresses", addrs);
        result.put("description", description);
        result.put("vrf", vrf);
        result.put("mtu", mtu);
        result.put("hw_id", hwId);
        result.put("duplex", duplex);
        result.put("speed", speed);
        result.put("disable", disabled);
        result.put("offload", offload == null ? null : offload.toJSON());
        result.put("ring_buffer",
                   ringBuffer == null ? null : ringBuffer.toJSON());
        result.put("ip", ip == null ? null : ip.toJSON());
        result.put("ipv6", ipv6 == null ? null : ipv6.toJSON());
        result.put("dhcp_options",
                   dhcpOptions == null ? null : dhcpOptions.toJSON());
        result.put("dhcpv6_options",
                   dhcpv6Options == null ? null : dhcpv6Options.toJSON());

        JSONArray vifList = null;
        if (vifs != null) {
            vifList = new JSONArray();
            for (VifRecord v : vifs)
                vifList.add(v.toJSON());
        }
        result.put("vif", vifList);

        JSONArray vifSList = null;
        if (vifS != null) {
            vifSList = new JSONArray();
            for (VifSRecord v : vifS)
                vifSList.add(v.toJSON());
        }
        result.put("vif_s", vifSList);

        result.put("mirror", mirror == null ? null : mirror.toJSON());
        result.put("eapol", eapol == null ? null : eapol.toJSON());
        result.put("evpn", evpn == null ? null : evpn.toJSON());
        return result;
    }

    @Override
    public String toString() {
        return type + " " + name;
    }

    /**
     * Accumulates the attributes of an interface. Sub-blocks not set
     * remain {@code null}.
     */
    public static final class Builder {
        private final String name;
        private final String type;
        private List<String> addresses = Collections.emptyList();
        private String description;
        private String vrf;
        private String mtu;
        private String hwId;
        private String duplex;
        private String speed;
        private boolean disabled;
        private OffloadSettings offload;
        private RingBufferSettings ringBuffer;
        private IpSettings ip;
        private Ipv6Settings ipv6;
        private DhcpOptions dhcpOptions;
        private Dhcpv6Options dhcpv6Options;
        private List<VifRecord> vifs;
        private List<VifSRecord> vifS;
        private MirrorSettings mirror;
        private EapolSettings eapol;
        private EvpnSettings evpn;

        private Builder(String name, String type) {
            this.name = name;
            this.type = type;
        }

        /**
         * Set the addresses.
         * 
         * @param addresses the addresses
         * 
         * @return this object
         */
        public Builder addresses(List<String> addresses) {
            this.addresses = Collections.unmodifiableList(addresses);
            return this;
        }

        /**
         * Set the description.
         * 
         * @param description the description
         * 
         * @return this object
         */
        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * Set the VRF.
         * 
         * @param vrf the VRF name
         * 
         * @return this object
         */
        public Builder vrf(String vrf) {
            this.vrf = vrf;
            return this;
        }

        /**
         * Set the MTU.
         * 
         * @param mtu the MTU
         * 
         * @return this object
         */
        public Builder mtu(String mtu) {
            this.mtu = mtu;
            return this;
        }

        /**
         * Set the hardware address.
         * 
         * @param hwId the hardware address
         * 
         * @return this object
         */
        public Builder hwId(String hwId) {
            this.hwId = hwId;
            return this;
        }

        /**
         * Set the duplex mode.
         * 
         * @param duplex the duplex mode
         * 
         * @return this object
         */
        public Builder duplex(String duplex) {
            this.duplex = duplex;
            return this;
        }

        /**
         * Set the link speed.
         * 
         * @param speed the link speed
         * 
         * @return this object
         */
        public Builder speed(String speed) {
            this.speed = speed;
            return this;
        }

        /**
         * Set whether the interface is disabled.
         * 
         * @param disabled {@code true} if disabled
         * 
         * @return this object
         */
        public Builder disabled(boolean disabled) {
            this.disabled = disabled;
            return this;
        }

        /**
         * Set the offloads.
         * 
         * @param offload the offloads
         * 
         * @return this object
         */
        public Builder offload(OffloadSettings offload) {
            this.offload = offload;
            return this;
        }

        /**
         * Set the ring sizes.
         * 
         * @param ringBuffer the ring sizes
         * 
         * @return this object
         */
        public Builder ringBuffer(RingBufferSettings ringBuffer) {
            this.ringBuffer = ringBuffer;
            return this;
        }

        /**
         * Set the IPv4 settings.
         * 
         * @param ip the IPv4 settings
         * 
         * @return this object
         */
        public Builder ip(IpSettings ip) {
            this.ip = ip;
            return this;
        }

        /**
         * Set the IPv6 settings.
         * 
         * @param ipv6 the IPv6 settings
         * 
         * @return this object
         */
        public Builder ipv6(Ipv6Settings ipv6) {
            this.ipv6 = ipv6;
            return this;
        }

        /**
         * Set the DHCP options.
         * 
         * @param dhcpOptions the DHCP options
         * 
         * @return this object
         */
        public Builder dhcpOptions(DhcpOptions dhcpOptions) {
            this.dhcpOptions = dhcpOptions;
            return this;
        }

        /**
         * Set the DHCPv6 options.
         * 
         * @param dhcpv6Options the DHCPv6 options
         * 
         * @return this object
         */
        public Builder dhcpv6Options(Dhcpv6Options dhcpv6Options) {
            this.dhcpv6Options = dhcpv6Options;
            return this;
        }

        /**
         * Set the single-tagged sub-interfaces.
         * 
         * @param vifs the sub-interfaces, or {@code null} if absent
         * 
         * @return this object
         */
        public Builder vifs(List<VifRecord> vifs) {
            this.vifs =
                vifs == null ? null : Collections.unmodifiableList(vifs);
            return this;
        }

        /**
         * Set the service VLANs.
         * 
         * @param vifS the service VLANs, or {@code null} if absent
         * 
         * @return this object
         */
        public Builder vifS(List<VifSRecord> vifS) {
            this.vifS =
                vifS == null ? null : Collections.unmodifiableList(vifS);
            return this;
        }

        /**
         * Set the mirroring.
         * 
         * @param mirror the mirroring
         * 
         * @return this object
         */
        public Builder mirror(MirrorSettings mirror) {
            this.mirror = mirror;
            return this;
        }

        /**
         * Set the 802.1X settings.
         * 
         * @param eapol the 802.1X settings
         * 
         * @return this object
         */
        public Builder eapol(EapolSettings eapol) {
            this.eapol = eapol;
            return this;
        }

        /**
         * Set the EVPN settings.
         * 
         * @param evpn the EVPN settings
         * 
         * @return this object
         */
        public Builder evpn(EvpnSettings evpn) {
            this.evpn = evpn;
            return this;
        }

        /**
         * Create the record.
         * 
         * @return the new record
         */
        public InterfaceRecord build() {
            return new InterfaceRecord(this);
        }
    }
}
