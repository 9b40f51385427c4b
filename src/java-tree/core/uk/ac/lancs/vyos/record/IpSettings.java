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

import java.util.Map;

import org.json.simple.JSONObject;

/**
 * Describes the IPv4 settings of an interface, from its <samp>ip</samp>
 * node.
 * 
 * @author simpsons
 */
public final class IpSettings {
    /**
     * The TCP MSS clamp, or {@code null} if not set
     */
    public final String adjustMss;

    /**
     * The ARP cache timeout in seconds, or {@code null} if not set
     */
    public final String arpCacheTimeout;

    /**
     * Whether the ARP filter is disabled
     */
    public final boolean disableArpFilter;

    /**
     * Whether IPv4 forwarding is disabled on the interface
     */
    public final boolean disableForwarding;

    /**
     * Whether gratuitous ARP frames are accepted
     */
    public final boolean enableArpAccept;

    /**
     * Whether ARP announcements are restricted
     */
    public final boolean enableArpAnnounce;

    /**
     * Whether ARP requests for other interfaces' addresses are ignored
     */
    public final boolean enableArpIgnore;

    /**
     * Whether proxy ARP is enabled
     */
    public final boolean enableProxyArp;

    /**
     * Whether private-VLAN proxy ARP is enabled
     */
    public final boolean proxyArpPvlan;

    /**
     * The reverse-path filter mode (<samp>strict</samp>,
     * <samp>loose</samp> or <samp>disable</samp>), or {@code null} if
     * not set
     */
    public final String sourceValidation;

    /**
     * Whether directed broadcasts are forwarded, or {@code null} if the
     * device's version does not support the setting
     */
    public final Boolean enableDirectedBroadcast;

    private IpSettings(Map<?, ?> ip, Boolean enableDirectedBroadcast) {
        this.adjustMss = RawValues.string(ip, "adjust-mss");
        this.arpCacheTimeout = RawValues.string(ip, "arp-cache-timeout");
        this.disableArpFilter = RawValues.flag(ip, "disable-arp-filter");
        this.disableForwarding = RawValues.flag(ip, "disable-forwarding");
        this.enableArpAccept = RawValues.flag(ip, "enable-arp-accept");
        this.enableArpAnnounce = RawValues.flag(ip, "enable-arp-announce");
        this.enableArpIgnore = RawValues.flag(ip, "enable-arp-ignore");
        this.enableProxyArp = RawValues.flag(ip, "enable-proxy-arp");
        this.proxyArpPvlan = RawValues.flag(ip, "proxy-arp-pvlan");
        this.sourceValidation = RawValues.string(ip, "source-validation");
        this.enableDirectedBroadcast = enableDirectedBroadcast;
    }

    /**
     * Parse the IPv4 settings of an interface, including those only
     * recent versions support.
     * 
     * @param iface the interface's raw node
     * 
     * @return the settings, or {@code null} if the interface has no
     * <samp>ip</samp> node
     */
    public static IpSettings of(Map<?, ?> iface) {
        Map<?, ?> ip = RawValues.block(iface, "ip");
        if (ip == null) return null;
        return new IpSettings(ip,
                              RawValues.flag(ip, "enable-directed-broadcast"));
    }

    /**
     * Parse the IPv4 settings of an interface on a version that does
     * not support directed broadcast.
     * 
     * @param iface the interface's raw node
     * 
     * @return the settings, with {@link #enableDirectedBroadcast} set
     * to {@code null}, or {@code null} if the interface has no
     * <samp>ip</samp> node
     */
    public static IpSettings withoutDirectedBroadcast(Map<?, ?> iface) {
        Map<?, ?> ip = RawValues.block(iface, "ip");
        if (ip == null) return null;
        return new IpSettings(ip, null);
    }

    /**
     * Convert these settings into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        result.put("adjust_mss", adjustMss);
        result.put("arp_cache_timeout", arpCacheTimeout);
        result.put("disable_arp_filter", disableArpFilter);
        result.put("disable_forwarding", disableForwarding);
        result.put("enable_arp_accept", enableArpAccept);
        result.put("enable_arp_announce", enableArpAnnounce);
        result.put("enable_arp_ignore", enableArpIgnore);
        result.put("enable_proxy_arp", enableProxyArp);
        result.put("proxy_arp_pvlan", proxyArpPvlan);
        result.put("source_validation", sourceValidation);
        result.put("enable_directed_broadcast", enableDirectedBroadcast);
        return result;
    }
}
