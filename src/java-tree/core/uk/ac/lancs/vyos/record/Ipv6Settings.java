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
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Describes the IPv6 settings of an interface, from its
 * <samp>ipv6</samp> node.
 * 
 * @author simpsons
 */
public final class Ipv6Settings {
    /**
     * The TCP MSS clamp, or {@code null} if not set
     */
    public final String adjustMss;

    /**
     * Whether SLAAC address autoconfiguration is enabled
     */
    public final boolean autoconf;

    /**
     * Prefixes from which EUI-64 addresses are formed; never
     * {@code null}
     */
    public final List<String> eui64;

    /**
     * Whether the link-local address is suppressed
     */
    public final boolean noDefaultLinkLocal;

    /**
     * Whether IPv6 forwarding is disabled on the interface
     */
    public final boolean disableForwarding;

    /**
     * The number of duplicate address detection transmissions, or
     * {@code null} if not set
     */
    public final String dupAddrDetectTransmits;

    private Ipv6Settings(Map<?, ?> ipv6) {
        this.adjustMss = RawValues.string(ipv6, "adjust-mss");
        Map<?, ?> address = RawValues.node(ipv6, "address");
        if (address == null) {
            this.autoconf = false;
            this.eui64 = Collections.emptyList();
            this.noDefaultLinkLocal = false;
        } else {
            this.autoconf = RawValues.flag(address, "autoconf");
            this.eui64 = RawValues.strings(address, "eui64");
            this.noDefaultLinkLocal =
                RawValues.flag(address, "no-default-link-local");
        }
        this.disableForwarding = RawValues.flag(ipv6, "disable-forwarding");
        this.dupAddrDetectTransmits =
            RawValues.string(ipv6, "dup-addr-detect-transmits");
    }

    /**
     * Parse the IPv6 settings of an interface.
     * 
     * @param iface the interface's raw node
     * 
     * @return the settings, or {@code null} if the interface has no
     * <samp>ipv6</samp> node
     */
    public static Ipv6Settings of(Map<?, ?> iface) {
        Map<?, ?> ipv6 = RawValues.block(iface, "ipv6");
        if (ipv6 == null) return null;
        return new Ipv6Settings(ipv6);
    }

    /**
     * Convert these settings into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        JSONArray prefixes = new JSONArray();
        prefixes.addAll(eui64);
        result.put("adjust_mss", adjustMss);
        result.put("autoconf", autoconf);
        result.put("eui64", prefixes);
        result.put("no_default_link_local", noDefaultLinkLocal);
        result.put("disable_forwarding", disableForwarding);
        result.put("dup_addr_detect_transmits", dupAddrDetectTransmits);
        return result;
    }
}
