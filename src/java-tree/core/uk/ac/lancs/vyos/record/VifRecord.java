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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Describes a VLAN sub-interface, either a single-tagged
 * <samp>vif</samp> or a customer VLAN <samp>vif-c</samp> nested in a
 * service VLAN.
 * 
 * @author simpsons
 */
public final class VifRecord {
    /**
     * The VLAN id
     */
    public final String id;

    /**
     * The description, or {@code null}
     */
    public final String description;

    /**
     * The addresses; never {@code null}
     */
    public final List<String> addresses;

    /**
     * The MTU, or {@code null}
     */
    public final String mtu;

    /**
     * The VRF, or {@code null}
     */
    public final String vrf;

    /**
     * Whether the sub-interface is administratively disabled
     */
    public final boolean disabled;

    /**
     * The DHCP client options, or {@code null}
     */
    public final DhcpOptions dhcpOptions;

    private VifRecord(String id, Map<?, ?> vif) {
        this.id = id;
        this.description = RawValues.string(vif, "description");
        this.addresses = RawValues.strings(vif, "address");
        this.mtu = RawValues.string(vif, "mtu");
        this.vrf = RawValues.string(vif, "vrf");
        this.disabled = RawValues.flag(vif, "disable");
        this.dhcpOptions = DhcpOptions.of(vif);
    }

    /**
     * Parse all sub-interfaces under a tag node.
     * 
     * @param parent the node holding the tag node
     * 
     * @param key the tag node's key, <samp>vif</samp> or
     * <samp>vif-c</samp>
     * 
     * @return an immutable list of sub-interfaces in configuration
     * order, or {@code null} if the tag node is absent
     */
    public static List<VifRecord> listOf(Map<?, ?> parent, String key) {
        Map<?, ?> tag = RawValues.node(parent, key);
        if (tag == null) return null;
        List<VifRecord> result = new ArrayList<>();
        for (String id : RawValues.tags(tag))
            result.add(new VifRecord(id, RawValues.node(tag, id)));
        return Collections.unmodifiableList(result);
    }

    /**
     * Convert this sub-interface into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        JSONArray addrs = new JSONArray();
        addrs.addAll(addresses);
        result.put("id", id);
        result.put("description", description);
        result.put("addresses", addrs);
        result.put("mtu", mtu);
        result.put("vrf", vrf);
        result.put("disable", disabled);
        result.put("dhcp_options",
                   dhcpOptions == null ? null : dhcpOptions.toJSON());
        return result;
    }
}
