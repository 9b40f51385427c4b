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
 * Describes a QinQ service-VLAN sub-interface and the customer VLANs
 * nested within it.
 * 
 * @author simpsons
 */
public final class VifSRecord {
    /**
     * The service VLAN id
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
     * The outer tag protocol, such as <samp>802.1ad</samp>, or
     * {@code null}
     */
    public final String protocol;

    /**
     * Whether the sub-interface is administratively disabled
     */
    public final boolean disabled;

    /**
     * The nested customer VLANs, or {@code null} if there is no
     * <samp>vif-c</samp> node
     */
    public final List<VifRecord> vifC;

    private VifSRecord(String id, Map<?, ?> vifs) {
        this.id = id;
        this.description = RawValues.string(vifs, "description");
        this.addresses = RawValues.strings(vifs, "address");
        this.mtu = RawValues.string(vifs, "mtu");
        this.protocol = RawValues.string(vifs, "protocol");
        this.disabled = RawValues.flag(vifs, "disable");
        this.vifC = VifRecord.listOf(vifs, "vif-c");
    }

    /**
     * Parse all service VLANs of an interface.
     * 
     * @param iface the interface's raw node
     * 
     * @return an immutable list of service VLANs in configuration
     * order, or {@code null} if the interface has no
     * <samp>vif-s</samp> node
     */
    public static List<VifSRecord> listOf(Map<?, ?> iface) {
        Map<?, ?> tag = RawValues.node(iface, "vif-s");
        if (tag == null) return null;
        List<VifSRecord> result = new ArrayList<>();
        for (String id : RawValues.tags(tag))
            result.add(new VifSRecord(id, RawValues.node(tag, id)));
        return Collections.unmodifiableList(result);
    }

    /**
     * Convert this service VLAN into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        JSONArray addrs = new JSONArray();
        addrs.addAll(addresses);
        JSONArray inner = null;
        if (vifC != null) {
            inner = new JSONArray();
            for (VifRecord c : vifC)
                inner.add(c.toJSON());
        }
        result.put("id", id);
        result.put("description", description);
        result.put("addresses", addrs);
        result.put("mtu", mtu);
        result.put("protocol", protocol);
        result.put("disable", disabled);
        result.put("vif_c", inner);
        return result;
    }
}
