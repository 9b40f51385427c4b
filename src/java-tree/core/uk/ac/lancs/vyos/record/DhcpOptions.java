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

import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Describes the DHCP client options of an interface, from its
 * <samp>dhcp-options</samp> node.
 * 
 * @author simpsons
 */
public final class DhcpOptions {
    /**
     * The client identifier, or {@code null} if not set
     */
    public final String clientId;

    /**
     * The host name sent to the server, or {@code null} if not set
     */
    public final String hostName;

    /**
     * The vendor class identifier, or {@code null} if not set
     */
    public final String vendorClassId;

    /**
     * The administrative distance of the learned default route, or
     * {@code null} if not set
     */
    public final String defaultRouteDistance;

    /**
     * Whether the learned default route is ignored
     */
    public final boolean noDefaultRoute;

    /**
     * Server addresses whose offers are rejected; never {@code null}
     */
    public final List<String> reject;

    private DhcpOptions(Map<?, ?> opts) {
        this.clientId = RawValues.string(opts, "client-id");
        this.hostName = RawValues.string(opts, "host-name");
        this.vendorClassId = RawValues.string(opts, "vendor-class-id");
        this.defaultRouteDistance =
            RawValues.string(opts, "default-route-distance");
        this.noDefaultRoute = RawValues.flag(opts, "no-default-route");
        this.reject = RawValues.strings(opts, "reject");
    }

    /**
     * Parse the DHCP options of an interface.
     * 
     * @param node the interface's (or sub-interface's) raw node
     * 
     * @return the options, or {@code null} if the node has no
     * <samp>dhcp-options</samp> node
     */
    public static DhcpOptions of(Map<?, ?> node) {
        Map<?, ?> opts = RawValues.block(node, "dhcp-options");
        if (opts == null) return null;
        return new DhcpOptions(opts);
    }

    /**
     * Convert these options into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        JSONArray rejected = new JSONArray();
        rejected.addAll(reject);
        result.put("client_id", clientId);
        result.put("host_name", hostName);
        result.put("vendor_class_id", vendorClassId);
        result.put("default_route_distance", defaultRouteDistance);
        result.put("no_default_route", noDefaultRoute);
        result.put("reject", rejected);
        return result;
    }
}
