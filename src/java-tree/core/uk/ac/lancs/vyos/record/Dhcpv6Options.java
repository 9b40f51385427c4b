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
 * Describes the DHCPv6 client options of an interface, from its
 * <samp>dhcpv6-options</samp> node.
 * 
 * @author simpsons
 */
public final class Dhcpv6Options {
    /**
     * The DHCP unique identifier, or {@code null} if not set
     */
    public final String duid;

    /**
     * Whether the two-message exchange is requested
     */
    public final boolean rapidCommit;

    /**
     * Whether only parameters, and no address, are requested
     */
    public final boolean parametersOnly;

    /**
     * Whether a temporary address is requested
     */
    public final boolean temporary;

    private Dhcpv6Options(Map<?, ?> opts) {
        this.duid = RawValues.string(opts, "duid");
        this.rapidCommit = RawValues.flag(opts, "rapid-commit");
        this.parametersOnly = RawValues.flag(opts, "parameters-only");
        this.temporary = RawValues.flag(opts, "temporary");
    }

    /**
     * Parse the DHCPv6 options of an interface.
     * 
     * @param iface the interface's raw node
     * 
     * @return the options, or {@code null} if the interface has no
     * <samp>dhcpv6-options</samp> node
     */
    public static Dhcpv6Options of(Map<?, ?> iface) {
        Map<?, ?> opts = RawValues.block(iface, "dhcpv6-options");
        if (opts == null) return null;
        return new Dhcpv6Options(opts);
    }

    /**
     * Convert these options into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        result.put("duid", duid);
        result.put("rapid_commit", rapidCommit);
        result.put("parameters_only", parametersOnly);
        result.put("temporary", temporary);
        return result;
    }
}
