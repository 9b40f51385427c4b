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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Summarizes the interfaces of one family. Interfaces with no VRF are
 * not counted in {@link #byVrf}, not even under a placeholder name.
 * 
 * @author simpsons
 */
public final class InterfaceSummary {
    /**
     * The interfaces in configuration order
     */
    public final List<InterfaceRecord> interfaces;

    /**
     * The number of interfaces
     */
    public final int total;

    /**
     * The number of interfaces of each type
     */
    public final Map<String, Integer> byType;

    /**
     * The number of interfaces in each VRF
     */
    public final Map<String, Integer> byVrf;

    /**
     * Summarize a sequence of interfaces of one type.
     * 
     * @param type the interface type, which is counted even if there
     * are no interfaces
     * 
     * @param interfaces the interfaces
     */
    public InterfaceSummary(String type, List<InterfaceRecord> interfaces) {
        this.interfaces =
            Collections.unmodifiableList(new ArrayList<>(interfaces));
        this.total = interfaces.size();
        Map<String, Integer> types = new LinkedHashMap<>();
        types.put(type, total);
        this.byType = Collections.unmodifiableMap(types);
        Map<String, Integer> vrfs = new LinkedHashMap<>();
        for (InterfaceRecord rec : interfaces)
            if (rec.vrf != null && !rec.vrf.isEmpty())
                vrfs.merge(rec.vrf, 1, Integer::sum);
        this.byVrf = Collections.unmodifiableMap(vrfs);
    }

    /**
     * Convert this summary into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        JSONArray list = new JSONArray();
        for (InterfaceRecord rec : interfaces)
            list.add(rec.toJSON());
        JSONObject types = new JSONObject();
        types.putAll(byType);
        JSONObject vrfs = new JSONObject();
        vrfs.putAll(byVrf);
        result.put("interfaces", list);
        result.put("total", total);
        result.put("by_type", types);
        result.put("by_vrf", vrfs);
        return result;
    }
}
