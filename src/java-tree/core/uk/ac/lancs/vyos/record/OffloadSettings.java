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
 * Describes which NIC offloads are enabled on an ethernet interface.
 * 
 * @author simpsons
 */
public final class OffloadSettings {
    /**
     * Generic receive offload
     */
    public final boolean gro;

    /**
     * Generic segmentation offload
     */
    public final boolean gso;

    /**
     * Large receive offload
     */
    public final boolean lro;

    /**
     * Receive packet steering
     */
    public final boolean rps;

    /**
     * Scatter-gather
     */
    public final boolean sg;

    /**
     * TCP segmentation offload
     */
    public final boolean tso;

    private OffloadSettings(Map<?, ?> offload) {
        this.gro = RawValues.flag(offload, "gro");
        this.gso = RawValues.flag(offload, "gso");
        this.lro = RawValues.flag(offload, "lro");
        this.rps = RawValues.flag(offload, "rps");
        this.sg = RawValues.flag(offload, "sg");
        this.tso = RawValues.flag(offload, "tso");
    }

    /**
     * Parse the offload settings of an interface.
     * 
     * @param iface the interface's raw node
     * 
     * @return the settings, or {@code null} if the interface has no
     * <samp>offload</samp> node
     */
    public static OffloadSettings of(Map<?, ?> iface) {
        Map<?, ?> offload = RawValues.block(iface, "offload");
        if (offload == null) return null;
        return new OffloadSettings(offload);
    }

    /**
     * Convert these settings into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        result.put("gro", gro);
        result.put("gso", gso);
        result.put("lro", lro);
        result.put("rps", rps);
        result.put("sg", sg);
        result.put("tso", tso);
        return result;
    }
}
