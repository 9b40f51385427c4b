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

import java.util.Locale;

/**
 * Identifies a NIC offload of an ethernet interface.
 * 
 * @author simpsons
 */
public enum Offload {
    /**
     * Generic receive offload
     */
    GRO,

    /**
     * Generic segmentation offload
     */
    GSO,

    /**
     * Large receive offload
     */
    LRO,

    /**
     * Receive packet steering
     */
    RPS,

    /**
     * Scatter-gather
     */
    SG,

    /**
     * TCP segmentation offload
     */
    TSO;

    /**
     * Get the path segment naming this offload.
     * 
     * @return the lower-case name
     */
    public String segment() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Find an offload by its path segment.
     * 
     * @param segment the segment, e.g., <samp>gro</samp>
     * 
     * @return the matching offload
     * 
     * @throws IllegalArgumentException if no offload matches
     */
    public static Offload forSegment(String segment) {
        return valueOf(segment.toUpperCase(Locale.ROOT));
    }
}
