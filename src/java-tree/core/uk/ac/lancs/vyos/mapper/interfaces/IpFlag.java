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

/**
 * Identifies a valueless IPv4 setting under an interface's
 * <samp>ip</samp> node that every supported version accepts.
 * 
 * @author simpsons
 */
public enum IpFlag {
    /**
     * Disable the ARP filter.
     */
    DISABLE_ARP_FILTER("disable-arp-filter"),

    /**
     * Disable IPv4 forwarding on the interface.
     */
    DISABLE_FORWARDING("disable-forwarding"),

    /**
     * Accept gratuitous ARP frames.
     */
    ENABLE_ARP_ACCEPT("enable-arp-accept"),

    /**
     * Restrict ARP announcements.
     */
    ENABLE_ARP_ANNOUNCE("enable-arp-announce"),

    /**
     * Ignore ARP requests for other interfaces' addresses.
     */
    ENABLE_ARP_IGNORE("enable-arp-ignore"),

    /**
     * Enable proxy ARP.
     */
    ENABLE_PROXY_ARP("enable-proxy-arp"),

    /**
     * Enable private-VLAN proxy ARP.
     */
    PROXY_ARP_PVLAN("proxy-arp-pvlan");

    private final String segment;

    IpFlag(String segment) {
        this.segment = segment;
    }

    /**
     * Get the path segment naming this setting.
     * 
     * @return the segment
     */
    public String segment() {
        return segment;
    }

    /**
     * Find a flag by its path segment.
     * 
     * @param segment the segment, e.g., <samp>enable-proxy-arp</samp>
     * 
     * @return the matching flag
     * 
     * @throws IllegalArgumentException if no flag matches
     */
    public static IpFlag forSegment(String segment) {
        for (IpFlag flag : values())
            if (flag.segment.equals(segment)) return flag;
        throw new IllegalArgumentException("unknown ip flag: " + segment);
    }
}
