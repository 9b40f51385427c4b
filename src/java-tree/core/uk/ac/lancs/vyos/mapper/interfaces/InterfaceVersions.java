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

import uk.ac.lancs.vyos.mapper.OverrideTable;
import uk.ac.lancs.vyos.mapper.UnsupportedFeatureException;
import uk.ac.lancs.vyos.mapper.VersionPolicy;
import uk.ac.lancs.vyos.mapper.VersionResolver;
import uk.ac.lancs.vyos.record.IpSettings;

/**
 * Holds the per-version deviations of interface mappers from their base
 * behaviour. Version 1.5 is the baseline; 1.4 lacks directed broadcast.
 * 
 * @author simpsons
 */
public final class InterfaceVersions {
    private InterfaceVersions() {}

    private static final OverrideTable V1_4 = OverrideTable.builder()
        .put(InterfaceMapper.DIRECTED_BROADCAST, iface -> {
            throw new UnsupportedFeatureException("ip enable-directed-broadcast",
                                                  "1.5", "1.4");
        }).put(InterfaceMapper.IP_PARSER, IpSettings::withoutDirectedBroadcast)
        .build();

    private static final VersionResolver<OverrideTable> TABLES =
        VersionResolver.<OverrideTable>builder("interface mapper")
            .version("1.4", V1_4).version("1.5", OverrideTable.EMPTY)
            .build();

    /**
     * Get the resolver of override tables by version.
     * 
     * @return the resolver
     */
    public static VersionResolver<OverrideTable> resolver() {
        return TABLES;
    }

    /**
     * Get the override table for a version.
     * 
     * @param version the device-software version
     * 
     * @param policy how to treat an unrecognized version
     * 
     * @return the matching table
     * 
     * @throws uk.ac.lancs.vyos.mapper.UnsupportedVersionException if
     * the version is unrecognized and the policy is
     * {@link VersionPolicy#STRICT}
     */
    public static OverrideTable overrides(String version,
                                          VersionPolicy policy) {
        return TABLES.resolve(version, policy);
    }
}
