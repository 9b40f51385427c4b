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
import uk.ac.lancs.vyos.mapper.VersionPolicy;

/**
 * Maps dummy interface attributes to configuration paths. Dummy
 * interfaces have no physical link, so they have only the attributes
 * common to all interfaces.
 * 
 * @author simpsons
 */
public class DummyInterfaceMapper extends InterfaceMapper {
    /**
     * Create a dummy mapper for a version, treating unrecognized
     * versions as the newest.
     * 
     * @param version the device-software version
     */
    public DummyInterfaceMapper(String version) {
        this(version, InterfaceVersions.overrides(version,
                                                  VersionPolicy.LATEST));
    }

    /**
     * Create a dummy mapper with explicit overrides.
     * 
     * @param version the device-software version
     * 
     * @param overrides the overrides for the version
     */
    public DummyInterfaceMapper(String version, OverrideTable overrides) {
        super("dummy", version, overrides);
    }

    @Override
    public String family() {
        return InterfaceModule.DUMMY;
    }
}
