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

import uk.ac.lancs.vyos.mapper.FeatureModule;
import uk.ac.lancs.vyos.mapper.MapperRegistry;
import uk.ac.lancs.vyos.mapper.VersionPolicy;

/**
 * Registers the interface families.
 * 
 * @author simpsons
 */
public final class InterfaceModule implements FeatureModule {
    /**
     * The family name of ethernet interfaces
     */
    public static final String ETHERNET = "interface_ethernet";

    /**
     * The family name of dummy interfaces
     */
    public static final String DUMMY = "interface_dummy";

    private final VersionPolicy policy;

    /**
     * Create the module, treating unrecognized versions as the newest.
     * This constructor is used when the module is found as a service.
     */
    public InterfaceModule() {
        this(VersionPolicy.LATEST);
    }

    /**
     * Create the module with a version policy.
     * 
     * @param policy how the registered factories treat unrecognized
     * versions
     */
    public InterfaceModule(VersionPolicy policy) {
        this.policy = policy;
    }

    @Override
    public void register(MapperRegistry.Builder builder) {
        builder.register(ETHERNET, v -> new EthernetInterfaceMapper(v,
            InterfaceVersions.overrides(v, policy)));
        builder.register(DUMMY, v -> new DummyInterfaceMapper(v,
            InterfaceVersions.overrides(v, policy)));
    }
}
