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
package uk.ac.lancs.vyos.mapper;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.mapper.interfaces.DummyInterfaceMapper;
import uk.ac.lancs.vyos.mapper.interfaces.EthernetInterfaceMapper;
import uk.ac.lancs.vyos.mapper.interfaces.InterfaceMapper;
import uk.ac.lancs.vyos.mapper.interfaces.InterfaceModule;

class MapperRegistryTest {
    @Test
    void standardRegistryHasInterfaceFamilies() {
        MapperRegistry reg = MapperRegistry.standard();
        assertTrue(reg.families().contains(InterfaceModule.ETHERNET));
        assertTrue(reg.families().contains(InterfaceModule.DUMMY));
        FeatureMapper m = reg.resolve(InterfaceModule.ETHERNET, "1.5");
        assertTrue(m instanceof EthernetInterfaceMapper);
        assertEquals("1.5", m.version());
    }

    @Test
    void unknownFamilyIsReported() {
        UnknownFeatureException ex =
            assertThrows(UnknownFeatureException.class, () -> MapperRegistry
                .standard().resolve("protocol_bgp", "1.4"));
        assertEquals("1.4", ex.getVersion());
    }

    @Test
    void lastRegistrationWins() {
        MapperRegistry reg = MapperRegistry.builder()
            .register("x", EthernetInterfaceMapper::new)
            .register("x", DummyInterfaceMapper::new).build();
        assertTrue(reg.resolve("x", "1.4") instanceof DummyInterfaceMapper);
    }

    @Test
    void wrongMapperTypeIsReported() {
        assertThrows(MappingException.class, () -> MapperRegistry.standard()
            .resolve(InterfaceModule.DUMMY, "1.5",
                     EthernetInterfaceMapper.class));
        InterfaceMapper m = MapperRegistry.standard()
            .resolve(InterfaceModule.DUMMY, "1.5", InterfaceMapper.class);
        assertEquals("dummy", m.type());
    }

    @Test
    void resolveAllCreatesOnePerFamily() {
        Map<String, FeatureMapper> all =
            MapperRegistry.standard().resolveAll("1.4");
        assertEquals(MapperRegistry.standard().families(), all.keySet());
        for (FeatureMapper m : all.values())
            assertEquals("1.4", m.version());
    }

    @Test
    void modulesAreFoundAsServices() {
        MapperRegistry reg = MapperRegistry.builder()
            .loadModules(MapperRegistryTest.class.getClassLoader()).build();
        assertTrue(reg.families().contains(InterfaceModule.ETHERNET));
    }

    @Test
    void strictModuleRejectsUnknownVersion() {
        MapperRegistry reg = MapperRegistry.builder()
            .install(new InterfaceModule(VersionPolicy.STRICT)).build();
        assertThrows(UnsupportedVersionException.class,
                     () -> reg.resolve(InterfaceModule.DUMMY, "1.3"));
        assertEquals("1.4",
                     reg.resolve(InterfaceModule.DUMMY, "1.4").version());
    }
}
