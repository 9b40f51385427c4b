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
package uk.ac.lancs.vyos.device;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.config.Configuration;
import uk.ac.lancs.vyos.config.ConfigurationContext;
import uk.ac.lancs.vyos.mapper.MapperRegistry;

class DeviceRegistryTest {
    private static VyOSService fake(String name) {
        return new VyOSService(name, "1.5", new RecordingTransport(),
                               MapperRegistry.standard());
    }

    @Test
    void devicesAreListedInOrder() {
        DeviceRegistry reg = new DeviceRegistry();
        reg.register(fake("b"));
        reg.register(fake("a"));
        assertEquals(Arrays.asList("b", "a"), reg.list());
        reg.unregister("b");
        assertEquals(List.of("a"), reg.list());
        reg.clear();
        assertTrue(reg.list().isEmpty());
    }

    @Test
    void unknownDeviceIsReported() {
        DeviceRegistry reg = new DeviceRegistry();
        UnknownDeviceException ex =
            assertThrows(UnknownDeviceException.class, () -> reg.get("x"));
        assertEquals("x", ex.getName());
    }

    @Test
    void devicesAreLoadedFromConfiguration()
        throws IOException,
            URISyntaxException,
            GeneralSecurityException {
        Configuration conf = new ConfigurationContext()
            .get(DeviceRegistryTest.class.getResource("/devices.properties")
                .toURI());
        DeviceRegistry reg =
            DeviceRegistry.fromConfiguration(conf, MapperRegistry.standard());
        assertEquals(Arrays.asList("edge1", "lab2"), reg.list());
        assertEquals("1.4", reg.get("lab2").version());
        assertEquals("s3cr3t", conf.subview("device.edge1.").get("apikey"));
    }
}
