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

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.config.Configuration;
import uk.ac.lancs.vyos.config.ConfigurationContext;
import uk.ac.lancs.vyos.mapper.MapperRegistry;

class DeviceConfigTest {
    private static Configuration conf(String... pairs) {
        Properties props = new Properties();
        for (int i = 0; i < pairs.length; i += 2)
            props.setProperty(pairs[i], pairs[i + 1]);
        return new ConfigurationContext().get(props);
    }

    @Test
    void defaultsApply() {
        DeviceConfig dc = DeviceConfig
            .fromConfiguration("r1", conf("hostname", "r1.example.net",
                                          "apikey", "s3cr3t", "version",
                                          "1.4"));
        assertEquals("https", dc.protocol);
        assertEquals(443, dc.port);
        assertEquals(10, dc.timeout);
        assertFalse(dc.verifySsl);
        assertEquals(URI.create("https://r1.example.net:443/"),
                     dc.baseURI());
        assertFalse(dc.toString().contains("s3cr3t"));
    }

    @Test
    void missingKeyIsReported() {
        assertThrows(IllegalArgumentException.class,
                     () -> DeviceConfig.fromConfiguration("r1",
                                                          conf("hostname",
                                                               "h",
                                                               "version",
                                                               "1.5")));
    }

    @Test
    void unknownVersionIsRejectedUnlessLenient() {
        assertThrows(IllegalArgumentException.class,
                     () -> DeviceConfig
                         .fromConfiguration("r1",
                                            conf("hostname", "h", "apikey",
                                                 "k", "version", "1.3")));
        DeviceConfig dc = DeviceConfig
            .fromConfiguration("r1", conf("hostname", "h", "apikey", "k",
                                          "version", "1.6",
                                          "version.strict", "false"));
        assertEquals("1.6", dc.version);
    }

    @Test
    void badValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> DeviceConfig
                         .fromConfiguration("r1",
                                            conf("hostname", "h", "apikey",
                                                 "k", "version", "1.5",
                                                 "port", "70000")));
        assertThrows(IllegalArgumentException.class,
                     () -> DeviceConfig
                         .fromConfiguration("r1",
                                            conf("hostname", "h", "apikey",
                                                 "k", "version", "1.5",
                                                 "protocol", "ftp")));
        assertThrows(IllegalArgumentException.class,
                     () -> DeviceConfig
                         .fromConfiguration("r1",
                                            conf("hostname", "h", "apikey",
                                                 "k", "version", "1.5",
                                                 "timeout", "soon")));
    }

    @Test
    void timeoutIsBounded() {
        for (String bad : new String[] { "0", "-5", "86401", "3000000" })
            assertThrows(IllegalArgumentException.class,
                         () -> DeviceConfig
                             .fromConfiguration("r1",
                                                conf("hostname", "h",
                                                     "apikey", "k",
                                                     "version", "1.5",
                                                     "timeout", bad)),
                         bad);
        DeviceConfig dc = DeviceConfig
            .fromConfiguration("r1", conf("hostname", "h", "apikey", "k",
                                          "version", "1.5", "timeout",
                                          Integer
                                              .toString(DeviceConfig.MAX_TIMEOUT)));
        assertEquals(DeviceConfig.MAX_TIMEOUT, dc.timeout);
    }

    @Test
    void pinnedCertificateIsOptional() {
        DeviceConfig plain = DeviceConfig
            .fromConfiguration("r1", conf("hostname", "h", "apikey", "k",
                                          "version", "1.5"));
        assertNull(plain.certificate);
        DeviceConfig pinned = DeviceConfig
            .fromConfiguration("r1", conf("hostname", "h", "apikey", "k",
                                          "version", "1.5", "verify-ssl",
                                          "true", "certificate",
                                          "certs/r1.pem"));
        assertTrue(pinned.verifySsl);
        assertEquals(new File("certs/r1.pem"), pinned.certificate);
    }

    @Test
    void missingCertificateFileIsReported() {
        DeviceConfig pinned = DeviceConfig
            .fromConfiguration("r1", conf("hostname", "h", "apikey", "k",
                                          "version", "1.5", "verify-ssl",
                                          "yes", "certificate",
                                          "no-such-dir/r1.pem"));
        assertThrows(IOException.class, () -> VyOSService
            .connect(pinned, MapperRegistry.standard()));
    }

    @Test
    void connectionIsPreparedWithoutContact() throws Exception {
        DeviceConfig dc = DeviceConfig
            .fromConfiguration("r1", conf("hostname", "192.0.2.7", "apikey",
                                          "k", "version", "1.4"));
        VyOSService service =
            VyOSService.connect(dc, MapperRegistry.standard());
        assertEquals("r1", service.name());
        assertEquals("1.4", service.version());
    }
}
