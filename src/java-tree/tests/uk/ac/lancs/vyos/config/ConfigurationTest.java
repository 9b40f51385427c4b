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
package uk.ac.lancs.vyos.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Properties;

import org.junit.jupiter.api.Test;

class ConfigurationTest {
    private static Configuration conf(String... pairs) {
        Properties props = new Properties();
        for (int i = 0; i < pairs.length; i += 2)
            props.setProperty(pairs[i], pairs[i + 1]);
        return new ConfigurationContext().get(props);
    }

    @Test
    void referencesAreExpanded() {
        Configuration c = conf("host", "r1", "url", "https://${host}/x",
                               "cost", "$$5");
        assertEquals("https://r1/x", c.get("url"));
        assertEquals("$5", c.get("cost"));
    }

    @Test
    void selfReferenceIsRejected() {
        Configuration c = conf("loop", "${loop}");
        assertThrows(IllegalArgumentException.class, () -> c.get("loop"));
    }

    @Test
    void subviewStripsPrefix() {
        Configuration c = conf("device.r1.hostname", "h1",
                               "device.r1.port", "8443", "other", "x");
        Configuration dev = c.subview("device.r1");
        assertEquals("device.r1.", dev.prefix());
        assertEquals("h1", dev.get("hostname"));
        assertEquals("443", dev.get("missing", "443"));
        assertNull(dev.get("other"));
    }

    @Test
    void listsSplitOnCommasAndSpace() {
        Configuration c = conf("devices", " r1, r2  r3 ");
        assertEquals(Arrays.asList("r1", "r2", "r3"), c.list("devices"));
        assertTrue(c.list("absent").isEmpty());
    }

    @Test
    void defaultsApplyBeneathProperties() {
        Properties defs = new Properties();
        defs.setProperty("timeout", "10");
        defs.setProperty("port", "443");
        Properties props = new Properties();
        props.setProperty("port", "8443");
        Configuration c = new ConfigurationContext(defs).get(props);
        assertEquals("10", c.get("timeout"));
        assertEquals("8443", c.get("port"));
    }
}
