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
package uk.ac.lancs.vyos.path;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class CommandPathTest {
    @Test
    void equalSegmentsMakeEqualPaths() {
        CommandPath a = CommandPath.of("interfaces", "ethernet", "eth0");
        CommandPath b =
            CommandPath.of(Arrays.asList("interfaces", "ethernet", "eth0"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("interfaces ethernet eth0", a.toString());
    }

    @Test
    void appendLeavesOriginalAlone() {
        CommandPath base = CommandPath.of("interfaces", "dummy", "dum0");
        CommandPath longer = base.append("mtu", "1400");
        assertEquals(3, base.length());
        assertEquals(5, longer.length());
        assertEquals("1400", longer.leaf());
    }

    @Test
    void strictPrefixIsAsymmetric() {
        CommandPath prop = CommandPath.of("interfaces", "ethernet", "eth0",
                                          "description");
        CommandPath value = prop.append("uplink");
        assertTrue(prop.isStrictPrefixOf(value));
        assertFalse(value.isStrictPrefixOf(prop));
        assertFalse(prop.isStrictPrefixOf(prop));
    }

    @Test
    void nullSegmentIsRejected() {
        assertThrows(NullPointerException.class,
                     () -> CommandPath.of("interfaces", null));
    }

    @Test
    void segmentsCannotBeModified() {
        CommandPath path = CommandPath.of("system", "host-name");
        assertThrows(UnsupportedOperationException.class,
                     () -> path.segments().add("x"));
    }

    @Test
    void wireFormIsArrayOfSegments() {
        assertEquals("[\"system\",\"host-name\",\"edge1\"]",
                     CommandPath.of("system", "host-name", "edge1").toJSON()
                         .toJSONString());
    }
}
