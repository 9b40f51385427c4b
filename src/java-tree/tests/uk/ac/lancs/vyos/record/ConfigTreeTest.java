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
package uk.ac.lancs.vyos.record;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigTreeTest {
    @Test
    void keysKeepDocumentOrder() throws ConfigParseException {
        Map<?, ?> root = ConfigTree.parse("{\"z\":{},\"a\":{},\"m\":{}}");
        assertEquals(Arrays.asList("z", "a", "m"),
                     new ArrayList<>(root.keySet()));
    }

    @Test
    void badTextIsReported() {
        assertThrows(ConfigParseException.class,
                     () -> ConfigTree.parse("{\"interfaces\":"));
        assertThrows(ConfigParseException.class,
                     () -> ConfigTree.parse("[1, 2]"));
    }

    @Test
    void missingBranchIsEmpty() throws ConfigParseException {
        Map<?, ?> root = ConfigTree.parse("{\"system\":{}}");
        assertTrue(ConfigTree.slice(root, "interfaces", "ethernet")
            .isEmpty());
        assertTrue(ConfigTree.asTree(null).isEmpty());
    }

    @Test
    void scalarInPlaceOfBranchIsReported() throws ConfigParseException {
        Map<?, ?> root = ConfigTree.parse("{\"interfaces\":\"none\"}");
        assertThrows(ConfigParseException.class,
                     () -> ConfigTree.slice(root, "interfaces", "dummy"));
    }

    @Test
    void multiValuedLeafIsAlwaysList() throws ConfigParseException {
        Map<?, ?> node =
            ConfigTree.parse("{\"one\":\"a\",\"many\":[\"a\",\"b\"],"
                + "\"flag\":{}}");
        assertEquals(List.of("a"), RawValues.strings(node, "one"));
        assertEquals(List.of("a", "b"), RawValues.strings(node, "many"));
        assertTrue(RawValues.strings(node, "none").isEmpty());
        assertTrue(RawValues.flag(node, "flag"));
        assertNull(RawValues.block(node, "flag"));
    }
}
