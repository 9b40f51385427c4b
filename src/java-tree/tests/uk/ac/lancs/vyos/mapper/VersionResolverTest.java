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

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class VersionResolverTest {
    private final VersionResolver<String> resolver = VersionResolver
        .<String>builder("test").version("1.4", "old").version("1.5", "new")
        .build();

    @Test
    void knownVersionsResolveDirectly() {
        assertEquals("old", resolver.resolve("1.4", VersionPolicy.STRICT));
        assertEquals("new", resolver.resolve("1.5", VersionPolicy.LATEST));
        assertEquals(Arrays.asList("1.4", "1.5"), resolver.versions());
        assertEquals("1.5", resolver.newest());
    }

    @Test
    void unknownVersionFallsBackToNewest() {
        assertFalse(resolver.isKnown("1.6"));
        assertEquals("new", resolver.resolve("1.6", VersionPolicy.LATEST));
    }

    @Test
    void unknownVersionIsRejectedWhenStrict() {
        UnsupportedVersionException ex =
            assertThrows(UnsupportedVersionException.class,
                         () -> resolver.resolve("1.3", VersionPolicy.STRICT));
        assertEquals("1.3", ex.getVersion());
    }
}
