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
package uk.ac.lancs.vyos.rest;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class APIResultTest {
    @Test
    void envelopeIsDecoded() throws DeviceResponseException {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put("success", false);
        env.put("data", null);
        env.put("error", "Configuration path is not valid");
        APIResult<Object> result = APIResult.of(400, env);
        assertFalse(result.success);
        assertEquals(400, result.code);
        assertEquals("Configuration path is not valid", result.error);
        assertEquals("400 failed: Configuration path is not valid",
                     result.toString());
    }

    @Test
    void envelopeWithoutFlagIsRejected() {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put("data", "x");
        DeviceResponseException ex =
            assertThrows(DeviceResponseException.class,
                         () -> APIResult.of(502, env));
        assertEquals(502, ex.getCode());
    }

    @Test
    void payloadCanBeAdapted() throws DeviceResponseException {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put("success", true);
        env.put("data", "edge1");
        APIResult<Integer> len =
            APIResult.of(200, env).adapt(d -> d.toString().length());
        assertTrue(len.success);
        assertEquals(5, len.data);
    }
}
