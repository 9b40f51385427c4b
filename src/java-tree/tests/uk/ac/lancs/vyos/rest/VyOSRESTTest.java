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

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import org.apache.http.impl.client.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpServer;

import uk.ac.lancs.vyos.batch.Operation;
import uk.ac.lancs.vyos.batch.OperationKind;
import uk.ac.lancs.vyos.path.CommandPath;

class VyOSRESTTest {
    private HttpServer server;
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private volatile String reply = "{\"success\":true,\"data\":null,"
        + "\"error\":null}";
    private VyOSREST client;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            paths.add(ex.getRequestURI().getPath());
            bodies.add(URLDecoder
                .decode(new String(ex.getRequestBody().readAllBytes(),
                                   StandardCharsets.UTF_8),
                        StandardCharsets.UTF_8));
            byte[] out = reply.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().set("Content-Type", "application/json");
            ex.sendResponseHeaders(200, out.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
        URI base = URI.create("http://127.0.0.1:"
            + server.getAddress().getPort() + "/");
        client = new VyOSREST(base, HttpClients::createDefault, "k3y");
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void configurePostsOrderedOperations() throws IOException {
        APIResult<Object> result = client.configure(Arrays.asList(
            new Operation(OperationKind.SET,
                          CommandPath.of("interfaces", "dummy", "dum0",
                                         "mtu", "1400")),
            new Operation(OperationKind.DELETE, CommandPath
                .of("interfaces", "dummy", "dum0", "description"))));
        assertTrue(result.success);
        assertEquals(List.of("/configure"), paths);
        String body = bodies.get(0);
        assertTrue(body.contains("key=k3y"));
        int set = body.indexOf("\"set\"");
        int delete = body.indexOf("\"delete\"");
        assertTrue(set >= 0 && delete > set);
    }

    @Test
    void showConfigReturnsOrderedTree() throws IOException {
        reply = "{\"success\":true,\"error\":null,"
            + "\"data\":{\"system\":{},\"interfaces\":{}}}";
        APIResult<Object> result =
            client.showConfig(Collections.emptyList());
        assertEquals(List.of("/retrieve"), paths);
        assertTrue(bodies.get(0).contains("\"op\":\"showConfig\""));
        Map<?, ?> data = (Map<?, ?>) result.data;
        assertEquals("system", data.keySet().iterator().next());
    }

    @Test
    void unexpectedBodyIsReported() {
        reply = "[]";
        assertThrows(DeviceResponseException.class,
                     () -> client.showConfig(Collections.emptyList()));
    }
}
