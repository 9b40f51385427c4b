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

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.NameValuePair;
import org.apache.http.client.HttpClient;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.message.BasicNameValuePair;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import uk.ac.lancs.vyos.batch.Operation;
import uk.ac.lancs.vyos.record.ConfigTree;

/**
 * Talks to a device through its HTTP API. Each request is a form
 * submission with a JSON-encoded <samp>data</samp> field and the API
 * key in a <samp>key</samp> field.
 * 
 * @author simpsons
 */
public final class VyOSREST implements DeviceTransport {
    private final URI service;
    private final Supplier<? extends HttpClient> httpProvider;
    private final String apiKey;

    /**
     * Create a client for a device.
     * 
     * @param service the base URI of the device's API, e.g.,
     * <samp>https://router.example.com:443/</samp>
     * 
     * @param httpProvider a source of HTTP clients
     * 
     * @param apiKey the API key
     */
    public VyOSREST(URI service, Supplier<? extends HttpClient> httpProvider,
                    String apiKey) {
        this.service = service;
        this.httpProvider = httpProvider;
        this.apiKey = apiKey;
    }

    @Override
    @SuppressWarnings("unchecked")
    public APIResult<Object> configure(List<Operation> operations)
        throws IOException {
        JSONArray data = new JSONArray();
        for (Operation op : operations)
            data.add(op.toJSON());
        return post("configure", data.toJSONString());
    }

    @Override
    @SuppressWarnings("unchecked")
    public APIResult<Object> showConfig(List<String> path)
        throws IOException {
        JSONArray segs = new JSONArray();
        segs.addAll(path);
        JSONObject data = new JSONObject();
        data.put("op", "showConfig");
        data.put("path", segs);
        return post("retrieve", data.toJSONString());
    }

    private APIResult<Object> post(String sub, String data)
        throws IOException {
        URI location = service.resolve(sub);
        logger.fine(() -> String.format("POST %s data=%s key=<redacted>",
                                        location, data));
        List<NameValuePair> form = new ArrayList<>(2);
        form.add(new BasicNameValuePair("data", data));
        form.add(new BasicNameValuePair("key", apiKey));
        HttpPost request = new HttpPost(location);
        request.setEntity(new UrlEncodedFormEntity(form,
                                                   StandardCharsets.UTF_8));

        HttpClient client = httpProvider.get();
        HttpResponse rsp = client.execute(request);
        final int code = rsp.getStatusLine().getStatusCode();
        HttpEntity ent = rsp.getEntity();
        if (ent == null)
            throw new DeviceResponseException(code, "empty response from "
                + location);
        final Object body;
        try (Reader in =
            new InputStreamReader(ent.getContent(), StandardCharsets.UTF_8)) {
            body = new JSONParser().parse(in, ConfigTree.ORDERED);
        } catch (ParseException ex) {
            throw new DeviceResponseException(code, "bad JSON from "
                + location + ": " + ex, ex);
        }
        if (!(body instanceof Map))
            throw new DeviceResponseException(code, "unexpected response from "
                + location + ": " + body);
        APIResult<Object> result = APIResult.of(code, (Map<?, ?>) body);
        logger.finer(() -> String.format("%s -> %s", location, result));
        return result;
    }

    @Override
    public String toString() {
        return service.toString();
    }

    private static final Logger logger =
        Logger.getLogger(VyOSREST.class.getName());
}
