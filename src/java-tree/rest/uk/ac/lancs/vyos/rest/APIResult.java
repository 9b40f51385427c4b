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

import java.util.Map;
import java.util.function.Function;

import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

/**
 * Holds the outcome of a request to a device's HTTP API. Every
 * response carries a <samp>success</samp> flag, a
 * <samp>data</samp> payload and an <samp>error</samp> text.
 * 
 * @param <T> the type of the payload
 * 
 * @author simpsons
 */
public final class APIResult<T> {
    /**
     * The HTTP status code
     */
    public final int code;

    /**
     * Whether the device accepted the request
     */
    public final boolean success;

    /**
     * The payload, or {@code null}
     */
    public final T data;

    /**
     * The device's error text, or {@code null} on success
     */
    public final String error;

    /**
     * Create a result.
     * 
     * @param code the HTTP status code
     * 
     * @param success whether the device accepted the request
     * 
     * @param data the payload
     * 
     * @param error the device's error text
     */
    public APIResult(int code, boolean success, T data, String error) {
        this.code = code;
        this.success = success;
        this.data = data;
        this.error = error;
    }

    /**
     * Decode a result from a response envelope.
     * 
     * @param code the HTTP status code
     * 
     * @param envelope the decoded response body
     * 
     * @return the result, with the raw payload
     * 
     * @throws DeviceResponseException if the envelope has no boolean
     * <samp>success</samp> field
     */
    public static APIResult<Object> of(int code, Map<?, ?> envelope)
        throws DeviceResponseException {
        Object success = envelope.get("success");
        if (!(success instanceof Boolean))
            throw new DeviceResponseException(code, "no success flag in "
                + JSONValue.toJSONString(envelope));
        Object error = envelope.get("error");
        return new APIResult<>(code, (Boolean) success, envelope.get("data"),
                               error == null ? null : error.toString());
    }

    /**
     * Convert the payload of this result.
     * 
     * @param <E> the new payload type
     * 
     * @param adapter a function converting the payload
     * 
     * @return a result with the same status and the converted payload
     */
    public <E> APIResult<E> adapt(Function<? super T, ? extends E> adapter) {
        return new APIResult<>(code, success, adapter.apply(data), error);
    }

    /**
     * Convert this result into JSON, in the device's envelope form.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        result.put("success", success);
        result.put("data", data);
        result.put("error", error);
        return result;
    }

    @Override
    public String toString() {
        return code + (success ? " ok" : " failed: " + error);
    }
}
