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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads values out of a raw configuration tree. A raw tree is a map of
 * string keys to scalars, lists of scalars, or nested maps, as decoded
 * from the device's JSON export. Leaves without values, such as
 * <samp>disable</samp>, appear as keys mapping to empty maps.
 *
 * @author simpsons
 */
public final class RawValues {
    private RawValues() {}

    /**
     * Get a scalar leaf.
     *
     * @param node the node holding the leaf
     *
     * @param key the leaf's key
     *
     * @return the leaf's value as a string, or {@code null} if absent
     * or not a scalar
     */
    public static String string(Map<?, ?> node, String key) {
        Object value = node.get(key);
        if (value == null || value instanceof Map || value instanceof List)
            return null;
        return value.toString();
    }

    /**
     * Determine whether a valueless leaf is present.
     *
     * @param node the node holding the leaf
     *
     * @param key the leaf's key
     *
     * @return {@code true} iff the key is present
     */
    public static boolean flag(Map<?, ?> node, String key) {
        return node.containsKey(key);
    }

    /**
     * Get a nested node.
     *
     * @param node the node holding the nested node
     *
     * @param key the nested node's key
     *
     * @return the nested node, or {@code null} if absent or not a map
     */
    public static Map<?, ?> node(Map<?, ?> node, String key) {
        Object value = node.get(key);
        if (value instanceof Map) return (Map<?, ?>) value;
        return null;
    }

    /**
     * Get a nested node, treating an empty one as absent.
     *
     * @param node the node holding the nested node
     *
     * @param key the nested node's key
     *
     * @return the nested node, or {@code null} if absent, empty or not
     * a map
     */
    public static Map<?, ?> block(Map<?, ?> node, String key) {
        Map<?, ?> result = node(node, key);
        if (result == null || result.isEmpty()) return null;
        return result;
    }

    /**
     * Get a multi-valued leaf. The device exports a leaf with one value
     * as a bare scalar, and one with several values as a list. Either
     * form yields a list.
     *
     * @param node the node holding the leaf
     *
     * @param key the leaf's key
     *
     * @return an immutable list of the leaf's values; empty if absent
     */
    public static List<String> strings(Map<?, ?> node, String key) {
        Object value = node.get(key);
        if (value == null || value instanceof Map)
            return Collections.emptyList();
        if (value instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<?>) value)
                if (item != null && !(item instanceof Map)
                    && !(item instanceof List))
                    result.add(item.toString());
            return Collections.unmodifiableList(result);
        }
        return Collections.singletonList(value.toString());
    }

    /**
     * Get the keys of a tag node, such as the VLAN ids under
     * <samp>vif</samp>, whose values are themselves nodes.
     *
     * @param node the tag node
     *
     * @return the keys in order, skipping any whose value is not a map
     */
    public static List<String> tags(Map<?, ?> node) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<?, ?> entry : node.entrySet())
            if (entry.getValue() instanceof Map)
                result.add(entry.getKey().toString());
        return result;
    }
}
