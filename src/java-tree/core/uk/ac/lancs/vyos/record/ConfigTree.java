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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.json.simple.parser.ContainerFactory;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Decodes and slices raw configuration trees. A tree decoded here keeps
 * the device's key order, so interfaces are reported in the order the
 * device lists them.
 * 
 * @author simpsons
 */
public final class ConfigTree {
    private ConfigTree() {}

    /**
     * Decodes JSON objects as insertion-ordered maps and arrays as
     * lists, for use with {@link JSONParser}
     */
    public static final ContainerFactory ORDERED = new ContainerFactory() {
        @Override
        public Map<?, ?> createObjectContainer() {
            return new LinkedHashMap<>();
        }

        @Override
        public List<?> creatArrayContainer() {
            return new ArrayList<>();
        }
    };

    /**
     * Decode a configuration tree from JSON text.
     * 
     * @param text the JSON text
     * 
     * @return the root of the tree
     * 
     * @throws ConfigParseException if the text is not JSON, or its
     * root is not an object
     */
    public static Map<?, ?> parse(String text) throws ConfigParseException {
        Object root;
        try {
            root = new JSONParser().parse(text, ORDERED);
        } catch (ParseException ex) {
            throw new ConfigParseException("bad JSON in configuration: "
                + ex, ex);
        }
        return asTree(root);
    }

    /**
     * Ensure that a decoded value is a tree.
     * 
     * @param root the decoded value
     * 
     * @return the value as a map
     * 
     * @throws ConfigParseException if the value is not a map
     */
    public static Map<?, ?> asTree(Object root) throws ConfigParseException {
        if (root == null) return Collections.emptyMap();
        if (!(root instanceof Map))
            throw new ConfigParseException("configuration root is not an"
                + " object: " + root.getClass().getSimpleName());
        return (Map<?, ?>) root;
    }

    /**
     * Get the subtree at a key path.
     * 
     * @param root the tree's root
     * 
     * @param keys the sequence of keys leading to the subtree, e.g.,
     * <samp>interfaces</samp>, <samp>ethernet</samp>
     * 
     * @return the subtree, or an empty map if any key is absent
     * 
     * @throws ConfigParseException if a key leads to something other
     * than a map
     */
    public static Map<?, ?> slice(Map<?, ?> root, String... keys)
        throws ConfigParseException {
        Map<?, ?> node = root;
        for (String key : keys) {
            Object next = node.get(key);
            if (next == null) return Collections.emptyMap();
            if (!(next instanceof Map))
                throw new ConfigParseException("configuration node " + key
                    + " is not an object");
            node = (Map<?, ?>) next;
        }
        return node;
    }
}
