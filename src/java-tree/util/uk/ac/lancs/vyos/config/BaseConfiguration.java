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

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Holds the properties of a single loaded source. Values may refer to
 * other keys of the same source with <samp>${<var>key</var>}</samp>;
 * references are expanded on retrieval. <samp>$$</samp> escapes the
 * following character.
 *
 * @author simpsons
 */
final class BaseConfiguration implements Configuration {
    private final URI location;
    private final Map<String, String> values = new TreeMap<>();

    BaseConfiguration(URI location, Properties props) {
        this.location = location;
        for (String key : props.stringPropertyNames())
            values.put(key, props.getProperty(key));
    }

    @Override
    public String toString() {
        return location == null ? "configuration" : location.toString();
    }

    @Override
    public String get(String key) {
        return expand(values.get(key), k -> {
            if (key.equals(k))
                throw new IllegalArgumentException("expansion of " + key
                    + " is recursive");
            return get(k);
        });
    }

    @Override
    public Configuration subview(String prefix) {
        prefix = Configuration.normalizePrefix(prefix);
        if (prefix.isEmpty()) return this;
        return new PrefixConfiguration(this, prefix);
    }

    @Override
    public Iterable<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    @Override
    public String prefix() {
        return "";
    }

    private static final Pattern REFERENCE_MARK =
        Pattern.compile("(\\$\\{)|(\\$\\$.)|(\\})");

    private static String expand(String rawValue,
                                 Function<String, String> map) {
        if (rawValue == null) return null;
        StringBuilder result = new StringBuilder(rawValue);
        List<Integer> stack = new ArrayList<>();

        boolean found;
        for (Matcher m = REFERENCE_MARK.matcher(result); (found = m.find())
            || !stack.isEmpty();) {
            int end = result.length(), tail = end;
            if (found) {
                if (m.group(1) != null) {
                    /* A new expansion is starting. Remember it. */
                    stack.add(0, m.start());
                    continue;
                }

                if (m.group(2) != null) {
                    /* An escaped character is found. */
                    result.delete(m.start(), m.start() + 2);
                    m.region(m.start() + 1, result.length());
                    continue;
                }

                end = m.start();
                tail = m.end();
            }

            if (stack.isEmpty()) {
                /* A stray close was found. Just delete it. */
                result.deleteCharAt(m.start());
                m.region(m.start(), result.length());
                continue;
            }

            /* Identify the referenced variable, get its value, and
             * write it in place of the reference. */
            int start = stack.remove(0);
            String varName = result.substring(start + 2, end);
            String varVal = map.apply(varName);
            if (varVal == null) varVal = "";
            result.delete(start, tail);
            result.insert(start, varVal);
            m.region(start + varVal.length(), result.length());
        }
        return result.toString();
    }
}
