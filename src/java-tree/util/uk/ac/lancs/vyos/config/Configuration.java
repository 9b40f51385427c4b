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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * Views a set of named configuration properties. Property names are the
 * same as for Java properties files.
 *
 * <p>
 * Subviews of a configuration are obtainable. For example, if the
 * subview <samp>device.edge1</samp> is obtained, then only properties
 * whose names in the original view begin with
 * <samp>device.edge1.</samp> will be visible. Furthermore, their names
 * will lack the prefix <samp>device.edge1.</samp>.
 *
 * @author simpsons
 */
public interface Configuration {
    /**
     * Get a configuration parameter.
     *
     * @param key the parameter key
     *
     * @return the parameter's value, or {@code null} if not present
     */
    String get(String key);

    /**
     * Get a configuration parameter, or a default.
     *
     * @param key the parameter key
     *
     * @param defaultValue the value to return if the parameter is not
     * set
     *
     * @return the parameter's value, or <samp>defaultValue</samp> if
     * not set
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        return value;
    }

    /**
     * Get a configuration parameter as a list of space- or
     * comma-separated words.
     *
     * @param key the parameter key
     *
     * @return the words of the parameter's value; empty if the
     * parameter is not set or blank
     */
    default List<String> list(String key) {
        String value = get(key);
        if (value == null || value.trim().isEmpty())
            return Collections.emptyList();
        return Arrays.asList(LIST_SEPARATOR.split(value.trim()));
    }

    /**
     * Get a subview.
     *
     * @param prefix the additional prefix to narrow down the available
     * parameters
     *
     * @return the requested subview
     */
    Configuration subview(String prefix);

    /**
     * List keys in this configuration.
     *
     * @return the keys
     */
    Iterable<String> keys();

    /**
     * Get the prefix of this view with respect to its base
     * configuration.
     *
     * @return the prefix, ending in a dot, or an empty string for a
     * base configuration
     */
    String prefix();

    /**
     * Convert the properties in this configuration into a conventional
     * Java properties object.
     *
     * @return a copy of this configuration's properties
     */
    default Properties toProperties() {
        Properties result = new Properties();
        for (String key : keys())
            result.setProperty(key, get(key));
        return result;
    }

    /**
     * Separates words in a list-valued parameter
     */
    Pattern LIST_SEPARATOR = Pattern.compile("[\\s,]+");

    /**
     * Normalize a prefix so that it is empty or ends with a single dot.
     * Leading dots are removed.
     *
     * @param prefix the prefix to normalize
     *
     * @return the normalized prefix
     */
    static String normalizePrefix(String prefix) {
        if (prefix == null) return "";
        int start = 0;
        while (start < prefix.length() && prefix.charAt(start) == '.')
            start++;
        int end = prefix.length();
        while (end > start && prefix.charAt(end - 1) == '.')
            end--;
        if (start == end) return "";
        return prefix.substring(start, end) + ".";
    }
}
