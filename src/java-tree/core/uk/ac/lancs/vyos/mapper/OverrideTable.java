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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps behaviours to their replacements for one device-software
 * version. A mapper consults its table before each replaceable
 * behaviour, and uses its own base behaviour when the table has no
 * entry.
 * 
 * @author simpsons
 */
public final class OverrideTable {
    private final Map<OverrideKey<?>, Object> entries;

    private OverrideTable(Map<OverrideKey<?>, Object> entries) {
        this.entries = entries;
    }

    /**
     * A table with no overrides
     */
    public static final OverrideTable EMPTY =
        new OverrideTable(Collections.emptyMap());

    /**
     * Choose the behaviour to use.
     * 
     * @param <F> the functional type of the behaviour
     * 
     * @param key the behaviour's key
     * 
     * @param base the behaviour to use if not overridden
     * 
     * @return the override if present; the base behaviour otherwise
     */
    public <F> F dispatch(OverrideKey<F> key, F base) {
        @SuppressWarnings("unchecked")
        F result = (F) entries.get(key);
        return result == null ? base : result;
    }

    /**
     * Determine whether a behaviour is overridden.
     * 
     * @param key the behaviour's key
     * 
     * @return {@code true} iff the table has an entry for the key
     */
    public boolean overrides(OverrideKey<?> key) {
        return entries.containsKey(key);
    }

    /**
     * Get the overridden behaviours.
     * 
     * @return an immutable set of the keys with entries
     */
    public Set<OverrideKey<?>> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * Start building a table.
     * 
     * @return a fresh builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Accumulates overrides.
     */
    public static final class Builder {
        private final Map<OverrideKey<?>, Object> entries =
            new IdentityHashMap<>();

        private Builder() {}

        /**
         * Replace a behaviour.
         * 
         * @param <F> the functional type of the behaviour
         * 
         * @param key the behaviour's key
         * 
         * @param replacement the replacement behaviour
         * 
         * @return this object
         */
        public <F> Builder put(OverrideKey<F> key, F replacement) {
            if (replacement == null)
                throw new NullPointerException("replacement for " + key);
            entries.put(key, replacement);
            return this;
        }

        /**
         * Create the table.
         * 
         * @return the new table
         */
        public OverrideTable build() {
            return new OverrideTable(Collections
                .unmodifiableMap(new IdentityHashMap<>(entries)));
        }
    }
}
