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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Selects a version-specific value by device-software version. Versions
 * are declared oldest first, so the last one declared is the newest.
 * 
 * @param <T> the type of value selected
 * 
 * @author simpsons
 */
public final class VersionResolver<T> {
    private final String subject;
    private final Map<String, T> byVersion;
    private final String newest;

    private VersionResolver(String subject, Map<String, T> byVersion) {
        this.subject = subject;
        this.byVersion = Collections.unmodifiableMap(byVersion);
        List<String> order = new ArrayList<>(byVersion.keySet());
        this.newest = order.get(order.size() - 1);
    }

    /**
     * Get the versions known to this resolver.
     * 
     * @return an immutable list of versions, oldest first
     */
    public List<String> versions() {
        return Collections
            .unmodifiableList(new ArrayList<>(byVersion.keySet()));
    }

    /**
     * Get the newest known version.
     * 
     * @return the newest version
     */
    public String newest() {
        return newest;
    }

    /**
     * Determine whether a version is known.
     * 
     * @param version the version to test
     * 
     * @return {@code true} iff the version was declared
     */
    public boolean isKnown(String version) {
        return byVersion.containsKey(version);
    }

    /**
     * Select the value for a version.
     * 
     * @param version the device-software version
     * 
     * @param policy the treatment of unrecognized versions
     * 
     * @return the value declared for the version, or for the newest
     * version if the version is unknown and the policy permits
     * 
     * @throws UnsupportedVersionException if the version is unknown and
     * the policy is {@link VersionPolicy#STRICT}
     */
    public T resolve(String version, VersionPolicy policy) {
        T result = byVersion.get(version);
        if (result != null) return result;
        if (policy == VersionPolicy.STRICT)
            throw new UnsupportedVersionException(version, versions());
        logger.warning(() -> String
            .format("%s: unrecognized version %s; assuming %s", subject,
                    version, newest));
        return byVersion.get(newest);
    }

    /**
     * Start building a resolver.
     * 
     * @param <T> the type of value selected
     * 
     * @param subject a name for what is being resolved, used in log
     * messages
     * 
     * @return a fresh builder
     */
    public static <T> Builder<T> builder(String subject) {
        return new Builder<>(subject);
    }

    /**
     * Accumulates version-specific values for a resolver.
     * 
     * @param <T> the type of value selected
     */
    public static final class Builder<T> {
        private final String subject;
        private final Map<String, T> byVersion = new LinkedHashMap<>();

        private Builder(String subject) {
            this.subject = subject;
        }

        /**
         * Declare the value for the next newer version.
         * 
         * @param version the version string
         * 
         * @param value the value for that version
         * 
         * @return this object
         * 
         * @throws IllegalArgumentException if the version has already
         * been declared
         */
        public Builder<T> version(String version, T value) {
            if (byVersion.containsKey(version))
                throw new IllegalArgumentException("version " + version
                    + " already declared for " + subject);
            if (value == null) throw new NullPointerException("value");
            byVersion.put(version, value);
            return this;
        }

        /**
         * Create the resolver.
         * 
         * @return the new resolver
         * 
         * @throws IllegalStateException if no versions were declared
         */
        public VersionResolver<T> build() {
            if (byVersion.isEmpty())
                throw new IllegalStateException("no versions for "
                    + subject);
            return new VersionResolver<>(subject,
                                         new LinkedHashMap<>(byVersion));
        }
    }

    private static final Logger logger =
        Logger.getLogger(VersionResolver.class.getName());
}
