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
package uk.ac.lancs.vyos.device;

import java.io.IOException;
import java.util.Map;
import java.util.logging.Logger;

import uk.ac.lancs.vyos.record.ConfigParseException;

/**
 * Retains the last configuration tree fetched from a device.
 * 
 * @author simpsons
 */
public final class ConfigTreeCache {
    /**
     * Fetches a fresh tree.
     */
    @FunctionalInterface
    public interface Source {
        /**
         * Fetch the whole configuration tree.
         * 
         * @return the root of the tree
         * 
         * @throws IOException if the device could not be reached
         * 
         * @throws ConfigParseException if the tree could not be decoded
         */
        Map<?, ?> fetch() throws IOException, ConfigParseException;
    }

    private final String device;
    private final Source source;
    private Map<?, ?> tree;

    /**
     * Create an empty cache.
     * 
     * @param device the device name, for logging
     * 
     * @param source the source of fresh trees
     */
    public ConfigTreeCache(String device, Source source) {
        this.device = device;
        this.source = source;
    }

    /**
     * Get the configuration tree.
     * 
     * @param refresh {@code true} to fetch a fresh tree even if one is
     * held
     * 
     * @return the root of the tree
     * 
     * @throws IOException if the device could not be reached
     * 
     * @throws ConfigParseException if the tree could not be decoded
     */
    public synchronized Map<?, ?> get(boolean refresh)
        throws IOException,
            ConfigParseException {
        if (tree != null && !refresh) {
            logger.fine(() -> device + ": configuration from cache");
            return tree;
        }
        tree = source.fetch();
        logger.fine(() -> device + ": configuration fetched");
        return tree;
    }

    /**
     * Discard the held tree, so that the next request fetches a fresh
     * one.
     */
    public synchronized void invalidate() {
        tree = null;
    }

    /**
     * Determine whether a tree is held.
     * 
     * @return {@code true} iff a tree is held
     */
    public synchronized boolean isCached() {
        return tree != null;
    }

    private static final Logger logger =
        Logger.getLogger(ConfigTreeCache.class.getName());
}
