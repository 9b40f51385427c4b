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
package uk.ac.lancs.vyos.path;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.json.simple.JSONArray;

/**
 * Addresses a node in the hierarchical configuration tree of a device.
 * A path is an ordered sequence of segments, such as
 * <samp>interfaces ethernet eth0 mtu 1500</samp>. The final segment of
 * a path used to set a value is the value itself.
 *
 * <p>
 * Paths are immutable. Methods that extend a path return a new one.
 *
 * @author simpsons
 */
public final class CommandPath {
    private final List<String> segments;

    private CommandPath(List<String> segments) {
        this.segments = segments;
    }

    /**
     * Create a path from its segments.
     *
     * @param segments the segments in order from the root of the tree
     *
     * @return the new path
     *
     * @throws NullPointerException if any segment is {@code null}
     */
    public static CommandPath of(String... segments) {
        return of(Arrays.asList(segments));
    }

    /**
     * Create a path from a list of segments. The list is copied.
     *
     * @param segments the segments in order from the root of the tree
     *
     * @return the new path
     *
     * @throws NullPointerException if any segment is {@code null}
     */
    public static CommandPath of(List<String> segments) {
        List<String> copy = new ArrayList<>(segments.size());
        for (String seg : segments) {
            if (seg == null)
                throw new NullPointerException("null segment in "
                    + segments);
            copy.add(seg);
        }
        return new CommandPath(Collections.unmodifiableList(copy));
    }

    /**
     * Create a longer path by appending segments to this one.
     *
     * @param more the segments to append
     *
     * @return a new path starting with this path's segments
     *
     * @throws NullPointerException if any segment is {@code null}
     */
    public CommandPath append(String... more) {
        List<String> joined = new ArrayList<>(segments.size() + more.length);
        joined.addAll(segments);
        joined.addAll(Arrays.asList(more));
        return of(joined);
    }

    /**
     * Get the segments of this path.
     *
     * @return an immutable list of the segments
     */
    public List<String> segments() {
        return segments;
    }

    /**
     * Get the number of segments.
     *
     * @return the path length
     */
    public int length() {
        return segments.size();
    }

    /**
     * Get the last segment, which is the value for a path that sets
     * one.
     *
     * @return the last segment, or {@code null} if the path is empty
     */
    public String leaf() {
        if (segments.isEmpty()) return null;
        return segments.get(segments.size() - 1);
    }

    /**
     * Determine whether this path is a strict prefix of another.
     *
     * @param other the other path
     *
     * @return {@code true} iff the other path is longer than this one
     * and starts with all of its segments
     */
    public boolean isStrictPrefixOf(CommandPath other) {
        if (other.segments.size() <= segments.size()) return false;
        return other.segments.subList(0, segments.size()).equals(segments);
    }

    /**
     * Convert this path into its wire form.
     *
     * @return a fresh JSON array of the segments
     */
    @SuppressWarnings("unchecked")
    public JSONArray toJSON() {
        JSONArray result = new JSONArray();
        result.addAll(segments);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CommandPath)) return false;
        return segments.equals(((CommandPath) obj).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    /**
     * Get the path as the device's command line would show it.
     *
     * @return the segments separated by spaces
     */
    @Override
    public String toString() {
        return String.join(" ", segments);
    }
}
