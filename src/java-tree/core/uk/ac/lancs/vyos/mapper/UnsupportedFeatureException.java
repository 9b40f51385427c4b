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

/**
 * Indicates that an attribute exists in the device's schema, but not in
 * the version the mapper is bound to.
 * 
 * @author simpsons
 */
public class UnsupportedFeatureException extends MappingException {
    private static final long serialVersionUID = 1L;

    private final String feature;

    private final String requiredVersion;

    /**
     * Get the name of the unsupported feature.
     * 
     * @return the feature name, e.g.,
     * <samp>ip enable-directed-broadcast</samp>
     */
    public String getFeature() {
        return feature;
    }

    /**
     * Get the minimum version that supports the feature.
     * 
     * @return the minimum version
     */
    public String getRequiredVersion() {
        return requiredVersion;
    }

    /**
     * Create an exception.
     * 
     * @param feature the name of the unsupported feature
     * 
     * @param requiredVersion the minimum version supporting the feature
     * 
     * @param version the version the mapper is bound to
     */
    public UnsupportedFeatureException(String feature, String requiredVersion,
                                       String version) {
        super(version, feature + " requires VyOS " + requiredVersion
            + "+; device is running " + version);
        this.feature = feature;
        this.requiredVersion = requiredVersion;
    }
}
