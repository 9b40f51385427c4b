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
 * Indicates that a request could not be translated for a device. These
 * exceptions arise from caller or wiring errors, and are never retried.
 * 
 * @author simpsons
 */
public class MappingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String version;

    /**
     * Get the device-software version in whose context the error
     * arose.
     * 
     * @return the version string, or {@code null} if not known
     */
    public String getVersion() {
        return version;
    }

    /**
     * Create an exception with a detail message.
     * 
     * @param version the device-software version, or {@code null} if
     * not known
     * 
     * @param message the detail message
     */
    public MappingException(String version, String message) {
        super(message);
        this.version = version;
    }

    /**
     * Create an exception with a detail message and a cause.
     * 
     * @param version the device-software version, or {@code null} if
     * not known
     * 
     * @param message the detail message
     * 
     * @param cause the cause
     */
    public MappingException(String version, String message,
                            Throwable cause) {
        super(message, cause);
        this.version = version;
    }
}
