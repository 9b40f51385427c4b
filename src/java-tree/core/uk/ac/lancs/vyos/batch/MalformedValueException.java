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
package uk.ac.lancs.vyos.batch;

import uk.ac.lancs.vyos.mapper.MappingException;

/**
 * Indicates that a composite operation argument did not split into the
 * expected number of parts.
 * 
 * @author simpsons
 */
public class MalformedValueException extends MappingException {
    private static final long serialVersionUID = 1L;

    private final String operation;

    private final String value;

    /**
     * Get the name of the operation whose argument was malformed.
     * 
     * @return the operation name
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Get the malformed argument.
     * 
     * @return the argument as supplied
     */
    public String getValue() {
        return value;
    }

    /**
     * Create an exception for a malformed argument.
     * 
     * @param version the device-software version
     * 
     * @param operation the operation name
     * 
     * @param value the argument as supplied
     * 
     * @param expected a description of the expected form, e.g.,
     * <samp>vlan,address</samp>
     */
    public MalformedValueException(String version, String operation,
                                   String value, String expected) {
        super(version, operation + " requires a value of the form "
            + expected + "; got " + value);
        this.operation = operation;
        this.value = value;
    }
}
