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
package uk.ac.lancs.vyos.rest;

import java.io.IOException;
import java.util.List;

import uk.ac.lancs.vyos.batch.Operation;

/**
 * Submits requests to a device. The device applies a multi-operation
 * request as a whole, or rejects it as a whole.
 * 
 * @author simpsons
 */
public interface DeviceTransport {
    /**
     * Submit an ordered list of operations as one request.
     * 
     * @param operations the operations, in the order to apply them
     * 
     * @return the device's verdict on the whole list
     * 
     * @throws IOException if the request could not be delivered, or the
     * response could not be understood
     */
    APIResult<Object> configure(List<Operation> operations)
        throws IOException;

    /**
     * Fetch part of the device's configuration tree.
     * 
     * @param path the path to the subtree; empty for the whole tree
     * 
     * @return the result, whose payload is the decoded subtree
     * 
     * @throws IOException if the request could not be delivered, or the
     * response could not be understood
     */
    APIResult<Object> showConfig(List<String> path) throws IOException;
}
