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

import java.util.List;

/**
 * Holds an ordered sequence of operations to be submitted to a device
 * in one request. A batch is used once: submitting it marks it as
 * executed, after which it accepts no more operations and cannot be
 * submitted again until cleared.
 * 
 * @author simpsons
 */
public interface Batch {
    /**
     * Get the device-software version the batch's paths were mapped
     * for.
     * 
     * @return the version
     */
    String version();

    /**
     * Get the queued operations.
     * 
     * @return a copy of the operations in queued order
     */
    List<Operation> getOperations();

    /**
     * Get the number of queued operations.
     * 
     * @return the number of operations
     */
    int operationCount();

    /**
     * Determine whether any operations are queued.
     * 
     * @return {@code true} iff no operations are queued
     */
    boolean isEmpty();

    /**
     * Determine whether the batch has been submitted.
     * 
     * @return {@code true} iff the batch has been submitted and not
     * cleared since
     */
    boolean isExecuted();

    /**
     * Mark the batch as submitted, and get its operations for
     * submission.
     * 
     * @return a copy of the operations in queued order
     * 
     * @throws IllegalStateException if the batch has already been
     * submitted
     */
    List<Operation> markExecuted();
}
