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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import uk.ac.lancs.vyos.path.CommandPath;

/**
 * Accumulates operations in order, and enforces single submission.
 * Instances are not thread-safe.
 * 
 * @author simpsons
 */
public final class OperationSequence implements Batch {
    private final String version;
    private final List<Operation> operations = new ArrayList<>();
    private boolean executed;

    /**
     * Create an empty sequence.
     * 
     * @param version the device-software version operations are mapped
     * for
     */
    public OperationSequence(String version) {
        this.version = version;
    }

    /**
     * Append an operation.
     * 
     * @param kind the kind of change
     * 
     * @param path the path the change applies to
     * 
     * @throws IllegalStateException if the sequence has been submitted
     */
    public void append(OperationKind kind, CommandPath path) {
        if (executed) throw new IllegalStateException("batch already executed");
        Operation op = new Operation(kind, path);
        operations.add(op);
        logger.finest(() -> "queued " + op);
    }

    /**
     * Remove all operations, and allow the sequence to be submitted
     * again.
     */
    public void clear() {
        operations.clear();
        executed = false;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public List<Operation> getOperations() {
        return new ArrayList<>(operations);
    }

    @Override
    public int operationCount() {
        return operations.size();
    }

    @Override
    public boolean isEmpty() {
        return operations.isEmpty();
    }

    @Override
    public boolean isExecuted() {
        return executed;
    }

    @Override
    public List<Operation> markExecuted() {
        if (executed) throw new IllegalStateException("batch already executed");
        executed = true;
        return getOperations();
    }

    private static final Logger logger =
        Logger.getLogger(OperationSequence.class.getName());
}
