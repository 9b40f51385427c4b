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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import uk.ac.lancs.vyos.mapper.FeatureMapper;
import uk.ac.lancs.vyos.mapper.MapperRegistry;
import uk.ac.lancs.vyos.mapper.MappingException;
import uk.ac.lancs.vyos.mapper.UnknownFeatureException;
import uk.ac.lancs.vyos.path.CommandPath;

/**
 * Implements the bookkeeping of a batch by delegating to an
 * {@link OperationSequence}. Typed builders extend this class and
 * declare the operation sets valid for their family.
 * 
 * @param <B> the concrete batch type
 * 
 * @author simpsons
 */
public abstract class AbstractBatchBuilder<B extends AbstractBatchBuilder<B>>
    implements BatchOperations<B> {
    private final OperationSequence operations;
    private final Map<String, FeatureMapper> mappers;

    /**
     * Create a batch with no mappers.
     * 
     * @param version the device-software version
     */
    protected AbstractBatchBuilder(String version) {
        this.operations = new OperationSequence(version);
        this.mappers = Collections.emptyMap();
    }

    /**
     * Create a batch with a mapper from each registered family.
     * 
     * @param registry the registry to obtain mappers from
     * 
     * @param version the device-software version
     */
    protected AbstractBatchBuilder(MapperRegistry registry, String version) {
        this.operations = new OperationSequence(version);
        this.mappers = registry.resolveAll(version);
    }

    /**
     * Get this batch's mapper for a family.
     * 
     * @param <M> the expected mapper type
     * 
     * @param family the family name
     * 
     * @param type the expected mapper type
     * 
     * @return the mapper
     * 
     * @throws UnknownFeatureException if the family was not registered
     * 
     * @throws MappingException if the family's mapper is not of the
     * expected type
     */
    protected final <M extends FeatureMapper> M mapper(String family,
                                                       Class<M> type) {
        FeatureMapper mapper = mappers.get(family);
        if (mapper == null)
            throw new UnknownFeatureException(family, version());
        if (!type.isInstance(mapper))
            throw new MappingException(version(), "family " + family
                + " has mapper " + mapper.getClass().getName() + ", not "
                + type.getName());
        return type.cast(mapper);
    }

    @SuppressWarnings("unchecked")
    private B self() {
        return (B) this;
    }

    @Override
    public B addSet(CommandPath path) {
        operations.append(OperationKind.SET, path);
        return self();
    }

    @Override
    public B addDelete(CommandPath path) {
        operations.append(OperationKind.DELETE, path);
        return self();
    }

    @Override
    public B addMultipleSets(Collection<? extends CommandPath> paths) {
        for (CommandPath path : paths)
            operations.append(OperationKind.SET, path);
        return self();
    }

    @Override
    public B clear() {
        operations.clear();
        return self();
    }

    @Override
    public String version() {
        return operations.version();
    }

    @Override
    public List<Operation> getOperations() {
        return operations.getOperations();
    }

    @Override
    public int operationCount() {
        return operations.operationCount();
    }

    @Override
    public boolean isEmpty() {
        return operations.isEmpty();
    }

    @Override
    public boolean isExecuted() {
        return operations.isExecuted();
    }

    @Override
    public List<Operation> markExecuted() {
        return operations.markExecuted();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + version() + " "
            + operations.getOperations();
    }
}
