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

import uk.ac.lancs.vyos.mapper.MapperRegistry;
import uk.ac.lancs.vyos.mapper.interfaces.EthernetInterfaceMapper;
import uk.ac.lancs.vyos.mapper.interfaces.InterfaceMapper;
import uk.ac.lancs.vyos.mapper.interfaces.InterfaceModule;

/**
 * Builds a batch of changes to ethernet interfaces.
 * 
 * @author simpsons
 */
public final class EthernetBatchBuilder
    extends AbstractBatchBuilder<EthernetBatchBuilder>
    implements IpOperations<EthernetBatchBuilder>,
    Ipv6Operations<EthernetBatchBuilder>,
    MirrorOperations<EthernetBatchBuilder>,
    LinkOperations<EthernetBatchBuilder>,
    DhcpOperations<EthernetBatchBuilder>,
    VlanOperations<EthernetBatchBuilder>,
    PortSecurityOperations<EthernetBatchBuilder> {
    private final EthernetInterfaceMapper mapper;

    /**
     * Create an empty batch.
     * 
     * @param registry the registry supplying the ethernet mapper
     * 
     * @param version the device-software version
     * 
     * @throws uk.ac.lancs.vyos.mapper.UnknownFeatureException if the
     * registry has no ethernet family
     */
    public EthernetBatchBuilder(MapperRegistry registry, String version) {
        super(registry, version);
        this.mapper = mapper(InterfaceModule.ETHERNET,
                             EthernetInterfaceMapper.class);
    }

    @Override
    public InterfaceMapper interfaceMapper() {
        return mapper;
    }

    @Override
    public EthernetInterfaceMapper ethernetMapper() {
        return mapper;
    }
}
