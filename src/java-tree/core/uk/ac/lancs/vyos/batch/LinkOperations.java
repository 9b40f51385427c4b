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

import uk.ac.lancs.vyos.mapper.interfaces.Offload;

/**
 * Queues changes to the physical link and NIC of an ethernet
 * interface.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public interface LinkOperations<B extends LinkOperations<B>>
    extends EthernetOperations<B> {
    /**
     * Queue setting an interface's duplex mode.
     * 
     * @param iface the interface name
     * 
     * @param duplex <samp>auto</samp>, <samp>half</samp> or
     * <samp>full</samp>
     * 
     * @return this batch
     */
    default B setInterfaceDuplex(String iface, String duplex) {
        return addSet(ethernetMapper().duplex(iface, duplex));
    }

    default B deleteInterfaceDuplex(String iface) {
        return addDelete(ethernetMapper().duplexPath(iface));
    }

    /**
     * Queue setting an interface's link speed.
     * 
     * @param iface the interface name
     * 
     * @param speed <samp>auto</samp> or a speed in Mb/s
     * 
     * @return this batch
     */
    default B setInterfaceSpeed(String iface, String speed) {
        return addSet(ethernetMapper().speed(iface, speed));
    }

    default B deleteInterfaceSpeed(String iface) {
        return addDelete(ethernetMapper().speedPath(iface));
    }

    default B setInterfaceHwId(String iface, String mac) {
        return addSet(ethernetMapper().hwId(iface, mac));
    }

    default B deleteInterfaceHwId(String iface) {
        return addDelete(ethernetMapper().hwIdPath(iface));
    }

    default B setOffload(String iface, Offload offload) {
        return addSet(ethernetMapper().offload(iface, offload));
    }

    default B deleteOffload(String iface, Offload offload) {
        return addDelete(ethernetMapper().offload(iface, offload));
    }

    default B setRingBufferRx(String iface, String size) {
        return addSet(ethernetMapper().ringBufferRx(iface, size));
    }

    default B deleteRingBufferRx(String iface) {
        return addDelete(ethernetMapper().ringBufferRxPath(iface));
    }

    default B setRingBufferTx(String iface, String size) {
        return addSet(ethernetMapper().ringBufferTx(iface, size));
    }

    default B deleteRingBufferTx(String iface) {
        return addDelete(ethernetMapper().ringBufferTxPath(iface));
    }
}
