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

import uk.ac.lancs.vyos.mapper.interfaces.IpFlag;

/**
 * Queues changes to the IPv4 settings of an interface.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public interface IpOperations<B extends IpOperations<B>>
    extends InterfaceOperations<B> {
    default B setIpAdjustMss(String iface, String mss) {
        return addSet(interfaceMapper().ipAdjustMss(iface, mss));
    }

    default B deleteIpAdjustMss(String iface) {
        return addDelete(interfaceMapper().ipAdjustMssPath(iface));
    }

    default B setIpArpCacheTimeout(String iface, String seconds) {
        return addSet(interfaceMapper().ipArpCacheTimeout(iface, seconds));
    }

    default B deleteIpArpCacheTimeout(String iface) {
        return addDelete(interfaceMapper().ipArpCacheTimeoutPath(iface));
    }

    default B setIpFlag(String iface, IpFlag flag) {
        return addSet(interfaceMapper().ipFlag(iface, flag));
    }

    default B deleteIpFlag(String iface, IpFlag flag) {
        return addDelete(interfaceMapper().ipFlag(iface, flag));
    }

    default B setIpSourceValidation(String iface, String mode) {
        return addSet(interfaceMapper().ipSourceValidation(iface, mode));
    }

    default B deleteIpSourceValidation(String iface) {
        return addDelete(interfaceMapper().ipSourceValidationPath(iface));
    }

    /**
     * Queue enabling forwarding of directed broadcasts.
     * 
     * @param iface the interface name
     * 
     * @return this batch
     * 
     * @throws uk.ac.lancs.vyos.mapper.UnsupportedFeatureException if
     * the batch's version lacks the setting, in which case nothing is
     * queued
     */
    default B setIpEnableDirectedBroadcast(String iface) {
        return addSet(interfaceMapper().ipEnableDirectedBroadcast(iface));
    }

    /**
     * Queue disabling forwarding of directed broadcasts.
     * 
     * @param iface the interface name
     * 
     * @return this batch
     * 
     * @throws uk.ac.lancs.vyos.mapper.UnsupportedFeatureException if
     * the batch's version lacks the setting, in which case nothing is
     * queued
     */
    default B deleteIpEnableDirectedBroadcast(String iface) {
        return addDelete(interfaceMapper().ipEnableDirectedBroadcast(iface));
    }
}
