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

/**
 * Queues changes to the IPv6 settings of an interface.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public interface Ipv6Operations<B extends Ipv6Operations<B>>
    extends InterfaceOperations<B> {
    default B setIpv6Autoconf(String iface) {
        return addSet(interfaceMapper().ipv6Autoconf(iface));
    }

    default B deleteIpv6Autoconf(String iface) {
        return addDelete(interfaceMapper().ipv6Autoconf(iface));
    }

    default B setIpv6Eui64(String iface, String prefix) {
        return addSet(interfaceMapper().ipv6Eui64(iface, prefix));
    }

    default B deleteIpv6Eui64(String iface, String prefix) {
        return addDelete(interfaceMapper().ipv6Eui64(iface, prefix));
    }

    default B setIpv6NoDefaultLinkLocal(String iface) {
        return addSet(interfaceMapper().ipv6NoDefaultLinkLocal(iface));
    }

    default B deleteIpv6NoDefaultLinkLocal(String iface) {
        return addDelete(interfaceMapper().ipv6NoDefaultLinkLocal(iface));
    }

    default B setIpv6AdjustMss(String iface, String mss) {
        return addSet(interfaceMapper().ipv6AdjustMss(iface, mss));
    }

    default B deleteIpv6AdjustMss(String iface) {
        return addDelete(interfaceMapper().ipv6AdjustMssPath(iface));
    }

    default B setIpv6DisableForwarding(String iface) {
        return addSet(interfaceMapper().ipv6DisableForwarding(iface));
    }

    default B deleteIpv6DisableForwarding(String iface) {
        return addDelete(interfaceMapper().ipv6DisableForwarding(iface));
    }

    default B setIpv6DupAddrDetectTransmits(String iface, String count) {
        return addSet(interfaceMapper().ipv6DupAddrDetectTransmits(iface,
                                                                   count));
    }

    default B deleteIpv6DupAddrDetectTransmits(String iface) {
        return addDelete(interfaceMapper()
            .ipv6DupAddrDetectTransmitsPath(iface));
    }
}
