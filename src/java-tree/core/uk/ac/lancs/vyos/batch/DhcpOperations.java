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
 * Queues changes to the DHCP and DHCPv6 client options of an ethernet
 * interface.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public interface DhcpOperations<B extends DhcpOperations<B>>
    extends EthernetOperations<B> {
    default B setDhcpClientId(String iface, String id) {
        return addSet(ethernetMapper().dhcpClientId(iface, id));
    }

    default B deleteDhcpClientId(String iface) {
        return addDelete(ethernetMapper().dhcpClientIdPath(iface));
    }

    default B setDhcpHostName(String iface, String name) {
        return addSet(ethernetMapper().dhcpHostName(iface, name));
    }

    default B deleteDhcpHostName(String iface) {
        return addDelete(ethernetMapper().dhcpHostNamePath(iface));
    }

    default B setDhcpVendorClassId(String iface, String id) {
        return addSet(ethernetMapper().dhcpVendorClassId(iface, id));
    }

    default B deleteDhcpVendorClassId(String iface) {
        return addDelete(ethernetMapper().dhcpVendorClassIdPath(iface));
    }

    default B setDhcpDefaultRouteDistance(String iface, String distance) {
        return addSet(ethernetMapper().dhcpDefaultRouteDistance(iface,
                                                                distance));
    }

    default B deleteDhcpDefaultRouteDistance(String iface) {
        return addDelete(ethernetMapper()
            .dhcpDefaultRouteDistancePath(iface));
    }

    default B setDhcpNoDefaultRoute(String iface) {
        return addSet(ethernetMapper().dhcpNoDefaultRoute(iface));
    }

    default B deleteDhcpNoDefaultRoute(String iface) {
        return addDelete(ethernetMapper().dhcpNoDefaultRoute(iface));
    }

    default B setDhcpReject(String iface, String server) {
        return addSet(ethernetMapper().dhcpReject(iface, server));
    }

    default B deleteDhcpReject(String iface, String server) {
        return addDelete(ethernetMapper().dhcpReject(iface, server));
    }

    default B setDhcpv6Duid(String iface, String duid) {
        return addSet(ethernetMapper().dhcpv6Duid(iface, duid));
    }

    default B deleteDhcpv6Duid(String iface) {
        return addDelete(ethernetMapper().dhcpv6DuidPath(iface));
    }

    default B setDhcpv6RapidCommit(String iface) {
        return addSet(ethernetMapper().dhcpv6RapidCommit(iface));
    }

    default B deleteDhcpv6RapidCommit(String iface) {
        return addDelete(ethernetMapper().dhcpv6RapidCommit(iface));
    }

    default B setDhcpv6ParametersOnly(String iface) {
        return addSet(ethernetMapper().dhcpv6ParametersOnly(iface));
    }

    default B deleteDhcpv6ParametersOnly(String iface) {
        return addDelete(ethernetMapper().dhcpv6ParametersOnly(iface));
    }

    default B setDhcpv6Temporary(String iface) {
        return addSet(ethernetMapper().dhcpv6Temporary(iface));
    }

    default B deleteDhcpv6Temporary(String iface) {
        return addDelete(ethernetMapper().dhcpv6Temporary(iface));
    }
}
