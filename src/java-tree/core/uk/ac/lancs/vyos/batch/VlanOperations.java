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
 * Queues changes to the VLAN sub-interfaces of an ethernet interface.
 * A sub-interface must be created before its attributes are set, and
 * the batch preserves the order in which calls are made.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public interface VlanOperations<B extends VlanOperations<B>>
    extends EthernetOperations<B> {
    /**
     * Queue creating a single-tagged VLAN sub-interface.
     * 
     * @param iface the parent interface name
     * 
     * @param vlan the VLAN id
     * 
     * @return this batch
     */
    default B setVif(String iface, String vlan) {
        return addSet(ethernetMapper().vif(iface, vlan));
    }

    default B deleteVif(String iface, String vlan) {
        return addDelete(ethernetMapper().vif(iface, vlan));
    }

    default B setVifAddress(String iface, String vlan, String address) {
        return addSet(ethernetMapper().vifAddress(iface, vlan, address));
    }

    default B deleteVifAddress(String iface, String vlan, String address) {
        return addDelete(ethernetMapper().vifAddress(iface, vlan, address));
    }

    default B setVifDescription(String iface, String vlan,
                                String description) {
        return addSet(ethernetMapper().vifDescription(iface, vlan,
                                                      description));
    }

    default B deleteVifDescription(String iface, String vlan) {
        return addDelete(ethernetMapper().vifDescriptionPath(iface, vlan));
    }

    default B setVifMtu(String iface, String vlan, String mtu) {
        return addSet(ethernetMapper().vifMtu(iface, vlan, mtu));
    }

    default B deleteVifMtu(String iface, String vlan) {
        return addDelete(ethernetMapper().vifMtuPath(iface, vlan));
    }

    default B setVifDisable(String iface, String vlan) {
        return addSet(ethernetMapper().vifDisable(iface, vlan));
    }

    default B deleteVifDisable(String iface, String vlan) {
        return addDelete(ethernetMapper().vifDisable(iface, vlan));
    }

    default B setVifVrf(String iface, String vlan, String vrf) {
        return addSet(ethernetMapper().vifVrf(iface, vlan, vrf));
    }

    default B deleteVifVrf(String iface, String vlan) {
        return addDelete(ethernetMapper().vifVrfPath(iface, vlan));
    }

    /**
     * Queue creating a QinQ service VLAN.
     * 
     * @param iface the parent interface name
     * 
     * @param serviceVlan the service VLAN id
     * 
     * @return this batch
     */
    default B setVifS(String iface, String serviceVlan) {
        return addSet(ethernetMapper().vifS(iface, serviceVlan));
    }

    default B deleteVifS(String iface, String serviceVlan) {
        return addDelete(ethernetMapper().vifS(iface, serviceVlan));
    }

    default B setVifSAddress(String iface, String serviceVlan,
                             String address) {
        return addSet(ethernetMapper().vifSAddress(iface, serviceVlan,
                                                   address));
    }

    default B deleteVifSAddress(String iface, String serviceVlan,
                                String address) {
        return addDelete(ethernetMapper().vifSAddress(iface, serviceVlan,
                                                      address));
    }

    default B setVifSDescription(String iface, String serviceVlan,
                                 String description) {
        return addSet(ethernetMapper().vifSDescription(iface, serviceVlan,
                                                       description));
    }

    default B deleteVifSDescription(String iface, String serviceVlan) {
        return addDelete(ethernetMapper().vifSDescriptionPath(iface,
                                                              serviceVlan));
    }

    default B setVifSMtu(String iface, String serviceVlan, String mtu) {
        return addSet(ethernetMapper().vifSMtu(iface, serviceVlan, mtu));
    }

    default B deleteVifSMtu(String iface, String serviceVlan) {
        return addDelete(ethernetMapper().vifSMtuPath(iface, serviceVlan));
    }

    default B setVifSProtocol(String iface, String serviceVlan,
                              String protocol) {
        return addSet(ethernetMapper().vifSProtocol(iface, serviceVlan,
                                                    protocol));
    }

    default B deleteVifSProtocol(String iface, String serviceVlan) {
        return addDelete(ethernetMapper().vifSProtocolPath(iface,
                                                           serviceVlan));
    }

    /**
     * Queue creating a QinQ customer VLAN within a service VLAN.
     * 
     * @param iface the parent interface name
     * 
     * @param serviceVlan the outer service VLAN id
     * 
     * @param customerVlan the inner customer VLAN id
     * 
     * @return this batch
     */
    default B setVifC(String iface, String serviceVlan,
                      String customerVlan) {
        return addSet(ethernetMapper().vifC(iface, serviceVlan,
                                            customerVlan));
    }

    default B deleteVifC(String iface, String serviceVlan,
                         String customerVlan) {
        return addDelete(ethernetMapper().vifC(iface, serviceVlan,
                                               customerVlan));
    }

    default B setVifCAddress(String iface, String serviceVlan,
                             String customerVlan, String address) {
        return addSet(ethernetMapper().vifCAddress(iface, serviceVlan,
                                                   customerVlan, address));
    }

    default B deleteVifCAddress(String iface, String serviceVlan,
                                String customerVlan, String address) {
        return addDelete(ethernetMapper()
            .vifCAddress(iface, serviceVlan, customerVlan, address));
    }

    default B setVifCDescription(String iface, String serviceVlan,
                                 String customerVlan, String description) {
        return addSet(ethernetMapper()
            .vifCDescription(iface, serviceVlan, customerVlan, description));
    }

    default B deleteVifCDescription(String iface, String serviceVlan,
                                    String customerVlan) {
        return addDelete(ethernetMapper()
            .vifCDescriptionPath(iface, serviceVlan, customerVlan));
    }

    default B setVifCMtu(String iface, String serviceVlan,
                         String customerVlan, String mtu) {
        return addSet(ethernetMapper().vifCMtu(iface, serviceVlan,
                                               customerVlan, mtu));
    }

    default B deleteVifCMtu(String iface, String serviceVlan,
                            String customerVlan) {
        return addDelete(ethernetMapper().vifCMtuPath(iface, serviceVlan,
                                                      customerVlan));
    }
}
