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

import uk.ac.lancs.vyos.mapper.interfaces.InterfaceMapper;

/**
 * Queues changes to the attributes every interface type has. Deleting
 * a scalar property uses its property path, while deleting one address
 * or VRF assignment uses the path to that value.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public interface InterfaceOperations<B extends InterfaceOperations<B>>
    extends BatchOperations<B> {
    /**
     * Get the mapper that supplies this batch's interface paths.
     * 
     * @return the mapper
     */
    InterfaceMapper interfaceMapper();

    /**
     * Queue setting an interface's description.
     * 
     * @param iface the interface name
     * 
     * @param description the new description
     * 
     * @return this batch
     */
    default B setInterfaceDescription(String iface, String description) {
        return addSet(interfaceMapper().description(iface, description));
    }

    /**
     * Queue removing an interface's description.
     * 
     * @param iface the interface name
     * 
     * @return this batch
     */
    default B deleteInterfaceDescription(String iface) {
        return addDelete(interfaceMapper().descriptionPath(iface));
    }

    /**
     * Queue adding an address to an interface.
     * 
     * @param iface the interface name
     * 
     * @param address the address with prefix length
     * 
     * @return this batch
     */
    default B setInterfaceAddress(String iface, String address) {
        return addSet(interfaceMapper().address(iface, address));
    }

    /**
     * Queue removing one address from an interface.
     * 
     * @param iface the interface name
     * 
     * @param address the address to remove
     * 
     * @return this batch
     */
    default B deleteInterfaceAddress(String iface, String address) {
        return addDelete(interfaceMapper().address(iface, address));
    }

    default B setInterfaceMtu(String iface, String mtu) {
        return addSet(interfaceMapper().mtu(iface, mtu));
    }

    default B deleteInterfaceMtu(String iface) {
        return addDelete(interfaceMapper().mtuPath(iface));
    }

    default B setInterfaceVrf(String iface, String vrf) {
        return addSet(interfaceMapper().vrf(iface, vrf));
    }

    default B deleteInterfaceVrf(String iface, String vrf) {
        return addDelete(interfaceMapper().vrf(iface, vrf));
    }

    /**
     * Queue administratively disabling an interface.
     * 
     * @param iface the interface name
     * 
     * @return this batch
     */
    default B setInterfaceDisable(String iface) {
        return addSet(interfaceMapper().disable(iface));
    }

    /**
     * Queue re-enabling an administratively disabled interface.
     * 
     * @param iface the interface name
     * 
     * @return this batch
     */
    default B deleteInterfaceDisable(String iface) {
        return addDelete(interfaceMapper().disable(iface));
    }

    /**
     * Queue removing an interface's entire configuration.
     * 
     * @param iface the interface name
     * 
     * @return this batch
     */
    default B deleteInterface(String iface) {
        return addDelete(interfaceMapper().interfacePath(iface));
    }
}
