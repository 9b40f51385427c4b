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
 * Queues changes to the 802.1X and EVPN settings of an ethernet
 * interface.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public interface PortSecurityOperations<B extends PortSecurityOperations<B>>
    extends EthernetOperations<B> {
    default B setEapolCertificate(String iface, String name) {
        return addSet(ethernetMapper().eapolCertificate(iface, name));
    }

    default B deleteEapolCertificate(String iface) {
        return addDelete(ethernetMapper().eapolCertificatePath(iface));
    }

    default B setEapolCaCertificate(String iface, String name) {
        return addSet(ethernetMapper().eapolCaCertificate(iface, name));
    }

    default B deleteEapolCaCertificate(String iface) {
        return addDelete(ethernetMapper().eapolCaCertificatePath(iface));
    }

    default B setEapolPassphrase(String iface, String passphrase) {
        return addSet(ethernetMapper().eapolPassphrase(iface, passphrase));
    }

    default B deleteEapolPassphrase(String iface) {
        return addDelete(ethernetMapper().eapolPassphrasePath(iface));
    }

    default B setEvpnUplink(String iface) {
        return addSet(ethernetMapper().evpnUplink(iface));
    }

    default B deleteEvpnUplink(String iface) {
        return addDelete(ethernetMapper().evpnUplink(iface));
    }
}
