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
package uk.ac.lancs.vyos.record;

import java.util.Map;

import org.json.simple.JSONObject;

/**
 * Describes IEEE 802.1X authentication of an ethernet interface, from
 * its <samp>eapol</samp> node. The passphrase itself is not retained.
 * 
 * @author simpsons
 */
public final class EapolSettings {
    /**
     * The name of the client certificate, or {@code null}
     */
    public final String certificate;

    /**
     * The name of the CA certificate, or {@code null}
     */
    public final String caCertificate;

    /**
     * Whether a passphrase is configured for the private key
     */
    public final boolean passphraseSet;

    private EapolSettings(Map<?, ?> eapol) {
        this.certificate = RawValues.string(eapol, "certificate");
        this.caCertificate = RawValues.string(eapol, "ca-certificate");
        this.passphraseSet = RawValues.flag(eapol, "passphrase");
    }

    /**
     * Parse the 802.1X settings of an interface.
     * 
     * @param iface the interface's raw node
     * 
     * @return the settings, or {@code null} if the interface has no
     * <samp>eapol</samp> node
     */
    public static EapolSettings of(Map<?, ?> iface) {
        Map<?, ?> eapol = RawValues.block(iface, "eapol");
        if (eapol == null) return null;
        return new EapolSettings(eapol);
    }

    /**
     * Convert these settings into JSON.
     * 
     * @return the JSON representation
     */
    @SuppressWarnings("unchecked")
    public JSONObject toJSON() {
        JSONObject result = new JSONObject();
        result.put("certificate", certificate);
        result.put("ca_certificate", caCertificate);
        result.put("passphrase_set", passphraseSet);
        return result;
    }
}
