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
package uk.ac.lancs.vyos.device;

import java.io.File;
import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import uk.ac.lancs.vyos.config.Configuration;

/**
 * Describes how to reach a device, and which software version it runs.
 * 
 * @author simpsons
 */
public final class DeviceConfig {
    /**
     * The versions accepted when version checking is strict
     */
    public static final List<String> KNOWN_VERSIONS =
        Collections.unmodifiableList(Arrays.asList("1.4", "1.5"));

    /**
     * The longest timeout accepted, in seconds
     */
    public static final int MAX_TIMEOUT = 86400;

    /**
     * The device's name within the registry
     */
    public final String name;

    /**
     * The device's host name or address
     */
    public final String hostname;

    /**
     * The API key
     */
    public final String apiKey;

    /**
     * The device-software version
     */
    public final String version;

    /**
     * <samp>http</samp> or <samp>https</samp>
     */
    public final String protocol;

    /**
     * The API port
     */
    public final int port;

    /**
     * Whether the device's certificate is verified
     */
    public final boolean verifySsl;

    /**
     * The connect and read timeout in seconds
     */
    public final int timeout;

    /**
     * A file holding the only certificate the device may present, or
     * {@code null} to use the system's trust store
     */
    public final File certificate;

    /**
     * Create a device configuration.
     * 
     * @param name the device's name within the registry
     * 
     * @param hostname the device's host name or address
     * 
     * @param apiKey the API key
     * 
     * @param version the device-software version
     * 
     * @param protocol <samp>http</samp> or <samp>https</samp>
     * 
     * @param port the API port
     * 
     * @param verifySsl whether the device's certificate is verified
     * 
     * @param timeout the connect and read timeout in seconds
     * 
     * @param certificate a file holding the device's pinned
     * certificate, or {@code null}
     */
    public DeviceConfig(String name, String hostname, String apiKey,
                        String version, String protocol, int port,
                        boolean verifySsl, int timeout, File certificate) {
        this.name = name;
        this.hostname = hostname;
        this.apiKey = apiKey;
        this.version = version;
        this.protocol = protocol;
        this.port = port;
        this.verifySsl = verifySsl;
        this.timeout = timeout;
        this.certificate = certificate;
    }

    /**
     * Get the base URI of the device's API.
     * 
     * @return the base URI, ending in a slash
     */
    public URI baseURI() {
        return URI.create(protocol + "://" + hostname + ":" + port + "/");
    }

    /**
     * Read a device configuration. The following keys are recognized:
     * 
     * <dl>
     * 
     * <dt><samp>hostname</samp></dt>
     * 
     * <dd>The device's host name or address. Required.
     * 
     * <dt><samp>apikey</samp></dt>
     * 
     * <dd>The API key. Required.
     * 
     * <dt><samp>version</samp></dt>
     * 
     * <dd>The device-software version. Required. Must be one of
     * {@link #KNOWN_VERSIONS} unless <samp>version.strict</samp> is
     * <samp>false</samp>.
     * 
     * <dt><samp>protocol</samp></dt>
     * 
     * <dd><samp>http</samp> or <samp>https</samp>. Default
     * <samp>https</samp>.
     * 
     * <dt><samp>port</samp></dt>
     * 
     * <dd>The API port, 1 to 65535. Default 443.
     * 
     * <dt><samp>verify-ssl</samp></dt>
     * 
     * <dd>Whether to verify the device's certificate;
     * <samp>true</samp>, <samp>1</samp> or <samp>yes</samp> enable it.
     * Default <samp>false</samp>.
     * 
     * <dt><samp>timeout</samp></dt>
     * 
     * <dd>The connect and read timeout in seconds, 1 to
     * {@value #MAX_TIMEOUT}. Default 10.
     * 
     * <dt><samp>certificate</samp></dt>
     * 
     * <dd>A PEM or DER file holding the only certificate the device may
     * present. Used only when <samp>verify-ssl</samp> is enabled.
     * Default none.
     * 
     * </dl>
     * 
     * @param name the device's name
     * 
     * @param conf the device's configuration
     * 
     * @return the device configuration
     * 
     * @throws IllegalArgumentException if a required key is missing, or
     * a value is invalid
     */
    public static DeviceConfig fromConfiguration(String name,
                                                 Configuration conf) {
        String hostname = required(conf, "hostname");
        String apiKey = required(conf, "apikey");
        String version = required(conf, "version");
        boolean strict =
            !"false".equalsIgnoreCase(conf.get("version.strict", "true")
                .trim());
        if (strict && !KNOWN_VERSIONS.contains(version))
            throw new IllegalArgumentException(name + ": invalid version '"
                + version + "' (must be one of " + KNOWN_VERSIONS + ")");

        String protocol =
            conf.get("protocol", "https").trim().toLowerCase(Locale.ROOT);
        if (!protocol.equals("http") && !protocol.equals("https"))
            throw new IllegalArgumentException(name + ": invalid protocol '"
                + protocol + "' (must be http or https)");

        int port = integer(name, conf, "port", "443");
        if (port < 1 || port > 65535)
            throw new IllegalArgumentException(name + ": invalid port "
                + port + " (must be 1-65535)");

        String verifyText =
            conf.get("verify-ssl", "false").trim().toLowerCase(Locale.ROOT);
        boolean verifySsl = verifyText.equals("true")
            || verifyText.equals("1") || verifyText.equals("yes");

        int timeout = integer(name, conf, "timeout", "10");
        if (timeout <= 0 || timeout > MAX_TIMEOUT)
            throw new IllegalArgumentException(name + ": invalid timeout "
                + timeout + " (must be 1-" + MAX_TIMEOUT + ")");

        String certText = conf.get("certificate");
        File certificate = certText == null || certText.trim().isEmpty() ?
            null : new File(certText.trim());

        return new DeviceConfig(name, hostname, apiKey, version, protocol,
                                port, verifySsl, timeout, certificate);
    }

    private static String required(Configuration conf, String key) {
        String value = conf.get(key);
        if (value == null || value.trim().isEmpty())
            throw new IllegalArgumentException("missing " + conf.prefix()
                + key);
        return value.trim();
    }

    private static int integer(String name, Configuration conf, String key,
                               String defaultValue) {
        String text = conf.get(key, defaultValue).trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + ": invalid " + key
                + " '" + text + "'", ex);
        }
    }

    /**
     * Get a description of this configuration without the API key.
     * 
     * @return a description of the device
     */
    @Override
    public String toString() {
        return name + " (" + baseURI() + ", VyOS " + version + ")";
    }
}
