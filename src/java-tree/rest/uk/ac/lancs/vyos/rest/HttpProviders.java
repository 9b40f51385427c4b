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
package uk.ac.lancs.vyos.rest;

import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.function.Supplier;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;

import org.apache.http.client.HttpClient;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;

/**
 * Supplies HTTP clients for talking to devices. Appliances usually
 * present self-signed certificates, so a client may trust a single
 * pinned certificate, or any certificate at all.
 * 
 * @author simpsons
 */
public final class HttpProviders {
    private HttpProviders() {}

    private static RequestConfig timeouts(int timeoutSeconds) {
        if (timeoutSeconds <= 0 || timeoutSeconds > Integer.MAX_VALUE / 1000)
            throw new IllegalArgumentException("timeout out of range: "
                + timeoutSeconds + "s");
        int millis = timeoutSeconds * 1000;
        return RequestConfig.custom().setConnectTimeout(millis)
            .setConnectionRequestTimeout(millis).setSocketTimeout(millis)
            .build();
    }

    /**
     * Get a provider of clients that verify certificates against the
     * system's trust store.
     * 
     * @param timeoutSeconds the connect and read timeout
     * 
     * @return the provider
     * 
     * @throws IllegalArgumentException if the timeout is not positive,
     * or too long to express in milliseconds
     */
    public static Supplier<HttpClient> verifying(int timeoutSeconds) {
        RequestConfig config = timeouts(timeoutSeconds);
        return () -> HttpClients.custom().setDefaultRequestConfig(config)
            .build();
    }

    /**
     * Get a provider of clients that accept only one certificate.
     * 
     * @param cert the certificate the device must present, or
     * {@code null} to use the system's trust store
     * 
     * @param timeoutSeconds the connect and read timeout
     * 
     * @return the provider
     * 
     * @throws IllegalArgumentException if the timeout is not positive,
     * or too long to express in milliseconds
     * 
     * @throws NoSuchAlgorithmException if TLS is not available
     * 
     * @throws KeyManagementException if the SSL context could not be
     * initialized
     */
    public static Supplier<HttpClient>
        forCertificate(X509Certificate cert, int timeoutSeconds)
            throws NoSuchAlgorithmException,
                KeyManagementException {
        if (cert == null) return verifying(timeoutSeconds);
        return unverifiedHost(contextOf(new TrustManager[] {
            new X509TrustManager() {
                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[] { cert };
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain,
                                               String authType)
                    throws CertificateException {
                    for (X509Certificate cand : chain) {
                        if (!cand.equals(cert)) continue;
                        return;
                    }
                    throw new CertificateException("not accepted");
                }

                @Override
                public void checkClientTrusted(X509Certificate[] chain,
                                               String authType)
                    throws CertificateException {
                    throw new CertificateException("client certificates"
                        + " not expected");
                }
            } }), timeoutSeconds);
    }

    /**
     * Get a provider of clients that accept any certificate.
     * 
     * @param timeoutSeconds the connect and read timeout
     * 
     * @return the provider
     * 
     * @throws IllegalArgumentException if the timeout is not positive,
     * or too long to express in milliseconds
     * 
     * @throws NoSuchAlgorithmException if TLS is not available
     * 
     * @throws KeyManagementException if the SSL context could not be
     * initialized
     */
    public static Supplier<HttpClient> trustingAll(int timeoutSeconds)
        throws NoSuchAlgorithmException,
            KeyManagementException {
        return unverifiedHost(contextOf(new TrustManager[] {
            new X509TrustManager() {
                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain,
                                               String authType) {}

                @Override
                public void checkClientTrusted(X509Certificate[] chain,
                                               String authType)
                    throws CertificateException {
                    throw new CertificateException("client certificates"
                        + " not expected");
                }
            } }), timeoutSeconds);
    }

    private static SSLContext contextOf(TrustManager[] tm)
        throws NoSuchAlgorithmException,
            KeyManagementException {
        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, tm, new SecureRandom());
        return sslContext;
    }

    private static Supplier<HttpClient> unverifiedHost(SSLContext sslContext,
                                                       int timeoutSeconds) {
        RequestConfig config = timeouts(timeoutSeconds);
        return () -> {
            HttpClientBuilder builder = HttpClients.custom()
                .setSSLContext(sslContext)
                .setSSLHostnameVerifier(new NoopHostnameVerifier())
                .setDefaultRequestConfig(config);
            return builder.build();
        };
    }
}
