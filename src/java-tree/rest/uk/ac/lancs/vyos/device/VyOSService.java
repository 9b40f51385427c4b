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
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Logger;

import org.apache.http.client.HttpClient;

import uk.ac.lancs.vyos.batch.Batch;
import uk.ac.lancs.vyos.batch.DummyBatchBuilder;
import uk.ac.lancs.vyos.batch.EmptyBatchException;
import uk.ac.lancs.vyos.batch.EthernetBatchBuilder;
import uk.ac.lancs.vyos.batch.Operation;
import uk.ac.lancs.vyos.batch.RawBatchBuilder;
import uk.ac.lancs.vyos.mapper.MapperRegistry;
import uk.ac.lancs.vyos.mapper.interfaces.InterfaceMapper;
import uk.ac.lancs.vyos.mapper.interfaces.InterfaceModule;
import uk.ac.lancs.vyos.record.ConfigParseException;
import uk.ac.lancs.vyos.record.ConfigTree;
import uk.ac.lancs.vyos.record.InterfaceSummary;
import uk.ac.lancs.vyos.rest.APIResult;
import uk.ac.lancs.vyos.rest.DeviceResponseException;
import uk.ac.lancs.vyos.rest.DeviceTransport;
import uk.ac.lancs.vyos.rest.HttpProviders;
import uk.ac.lancs.vyos.rest.VyOSREST;

/**
 * Manages one device. Batches created here are mapped for the device's
 * version, and submitted through its transport. The device's
 * configuration tree is cached until a refresh is requested.
 * 
 * @author simpsons
 */
public final class VyOSService {
    private final String name;
    private final String version;
    private final DeviceTransport transport;
    private final MapperRegistry registry;
    private final ConfigTreeCache cache;

    /**
     * Create a service for a device.
     * 
     * @param name the device's name
     * 
     * @param version the device-software version
     * 
     * @param transport the means of reaching the device
     * 
     * @param registry the source of mappers
     */
    public VyOSService(String name, String version, DeviceTransport transport,
                       MapperRegistry registry) {
        this.name = name;
        this.version = version;
        this.transport = transport;
        this.registry = registry;
        this.cache = new ConfigTreeCache(name, this::fetchConfig);
    }

    /**
     * Create a service for a device reached over its HTTP API.
     * 
     * @param config the device's configuration
     * 
     * @param registry the source of mappers
     * 
     * @return the new service
     * 
     * @throws GeneralSecurityException if an HTTP client trusting the
     * device could not be set up
     * 
     * @throws IOException if the pinned certificate could not be read
     */
    public static VyOSService connect(DeviceConfig config,
                                      MapperRegistry registry)
        throws GeneralSecurityException,
            IOException {
        final Supplier<HttpClient> http;
        if (!config.verifySsl)
            http = HttpProviders.trustingAll(config.timeout);
        else
            http = HttpProviders
                .forCertificate(loadCertificate(config.certificate),
                                config.timeout);
        if (!config.verifySsl && config.protocol.equals("https"))
            logger.warning(() -> config.name
                + ": certificate verification is disabled");
        DeviceTransport transport =
            new VyOSREST(config.baseURI(), http, config.apiKey);
        return new VyOSService(config.name, config.version, transport,
                               registry);
    }

    private static X509Certificate loadCertificate(File file)
        throws IOException,
            CertificateException {
        if (file == null) return null;
        try (InputStream in = new FileInputStream(file)) {
            return (X509Certificate) CertificateFactory.getInstance("X.509")
                .generateCertificate(in);
        }
    }

    /**
     * Get the device's name.
     * 
     * @return the device's name
     */
    public String name() {
        return name;
    }

    /**
     * Get the device-software version.
     * 
     * @return the version
     */
    public String version() {
        return version;
    }

    /**
     * Create an empty batch for the device's ethernet interfaces.
     * 
     * @return the new batch
     */
    public EthernetBatchBuilder ethernetBatch() {
        return new EthernetBatchBuilder(registry, version);
    }

    /**
     * Create an empty batch for the device's dummy interfaces.
     * 
     * @return the new batch
     */
    public DummyBatchBuilder dummyBatch() {
        return new DummyBatchBuilder(registry, version);
    }

    /**
     * Create an empty batch accepting arbitrary paths.
     * 
     * @return the new batch
     */
    public RawBatchBuilder rawBatch() {
        return new RawBatchBuilder(version);
    }

    /**
     * Submit a batch to the device. The batch is marked as executed
     * once the device has answered, whether it accepted the batch or
     * not. If the device cannot be reached, the batch is left as it
     * was, and may be submitted again.
     * 
     * @param batch the batch to submit
     * 
     * @return the device's verdict on the whole batch
     * 
     * @throws EmptyBatchException if the batch has no operations, in
     * which case the device is not contacted
     * 
     * @throws IllegalStateException if the batch has already been
     * executed
     * 
     * @throws IOException if the device could not be reached, or its
     * response could not be understood
     */
    public APIResult<Object> execute(Batch batch) throws IOException {
        if (batch.isEmpty()) throw new EmptyBatchException(batch.version());
        if (batch.isExecuted())
            throw new IllegalStateException("batch already executed");
        List<Operation> ops = batch.getOperations();
        logger.fine(() -> String.format("%s: submitting %d operations"
            + " for VyOS %s", name, ops.size(), batch.version()));
        APIResult<Object> result = transport.configure(ops);
        batch.markExecuted();
        if (!result.success)
            logger.warning(() -> name + ": batch rejected: " + result.error);
        return result;
    }

    private Map<?, ?> fetchConfig() throws IOException, ConfigParseException {
        APIResult<Object> rsp = transport.showConfig(Collections.emptyList());
        if (!rsp.success)
            throw new DeviceResponseException(rsp.code, name
                + ": configuration not retrieved: " + rsp.error);
        return ConfigTree.asTree(rsp.data);
    }

    /**
     * Get the device's whole configuration tree.
     * 
     * @param refresh {@code true} to fetch the tree from the device even
     * if one is cached
     * 
     * @return the root of the tree
     * 
     * @throws IOException if the device could not be reached, or
     * refused the request
     * 
     * @throws ConfigParseException if the tree could not be decoded
     */
    public Map<?, ?> getFullConfig(boolean refresh)
        throws IOException,
            ConfigParseException {
        return cache.get(refresh);
    }

    /**
     * Parse the device's interfaces of one family.
     * 
     * @param family the family name, e.g.,
     * {@value InterfaceModule#ETHERNET}
     * 
     * @param refresh {@code true} to fetch the tree from the device even
     * if one is cached
     * 
     * @return a summary of the interfaces
     * 
     * @throws IOException if the device could not be reached, or
     * refused the request
     * 
     * @throws ConfigParseException if the tree could not be decoded
     */
    public InterfaceSummary getInterfaces(String family, boolean refresh)
        throws IOException,
            ConfigParseException {
        InterfaceMapper mapper =
            registry.resolve(family, version, InterfaceMapper.class);
        Map<?, ?> subtree = ConfigTree.slice(getFullConfig(refresh),
                                             "interfaces", mapper.type());
        return mapper.parseInterfacesOfType(subtree);
    }

    /**
     * Parse the device's ethernet interfaces.
     * 
     * @param refresh {@code true} to fetch the tree from the device even
     * if one is cached
     * 
     * @return a summary of the interfaces
     * 
     * @throws IOException if the device could not be reached, or
     * refused the request
     * 
     * @throws ConfigParseException if the tree could not be decoded
     */
    public InterfaceSummary getEthernetInterfaces(boolean refresh)
        throws IOException,
            ConfigParseException {
        return getInterfaces(InterfaceModule.ETHERNET, refresh);
    }

    /**
     * Parse the device's dummy interfaces.
     * 
     * @param refresh {@code true} to fetch the tree from the device even
     * if one is cached
     * 
     * @return a summary of the interfaces
     * 
     * @throws IOException if the device could not be reached, or
     * refused the request
     * 
     * @throws ConfigParseException if the tree could not be decoded
     */
    public InterfaceSummary getDummyInterfaces(boolean refresh)
        throws IOException,
            ConfigParseException {
        return getInterfaces(InterfaceModule.DUMMY, refresh);
    }

    @Override
    public String toString() {
        return name + " (VyOS " + version + ")";
    }

    private static final Logger logger =
        Logger.getLogger(VyOSService.class.getName());
}
