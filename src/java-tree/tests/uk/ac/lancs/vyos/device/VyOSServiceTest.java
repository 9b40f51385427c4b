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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.batch.EmptyBatchException;
import uk.ac.lancs.vyos.batch.EthernetBatchBuilder;
import uk.ac.lancs.vyos.mapper.MapperRegistry;
import uk.ac.lancs.vyos.path.CommandPath;
import uk.ac.lancs.vyos.record.ConfigParseException;
import uk.ac.lancs.vyos.record.ConfigTree;
import uk.ac.lancs.vyos.record.InterfaceSummary;
import uk.ac.lancs.vyos.rest.APIResult;
import uk.ac.lancs.vyos.rest.DeviceResponseException;

class VyOSServiceTest {
    private RecordingTransport transport;
    private VyOSService service;

    @BeforeEach
    void setUp() throws ConfigParseException {
        transport = new RecordingTransport();
        transport.tree = ConfigTree.parse("{\"interfaces\":{"
            + "\"ethernet\":{\"eth0\":{\"address\":\"192.0.2.1/24\","
            + "\"vrf\":\"mgmt\"},\"eth1\":{}},"
            + "\"dummy\":{\"dum0\":{}}}}");
        service = new VyOSService("edge1", "1.5", transport,
                                  MapperRegistry.standard());
    }

    @Test
    void emptyBatchNeverReachesDevice() {
        EthernetBatchBuilder batch = service.ethernetBatch();
        assertThrows(EmptyBatchException.class,
                     () -> service.execute(batch));
        assertTrue(transport.configured.isEmpty());
        assertFalse(batch.isExecuted());
    }

    @Test
    void batchIsSubmittedOnce() throws IOException {
        EthernetBatchBuilder batch = service.ethernetBatch()
            .setInterfaceDescription("eth0", "uplink")
            .setInterfaceMtu("eth0", "9000");
        APIResult<Object> result = service.execute(batch);
        assertTrue(result.success);
        assertEquals(1, transport.configured.size());
        assertEquals(batch.getOperations(), transport.configured.get(0));
        assertThrows(IllegalStateException.class,
                     () -> service.execute(batch));
        assertEquals(1, transport.configured.size());
    }

    @Test
    void unreachableDeviceLeavesBatchOpen() throws IOException {
        EthernetBatchBuilder batch = service.ethernetBatch()
            .setInterfaceDescription("eth0", "uplink");
        transport.failure = new IOException("connection refused");
        assertThrows(IOException.class, () -> service.execute(batch));
        assertFalse(batch.isExecuted());
        assertEquals(1, batch.operationCount());

        transport.failure = null;
        assertTrue(service.execute(batch).success);
        assertTrue(batch.isExecuted());
        assertEquals(1, transport.configured.size());
    }

    @Test
    void rejectedBatchIsStillSealed() throws IOException {
        transport.accept = false;
        EthernetBatchBuilder batch = service.ethernetBatch()
            .setInterfaceMtu("eth0", "9000");
        assertFalse(service.execute(batch).success);
        assertTrue(batch.isExecuted());
    }

    @Test
    void rejectionIsReturnedNotThrown() throws IOException {
        transport.accept = false;
        APIResult<Object> result = service
            .execute(service.dummyBatch().setInterfaceDisable("dum0"));
        assertFalse(result.success);
        assertEquals("rejected", result.error);
    }

    @Test
    void treeIsCachedUntilRefresh()
        throws IOException,
            ConfigParseException {
        service.getFullConfig(false);
        service.getEthernetInterfaces(false);
        service.getDummyInterfaces(false);
        assertEquals(1, transport.showConfigCalls);
        service.getFullConfig(true);
        assertEquals(2, transport.showConfigCalls);
    }

    @Test
    void executionLeavesCacheAlone()
        throws IOException,
            ConfigParseException {
        service.getFullConfig(false);
        service.execute(service.rawBatch()
            .addDelete(CommandPath.of("interfaces", "dummy", "dum0")));
        service.getFullConfig(false);
        assertEquals(1, transport.showConfigCalls);
    }

    @Test
    void interfacesAreSummarized()
        throws IOException,
            ConfigParseException {
        InterfaceSummary eth = service.getEthernetInterfaces(false);
        assertEquals(2, eth.total);
        assertEquals(1, eth.byVrf.get("mgmt"));
        assertEquals(1, service.getDummyInterfaces(false).total);
    }

    @Test
    void failedRetrievalIsReported() {
        transport.tree = null;
        DeviceResponseException ex =
            assertThrows(DeviceResponseException.class,
                         () -> service.getFullConfig(false));
        assertEquals(500, ex.getCode());
    }
}
