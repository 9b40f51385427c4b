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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.vyos.mapper.MapperRegistry;
import uk.ac.lancs.vyos.path.CommandPath;

class OperationTableTest {
    private final MapperRegistry registry = MapperRegistry.standard();

    private static Map<String, String> op(String name, String value) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("op", name);
        if (value != null) result.put("value", value);
        return result;
    }

    @Test
    void dummyTableRejectsLinkSettings() {
        DummyBatchBuilder batch = new DummyBatchBuilder(registry, "1.5");
        assertFalse(OperationTable.DUMMY.supports("set_duplex"));
        IllegalArgumentException ex =
            assertThrows(IllegalArgumentException.class,
                         () -> OperationTable.DUMMY
                             .apply(batch, "dum0", "set_duplex", "full"));
        assertEquals("Unsupported operation: set_duplex", ex.getMessage());
        assertTrue(batch.isEmpty());
        assertTrue(OperationTable.ETHERNET.supports("set_duplex"));
    }

    @Test
    void compositeValueIsSplit() {
        EthernetBatchBuilder batch = new EthernetBatchBuilder(registry, "1.5");
        OperationTable.ETHERNET.apply(batch, "eth0", "set_vif_c_address",
                                      "100, 200 ,10.0.0.1/24");
        assertEquals(CommandPath.of("interfaces", "ethernet", "eth0",
                                    "vif-s", "100", "vif-c", "200",
                                    "address", "10.0.0.1/24"),
                     batch.getOperations().get(0).path);
    }

    @Test
    void namedVlanRequestsKeepOrder() {
        EthernetBatchBuilder batch = new EthernetBatchBuilder(registry, "1.5");
        OperationTable.ETHERNET.apply(batch, "eth0", "set_vif", "100");
        OperationTable.ETHERNET.apply(batch, "eth0", "set_vif_address",
                                      "100,10.1.1.1/24");
        List<Operation> ops = batch.getOperations();
        assertEquals(2, ops.size());
        assertEquals(CommandPath.of("interfaces", "ethernet", "eth0", "vif",
                                    "100"),
                     ops.get(0).path);
        assertEquals(CommandPath.of("interfaces", "ethernet", "eth0", "vif",
                                    "100", "address", "10.1.1.1/24"),
                     ops.get(1).path);
    }

    @Test
    void descriptionMayContainCommas() {
        EthernetBatchBuilder batch = new EthernetBatchBuilder(registry, "1.5");
        OperationTable.ETHERNET.apply(batch, "eth0", "set_vif_description",
                                      "10,core, west");
        assertEquals("core, west", batch.getOperations().get(0).path.leaf());
    }

    @Test
    void wrongPartCountIsMalformed() {
        EthernetBatchBuilder batch = new EthernetBatchBuilder(registry, "1.5");
        MalformedValueException ex =
            assertThrows(MalformedValueException.class,
                         () -> OperationTable.ETHERNET
                             .apply(batch, "eth0", "set_vif_address", "10"));
        assertEquals("set_vif_address", ex.getOperation());
        assertEquals("10", ex.getValue());
        assertThrows(MalformedValueException.class,
                     () -> OperationTable.ETHERNET
                         .apply(batch, "eth0", "set_vif_c", "100,"));
        assertTrue(batch.isEmpty());
    }

    @Test
    void valueIsRequiredWhereExpected() {
        DummyBatchBuilder batch = new DummyBatchBuilder(registry, "1.5");
        IllegalArgumentException ex =
            assertThrows(IllegalArgumentException.class,
                         () -> OperationTable.DUMMY.apply(batch, "dum0",
                                                          "set_mtu", ""));
        assertEquals("set_mtu requires a value", ex.getMessage());
        OperationTable.DUMMY.apply(batch, "dum0", "disable", null);
        assertEquals("disable", batch.getOperations().get(0).path.leaf());
    }

    @Test
    void requestsApplyInOrder() {
        DummyBatchBuilder batch = new DummyBatchBuilder(registry, "1.5");
        List<Map<String, String>> reqs =
            Arrays.asList(op("set_address", "203.0.113.1/32"),
                          op("set_description", "loopback"),
                          op("delete_mtu", null));
        OperationTable.DUMMY.applyAll(batch, "dum0", reqs);
        assertEquals(3, batch.operationCount());
        assertEquals(OperationKind.DELETE,
                     batch.getOperations().get(2).kind);
    }

    @Test
    void requestWithoutNameIsRejected() {
        DummyBatchBuilder batch = new DummyBatchBuilder(registry, "1.5");
        Map<String, String> bad = new HashMap<>();
        bad.put("value", "x");
        assertThrows(IllegalArgumentException.class,
                     () -> OperationTable.DUMMY
                         .applyAll(batch, "dum0",
                                   Collections.singletonList(bad)));
    }

    @Test
    void ipFlagNamesAreChecked() {
        EthernetBatchBuilder batch = new EthernetBatchBuilder(registry, "1.5");
        OperationTable.ETHERNET.apply(batch, "eth0", "set_ip_flag",
                                      "enable-proxy-arp");
        assertEquals("enable-proxy-arp",
                     batch.getOperations().get(0).path.leaf());
        assertThrows(IllegalArgumentException.class,
                     () -> OperationTable.ETHERNET
                         .apply(batch, "eth0", "set_ip_flag", "bogus"));
    }
}
