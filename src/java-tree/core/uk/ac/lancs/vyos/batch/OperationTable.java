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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import uk.ac.lancs.vyos.mapper.interfaces.IpFlag;
import uk.ac.lancs.vyos.mapper.interfaces.Offload;

/**
 * Applies named operations, as received in requests, to a typed batch.
 * A request names an operation such as <samp>set_mtu</samp> and
 * optionally supplies a value. Operations on sub-interfaces take a
 * composite value, with the identifiers and the attribute value
 * separated by commas, e.g., <samp>100,10.1.1.1/24</samp> for
 * <samp>set_vif_address</samp>.
 * 
 * <p>
 * A family's table contains only the operations its batch type offers,
 * so an ethernet-only operation named against the dummy table is
 * rejected as unsupported.
 * 
 * @param <B> the batch type
 * 
 * @author simpsons
 */
public final class OperationTable<B extends InterfaceOperations<B>> {
    /**
     * Queues one named operation on a batch.
     * 
     * @param <B> the batch type
     */
    @FunctionalInterface
    public interface Handler<B> {
        /**
         * Queue the operation.
         * 
         * @param batch the batch to queue on
         * 
         * @param iface the interface name
         * 
         * @param value the supplied value, or {@code null} if the
         * operation takes none
         */
        void apply(B batch, String iface, String value);
    }

    private static final class Entry<B> {
        final boolean needsValue;
        final Handler<B> handler;

        Entry(boolean needsValue, Handler<B> handler) {
            this.needsValue = needsValue;
            this.handler = handler;
        }
    }

    private final Map<String, Entry<B>> entries;

    private OperationTable(Map<String, Entry<B>> entries) {
        this.entries = entries;
    }

    /**
     * Get the names of the operations in this table.
     * 
     * @return an immutable set of operation names
     */
    public Set<String> operations() {
        return entries.keySet();
    }

    /**
     * Determine whether an operation is in this table.
     * 
     * @param op the operation name
     * 
     * @return {@code true} iff the operation is supported
     */
    public boolean supports(String op) {
        return entries.containsKey(op);
    }

    /**
     * Apply a named operation to a batch.
     * 
     * @param batch the batch to queue on
     * 
     * @param iface the interface name
     * 
     * @param op the operation name
     * 
     * @param value the operation's value, or {@code null}
     * 
     * @return the batch
     * 
     * @throws IllegalArgumentException if the operation is not in this
     * table, or needs a value and none was supplied
     * 
     * @throws MalformedValueException if a composite value has the
     * wrong number of parts
     */
    public B apply(B batch, String iface, String op, String value) {
        if (op == null || op.isEmpty())
            throw new IllegalArgumentException("operation has no name");
        Entry<B> entry = entries.get(op);
        if (entry == null)
            throw new IllegalArgumentException("Unsupported operation: "
                + op);
        if (entry.needsValue && (value == null || value.isEmpty()))
            throw new IllegalArgumentException(op + " requires a value");
        entry.handler.apply(batch, iface, value);
        return batch;
    }

    /**
     * Apply a sequence of named operations to a batch, in order. Each
     * operation is a map with an <samp>op</samp> entry and an optional
     * <samp>value</samp> entry, as decoded from a request.
     * 
     * @param batch the batch to queue on
     * 
     * @param iface the interface name
     * 
     * @param requests the operations
     * 
     * @return the batch
     * 
     * @throws IllegalArgumentException if an operation lacks a name, is
     * not in this table, or needs a value and none was supplied
     * 
     * @throws MalformedValueException if a composite value has the
     * wrong number of parts
     */
    public B applyAll(B batch, String iface,
                      Iterable<? extends Map<?, ?>> requests) {
        for (Map<?, ?> req : requests) {
            Object op = req.get("op");
            if (op == null)
                throw new IllegalArgumentException("Invalid operation: "
                    + req + ". Must have 'op' key");
            Object value = req.get("value");
            apply(batch, iface, op.toString(),
                  value == null ? null : value.toString());
        }
        return batch;
    }

    /**
     * Split a composite value into a fixed number of parts. The last
     * part keeps any further commas.
     * 
     * @param version the device-software version, for reporting
     * 
     * @param op the operation name, for reporting
     * 
     * @param value the composite value
     * 
     * @param expected the expected form, e.g.,
     * <samp>vlan,address</samp>
     * 
     * @return the parts, trimmed
     * 
     * @throws MalformedValueException if the value does not have the
     * expected number of non-empty parts
     */
    static String[] split(String version, String op, String value,
                          String expected) {
        int count = expected.split(",").length;
        String[] parts = value.split(",", count);
        if (parts.length != count)
            throw new MalformedValueException(version, op, value, expected);
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
            if (parts[i].isEmpty())
                throw new MalformedValueException(version, op, value,
                                                  expected);
        }
        return parts;
    }

    /**
     * Accumulates the entries of a table.
     * 
     * @param <B> the batch type
     */
    private static final class Builder<B extends InterfaceOperations<B>> {
        private final Map<String, Entry<B>> entries = new LinkedHashMap<>();

        Builder<B> valued(String op, Handler<B> handler) {
            entries.put(op, new Entry<>(true, handler));
            return this;
        }

        Builder<B> bare(String op, Handler<B> handler) {
            entries.put(op, new Entry<>(false, handler));
            return this;
        }

        OperationTable<B> build() {
            return new OperationTable<>(Collections
                .unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }

    private static <B extends IpOperations<B> & Ipv6Operations<B> & MirrorOperations<B>>
        Builder<B> common() {
        Builder<B> b = new Builder<>();
        b.valued("set_description",
                 (x, i, v) -> x.setInterfaceDescription(i, v));
        b.bare("delete_description",
               (x, i, v) -> x.deleteInterfaceDescription(i));
        b.valued("set_address", (x, i, v) -> x.setInterfaceAddress(i, v));
        b.valued("delete_address",
                 (x, i, v) -> x.deleteInterfaceAddress(i, v));
        b.valued("set_mtu", (x, i, v) -> x.setInterfaceMtu(i, v));
        b.bare("delete_mtu", (x, i, v) -> x.deleteInterfaceMtu(i));
        b.valued("set_vrf", (x, i, v) -> x.setInterfaceVrf(i, v));
        b.valued("delete_vrf", (x, i, v) -> x.deleteInterfaceVrf(i, v));
        b.bare("disable", (x, i, v) -> x.setInterfaceDisable(i));
        b.bare("enable", (x, i, v) -> x.deleteInterfaceDisable(i));
        b.bare("delete_interface", (x, i, v) -> x.deleteInterface(i));

        b.valued("set_ip_adjust_mss", (x, i, v) -> x.setIpAdjustMss(i, v));
        b.bare("delete_ip_adjust_mss", (x, i, v) -> x.deleteIpAdjustMss(i));
        b.valued("set_ip_arp_cache_timeout",
                 (x, i, v) -> x.setIpArpCacheTimeout(i, v));
        b.bare("delete_ip_arp_cache_timeout",
               (x, i, v) -> x.deleteIpArpCacheTimeout(i));
        b.valued("set_ip_flag",
                 (x, i, v) -> x.setIpFlag(i, IpFlag.forSegment(v)));
        b.valued("delete_ip_flag",
                 (x, i, v) -> x.deleteIpFlag(i, IpFlag.forSegment(v)));
        b.valued("set_ip_source_validation",
                 (x, i, v) -> x.setIpSourceValidation(i, v));
        b.bare("delete_ip_source_validation",
               (x, i, v) -> x.deleteIpSourceValidation(i));
        b.bare("enable_directed_broadcast",
               (x, i, v) -> x.setIpEnableDirectedBroadcast(i));
        b.bare("disable_directed_broadcast",
               (x, i, v) -> x.deleteIpEnableDirectedBroadcast(i));

        b.bare("set_ipv6_autoconf", (x, i, v) -> x.setIpv6Autoconf(i));
        b.bare("delete_ipv6_autoconf", (x, i, v) -> x.deleteIpv6Autoconf(i));
        b.valued("set_ipv6_eui64", (x, i, v) -> x.setIpv6Eui64(i, v));
        b.valued("delete_ipv6_eui64", (x, i, v) -> x.deleteIpv6Eui64(i, v));
        b.valued("set_ipv6_adjust_mss",
                 (x, i, v) -> x.setIpv6AdjustMss(i, v));
        b.bare("delete_ipv6_adjust_mss",
               (x, i, v) -> x.deleteIpv6AdjustMss(i));
        b.bare("disable_ipv6_forwarding",
               (x, i, v) -> x.setIpv6DisableForwarding(i));
        b.bare("enable_ipv6_forwarding",
               (x, i, v) -> x.deleteIpv6DisableForwarding(i));

        b.valued("set_mirror_ingress",
                 (x, i, v) -> x.setMirrorIngress(i, v));
        b.bare("delete_mirror_ingress",
               (x, i, v) -> x.deleteMirrorIngress(i));
        b.valued("set_mirror_egress", (x, i, v) -> x.setMirrorEgress(i, v));
        b.bare("delete_mirror_egress", (x, i, v) -> x.deleteMirrorEgress(i));
        return b;
    }

    /**
     * The operations applicable to dummy interfaces
     */
    public static final OperationTable<DummyBatchBuilder> DUMMY =
        OperationTable.<DummyBatchBuilder>common().build();

    /**
     * The operations applicable to ethernet interfaces
     */
    public static final OperationTable<EthernetBatchBuilder> ETHERNET;

    static {
        Builder<EthernetBatchBuilder> b = common();
        b.valued("set_duplex", (x, i, v) -> x.setInterfaceDuplex(i, v));
        b.bare("delete_duplex", (x, i, v) -> x.deleteInterfaceDuplex(i));
        b.valued("set_speed", (x, i, v) -> x.setInterfaceSpeed(i, v));
        b.bare("delete_speed", (x, i, v) -> x.deleteInterfaceSpeed(i));
        b.valued("set_hw_id", (x, i, v) -> x.setInterfaceHwId(i, v));
        b.bare("delete_hw_id", (x, i, v) -> x.deleteInterfaceHwId(i));
        b.valued("set_offload",
                 (x, i, v) -> x.setOffload(i, Offload.forSegment(v)));
        b.valued("delete_offload",
                 (x, i, v) -> x.deleteOffload(i, Offload.forSegment(v)));
        b.valued("set_ring_buffer_rx",
                 (x, i, v) -> x.setRingBufferRx(i, v));
        b.bare("delete_ring_buffer_rx",
               (x, i, v) -> x.deleteRingBufferRx(i));
        b.valued("set_ring_buffer_tx",
                 (x, i, v) -> x.setRingBufferTx(i, v));
        b.bare("delete_ring_buffer_tx",
               (x, i, v) -> x.deleteRingBufferTx(i));

        b.valued("set_dhcp_client_id", (x, i, v) -> x.setDhcpClientId(i, v));
        b.bare("delete_dhcp_client_id", (x, i, v) -> x.deleteDhcpClientId(i));
        b.valued("set_dhcp_host_name", (x, i, v) -> x.setDhcpHostName(i, v));
        b.bare("delete_dhcp_host_name", (x, i, v) -> x.deleteDhcpHostName(i));
        b.valued("set_dhcp_vendor_class_id",
                 (x, i, v) -> x.setDhcpVendorClassId(i, v));
        b.bare("delete_dhcp_vendor_class_id",
               (x, i, v) -> x.deleteDhcpVendorClassId(i));
        b.valued("set_dhcp_default_route_distance",
                 (x, i, v) -> x.setDhcpDefaultRouteDistance(i, v));
        b.bare("delete_dhcp_default_route_distance",
               (x, i, v) -> x.deleteDhcpDefaultRouteDistance(i));
        b.bare("set_dhcp_no_default_route",
               (x, i, v) -> x.setDhcpNoDefaultRoute(i));
        b.bare("delete_dhcp_no_default_route",
               (x, i, v) -> x.deleteDhcpNoDefaultRoute(i));
        b.valued("set_dhcp_reject", (x, i, v) -> x.setDhcpReject(i, v));
        b.valued("delete_dhcp_reject", (x, i, v) -> x.deleteDhcpReject(i, v));
        b.valued("set_dhcpv6_duid", (x, i, v) -> x.setDhcpv6Duid(i, v));
        b.bare("delete_dhcpv6_duid", (x, i, v) -> x.deleteDhcpv6Duid(i));
        b.bare("set_dhcpv6_rapid_commit",
               (x, i, v) -> x.setDhcpv6RapidCommit(i));
        b.bare("delete_dhcpv6_rapid_commit",
               (x, i, v) -> x.deleteDhcpv6RapidCommit(i));
        b.bare("set_dhcpv6_parameters_only",
               (x, i, v) -> x.setDhcpv6ParametersOnly(i));
        b.bare("delete_dhcpv6_parameters_only",
               (x, i, v) -> x.deleteDhcpv6ParametersOnly(i));
        b.bare("set_dhcpv6_temporary", (x, i, v) -> x.setDhcpv6Temporary(i));
        b.bare("delete_dhcpv6_temporary",
               (x, i, v) -> x.deleteDhcpv6Temporary(i));

        b.valued("set_vif", (x, i, v) -> x.setVif(i, v));
        b.valued("delete_vif", (x, i, v) -> x.deleteVif(i, v));
        b.valued("set_vif_address", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_address", v,
                               "vlan,address");
            x.setVifAddress(i, p[0], p[1]);
        });
        b.valued("delete_vif_address", (x, i, v) -> {
            String[] p = split(x.version(), "delete_vif_address", v,
                               "vlan,address");
            x.deleteVifAddress(i, p[0], p[1]);
        });
        b.valued("set_vif_description", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_description", v,
                               "vlan,description");
            x.setVifDescription(i, p[0], p[1]);
        });
        b.valued("delete_vif_description",
                 (x, i, v) -> x.deleteVifDescription(i, v));
        b.valued("set_vif_mtu", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_mtu", v, "vlan,mtu");
            x.setVifMtu(i, p[0], p[1]);
        });
        b.valued("delete_vif_mtu", (x, i, v) -> x.deleteVifMtu(i, v));
        b.valued("set_vif_vrf", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_vrf", v, "vlan,vrf");
            x.setVifVrf(i, p[0], p[1]);
        });
        b.valued("delete_vif_vrf", (x, i, v) -> x.deleteVifVrf(i, v));
        b.valued("disable_vif", (x, i, v) -> x.setVifDisable(i, v));
        b.valued("enable_vif", (x, i, v) -> x.deleteVifDisable(i, v));

        b.valued("set_vif_s", (x, i, v) -> x.setVifS(i, v));
        b.valued("delete_vif_s", (x, i, v) -> x.deleteVifS(i, v));
        b.valued("set_vif_s_address", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_s_address", v,
                               "svid,address");
            x.setVifSAddress(i, p[0], p[1]);
        });
        b.valued("delete_vif_s_address", (x, i, v) -> {
            String[] p = split(x.version(), "delete_vif_s_address", v,
                               "svid,address");
            x.deleteVifSAddress(i, p[0], p[1]);
        });
        b.valued("set_vif_s_protocol", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_s_protocol", v,
                               "svid,protocol");
            x.setVifSProtocol(i, p[0], p[1]);
        });
        b.valued("set_vif_c", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_c", v, "svid,cvid");
            x.setVifC(i, p[0], p[1]);
        });
        b.valued("delete_vif_c", (x, i, v) -> {
            String[] p = split(x.version(), "delete_vif_c", v, "svid,cvid");
            x.deleteVifC(i, p[0], p[1]);
        });
        b.valued("set_vif_c_address", (x, i, v) -> {
            String[] p = split(x.version(), "set_vif_c_address", v,
                               "svid,cvid,address");
            x.setVifCAddress(i, p[0], p[1], p[2]);
        });
        b.valued("delete_vif_c_address", (x, i, v) -> {
            String[] p = split(x.version(), "delete_vif_c_address", v,
                               "svid,cvid,address");
            x.deleteVifCAddress(i, p[0], p[1], p[2]);
        });

        b.bare("set_evpn_uplink", (x, i, v) -> x.setEvpnUplink(i));
        b.bare("delete_evpn_uplink", (x, i, v) -> x.deleteEvpnUplink(i));
        ETHERNET = b.build();
    }
}
