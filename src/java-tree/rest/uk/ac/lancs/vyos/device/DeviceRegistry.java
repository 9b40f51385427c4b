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

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import uk.ac.lancs.vyos.config.Configuration;
import uk.ac.lancs.vyos.mapper.MapperRegistry;

/**
 * Holds the services of managed devices by name.
 * 
 * @author simpsons
 */
public final class DeviceRegistry {
    private final Map<String, VyOSService> devices = new LinkedHashMap<>();

    /**
     * Register a device, replacing any with the same name.
     * 
     * @param service the device's service
     */
    public synchronized void register(VyOSService service) {
        if (devices.put(service.name(), service) != null)
            logger.fine(() -> "replaced device " + service.name());
    }

    /**
     * Get a device's service.
     * 
     * @param name the device's name
     * 
     * @return the device's service
     * 
     * @throws UnknownDeviceException if no device has the name
     */
    public synchronized VyOSService get(String name) {
        VyOSService result = devices.get(name);
        if (result == null) throw new UnknownDeviceException(name);
        return result;
    }

    /**
     * Remove a device. Nothing happens if no device has the name.
     * 
     * @param name the device's name
     */
    public synchronized void unregister(String name) {
        devices.remove(name);
    }

    /**
     * List the registered devices.
     * 
     * @return the device names in registration order
     */
    public synchronized List<String> list() {
        return new ArrayList<>(devices.keySet());
    }

    /**
     * Remove all devices.
     */
    public synchronized void clear() {
        devices.clear();
    }

    /**
     * Create a registry holding the devices listed in a configuration.
     * The names of devices are listed by <samp>devices</samp>, and each
     * device's settings are in the subview
     * <samp>device.<var>name</var></samp>, as read by
     * {@link DeviceConfig#fromConfiguration(String, Configuration)}.
     * 
     * @param conf the configuration
     * 
     * @param mappers the source of mappers for all devices
     * 
     * @return the new registry
     * 
     * @throws IllegalArgumentException if a device's settings are
     * invalid
     * 
     * @throws GeneralSecurityException if an HTTP client for a device
     * could not be set up
     * 
     * @throws IOException if a device's pinned certificate could not be
     * read
     */
    public static DeviceRegistry fromConfiguration(Configuration conf,
                                                   MapperRegistry mappers)
        throws GeneralSecurityException,
            IOException {
        DeviceRegistry result = new DeviceRegistry();
        for (String name : conf.list("devices")) {
            DeviceConfig dc = DeviceConfig
                .fromConfiguration(name, conf.subview("device." + name));
            result.register(VyOSService.connect(dc, mappers));
            logger.config(() -> "device " + dc);
        }
        return result;
    }

    private static final Logger logger =
        Logger.getLogger(DeviceRegistry.class.getName());
}
