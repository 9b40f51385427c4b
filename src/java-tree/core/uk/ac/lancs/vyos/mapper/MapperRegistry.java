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
package uk.ac.lancs.vyos.mapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.logging.Logger;

import uk.ac.lancs.vyos.mapper.interfaces.InterfaceModule;

/**
 * Associates feature-family names with the factories that create their
 * mappers. A registry is assembled once through a {@link Builder}, and
 * is immutable thereafter, so it may be read from any thread without
 * locking.
 *
 * <p>
 * No mapper is cached. Each resolution creates a fresh mapper, which is
 * cheap as mappers hold nothing but their version.
 *
 * @author simpsons
 */
public final class MapperRegistry {
    private final Map<String, MapperFactory> factories;

    private MapperRegistry(Map<String, MapperFactory> factories) {
        this.factories = factories;
    }

    /**
     * Get the registered family names.
     *
     * @return an immutable set of family names in registration order
     */
    public Set<String> families() {
        return factories.keySet();
    }

    /**
     * Create a mapper for a family.
     *
     * @param family the family name
     *
     * @param version the device-software version
     *
     * @return a fresh mapper bound to the version
     *
     * @throws UnknownFeatureException if the family is not registered
     */
    public FeatureMapper resolve(String family, String version) {
        MapperFactory factory = factories.get(family);
        if (factory == null)
            throw new UnknownFeatureException(family, version);
        return factory.create(version);
    }

    /**
     * Create a mapper of an expected type for a family.
     *
     * @param <M> the expected mapper type
     *
     * @param family the family name
     *
     * @param version the device-software version
     *
     * @param type the expected mapper type
     *
     * @return a fresh mapper bound to the version
     *
     * @throws UnknownFeatureException if the family is not registered
     *
     * @throws MappingException if the family's mapper is not of the
     * expected type
     */
    public <M extends FeatureMapper> M resolve(String family, String version,
                                               Class<M> type) {
        FeatureMapper mapper = resolve(family, version);
        if (!type.isInstance(mapper))
            throw new MappingException(version, "family " + family
                + " has mapper " + mapper.getClass().getName() + ", not "
                + type.getName());
        return type.cast(mapper);
    }

    /**
     * Create a mapper for every registered family.
     *
     * @param version the device-software version
     *
     * @return an immutable map from family name to fresh mapper
     */
    public Map<String, FeatureMapper> resolveAll(String version) {
        Map<String, FeatureMapper> result = new LinkedHashMap<>();
        for (Map.Entry<String, MapperFactory> entry : factories.entrySet())
            result.put(entry.getKey(), entry.getValue().create(version));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Start building a registry.
     *
     * @return a fresh, empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get a registry holding the families supplied with this library,
     * namely {@value InterfaceModule#ETHERNET} and
     * {@value InterfaceModule#DUMMY}.
     *
     * @return the standard registry
     */
    public static MapperRegistry standard() {
        return STANDARD;
    }

    private static final MapperRegistry STANDARD =
        builder().install(new InterfaceModule()).build();

    /**
     * Accumulates registrations. The last registration for a name wins.
     */
    public static final class Builder {
        private final Map<String, MapperFactory> factories =
            new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register a family.
         *
         * @param family the family name
         *
         * @param factory the mapper factory, e.g., a constructor
         * taking a version string
         *
         * @return this object
         */
        public Builder register(String family, MapperFactory factory) {
            if (family == null) throw new NullPointerException("family");
            if (factory == null) throw new NullPointerException("factory");
            if (factories.put(family, factory) != null)
                logger.fine(() -> "replaced registration of " + family);
            return this;
        }

        /**
         * Register the families of a module.
         *
         * @param module the module
         *
         * @return this object
         */
        public Builder install(FeatureModule module) {
            module.register(this);
            return this;
        }

        /**
         * Register the families of all modules declared as services.
         *
         * @param loader the class loader to search
         *
         * @return this object
         */
        public Builder loadModules(ClassLoader loader) {
            for (FeatureModule module : ServiceLoader
                .load(FeatureModule.class, loader))
                install(module);
            return this;
        }

        /**
         * Create the registry. The builder may be discarded or reused.
         *
         * @return an immutable registry with the registrations made so
         * far
         */
        public MapperRegistry build() {
            MapperRegistry result = new MapperRegistry(Collections
                .unmodifiableMap(new LinkedHashMap<>(factories)));
            logger.config(() -> "mapper families: " + result.families());
            return result;
        }
    }

    private static final Logger logger =
        Logger.getLogger(MapperRegistry.class.getName());
}
