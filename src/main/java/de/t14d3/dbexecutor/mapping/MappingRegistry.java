package de.t14d3.dbexecutor.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicitly registered mappings.
 * <p>
 * Registering a type builds and validates its {@link EntityMetadata} once. Types that
 * were never registered are described again on every lookup.
 */
public class MappingRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(MappingRegistry.class);

    private final Map<Class<?>, EntityMetadata> registered = new ConcurrentHashMap<>();

    /**
     * Registers the given types.
     *
     * @throws de.t14d3.dbexecutor.exceptions.MappingException if a mapping is invalid
     */
    public MappingRegistry register(Class<?>... types) {
        for (Class<?> type : types) {
            EntityMetadata metadata = EntityMetadata.describe(type);
            registered.put(type, metadata);
            LOG.debug("Registered mapping {}", metadata);
        }
        return this;
    }

    public boolean isRegistered(Class<?> type) {
        return registered.containsKey(type);
    }

    public Set<Class<?>> getRegisteredTypes() {
        return Collections.unmodifiableSet(registered.keySet());
    }

    /**
     * Returns the registered mapping for the type, or a freshly described one.
     */
    public EntityMetadata metadataFor(Class<?> type) {
        EntityMetadata metadata = registered.get(type);
        return metadata != null ? metadata : EntityMetadata.describe(type);
    }
}
