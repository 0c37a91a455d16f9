package com.interfaceagent.orchestrator.agent;

import com.interfaceagent.orchestrator.model.AgentCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process registry mapping agent type names to factories.
 *
 * Every {@link AgentRegistration} bean is collected at startup via constructor
 * injection; the Plugin Loader adds more at runtime. Lookups vastly outnumber
 * registrations, so the map is guarded by a read/write lock rather than
 * synchronising every lookup.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Registration ({@link #register}): rejects a type name already bound to a
 *       different factory with DUPLICATE_TYPE; the existing binding is untouched.</li>
 *   <li>Construction ({@link #createAgent}): a fresh instance per call, except for
 *       reentrant registrations which get one cached instance per configuration.</li>
 *   <li>Replacement ({@link #replace}) and removal ({@link #unregister}): only used by
 *       an explicit plugin reload or unload.</li>
 * </ol>
 * Cached reentrant instances are dropped whenever their type is replaced or
 * removed, and on {@link #evictInstances} when an agent's configuration changes.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentRegistration> registrations = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Shared instances of reentrant agents, keyed by type and configuration.
    private final Map<InstanceKey, Agent> reentrantInstances = new ConcurrentHashMap<>();

    private record InstanceKey(String typeName, Map<String, Object> config) {}

    /**
     * Spring collects every {@code AgentRegistration} bean and passes the list here.
     * Adding a built-in agent only requires declaring its registration as a bean.
     */
    public AgentRegistry(List<AgentRegistration> builtIns) {
        for (AgentRegistration registration : builtIns) {
            register(registration);
        }
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    public void register(String typeName, AgentFactory factory) {
        register(AgentRegistration.of(typeName, AgentCategory.CUSTOM, factory));
    }

    /**
     * Bind a type name to a factory.
     *
     * Registering the same factory under the same name twice is a no-op.
     *
     * @throws AgentRegistryException DUPLICATE_TYPE if the name is bound to a different factory
     */
    public void register(AgentRegistration registration) {
        String typeName = requireTypeName(registration.typeName());
        lock.writeLock().lock();
        try {
            AgentRegistration existing = registrations.get(typeName);
            if (existing != null) {
                if (existing.factory() == registration.factory()) {
                    return;
                }
                throw new AgentRegistryException(AgentRegistryException.Kind.DUPLICATE_TYPE, typeName,
                        "Agent type '" + typeName + "' is already registered");
            }
            registrations.put(typeName, registration);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered agent type '{}' v{} [{}]{}",
                typeName, registration.version(), registration.category(),
                registration.reentrant() ? " (reentrant)" : "");
    }

    /**
     * Rebind a type name unconditionally and drop any cached reentrant instances
     * of it. Used by the Plugin Loader's explicit reload only.
     */
    public void replace(AgentRegistration registration) {
        String typeName = requireTypeName(registration.typeName());
        lock.writeLock().lock();
        try {
            registrations.put(typeName, registration);
            reentrantInstances.keySet().removeIf(k -> k.typeName().equals(typeName));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Replaced agent type '{}' v{}", typeName, registration.version());
    }

    /**
     * Remove a type name and its cached instances. Used by the Plugin Loader's explicit unload only.
     *
     * @return false if nothing was registered under the name
     */
    public boolean unregister(String typeName) {
        AgentRegistration removed;
        lock.writeLock().lock();
        try {
            removed = registrations.remove(typeName);
            reentrantInstances.keySet().removeIf(k -> k.typeName().equals(typeName));
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            log.info("Unregistered agent type '{}'", typeName);
        }
        return removed != null;
    }

    /** Drop the cached reentrant instances of a type; the next lookup builds fresh ones. */
    public int evictInstances(String typeName) {
        int before = reentrantInstances.size();
        reentrantInstances.keySet().removeIf(k -> k.typeName().equals(typeName));
        int evicted = before - reentrantInstances.size();
        if (evicted > 0) {
            log.debug("Evicted {} cached instance(s) of agent type '{}'", evicted, typeName);
        }
        return evicted;
    }

    // ------------------------------------------------------------------
    // Lookup + construction
    // ------------------------------------------------------------------

    public boolean contains(String typeName) {
        return find(typeName).isPresent();
    }

    public Optional<AgentRegistration> find(String typeName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(registrations.get(typeName));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Construct an agent of the given type bound to {@code config}.
     *
     * @throws AgentRegistryException UNKNOWN_TYPE if nothing is registered under the name,
     *                                INSTANTIATION_FAILED if the factory throws
     */
    public Agent createAgent(String typeName, Map<String, Object> config) {
        AgentRegistration registration = find(typeName).orElseThrow(() ->
                new AgentRegistryException(AgentRegistryException.Kind.UNKNOWN_TYPE, typeName,
                        "No agent type registered with name: '" + typeName + "'"));

        Map<String, Object> ownConfig = config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
        if (registration.reentrant()) {
            return reentrantInstances.computeIfAbsent(
                    new InstanceKey(typeName, Map.copyOf(withoutNulls(ownConfig))),
                    key -> instantiate(registration, ownConfig));
        }
        return instantiate(registration, ownConfig);
    }

    /** Snapshot of the registered type names. */
    public Set<String> listTypes() {
        lock.readLock().lock();
        try {
            return Set.copyOf(registrations.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshot of every registration, sorted by type name. */
    public List<AgentRegistration> registrations() {
        lock.readLock().lock();
        try {
            return registrations.values().stream()
                    .sorted(Comparator.comparing(AgentRegistration::typeName))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Agent instantiate(AgentRegistration registration, Map<String, Object> config) {
        Agent agent;
        try {
            agent = registration.factory().create(config);
        } catch (RuntimeException e) {
            throw new AgentRegistryException(AgentRegistryException.Kind.INSTANTIATION_FAILED,
                    registration.typeName(),
                    "Factory for '" + registration.typeName() + "' failed: " + e.getMessage(), e);
        }
        if (agent == null) {
            throw new AgentRegistryException(AgentRegistryException.Kind.INSTANTIATION_FAILED,
                    registration.typeName(), "Factory for '" + registration.typeName() + "' returned null");
        }
        return agent;
    }

    // Map.copyOf rejects null values; they carry no meaning in a cache key anyway.
    private static Map<String, Object> withoutNulls(Map<String, Object> config) {
        Map<String, Object> copy = new LinkedHashMap<>();
        config.forEach((k, v) -> { if (v != null) copy.put(k, v); });
        return copy;
    }

    private static String requireTypeName(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("Agent type name must not be blank");
        }
        return typeName;
    }
}
