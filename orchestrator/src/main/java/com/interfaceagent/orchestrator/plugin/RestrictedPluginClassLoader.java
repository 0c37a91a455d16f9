package com.interfaceagent.orchestrator.plugin;

import com.interfaceagent.orchestrator.agent.Agent;

import java.util.List;

/**
 * Parent class loader for external plugin modules.
 *
 * Only the JDK, the Jakarta APIs, SLF4J and the agent contract package are
 * visible through it; every other class of the service (orchestration,
 * repositories, event bus, Spring) resolves to {@link ClassNotFoundException},
 * including lookups made through {@code Class.forName}. Classes inside the
 * plugin module itself are then found by the child {@code URLClassLoader}.
 */
final class RestrictedPluginClassLoader extends ClassLoader {

    static final List<String> ALLOWED_PREFIXES = List.of(
            "java.",
            "javax.",
            "jakarta.",
            "org.slf4j.",
            Agent.class.getPackageName() + ".");

    private final ClassLoader serviceLoader;

    RestrictedPluginClassLoader() {
        super(null);
        this.serviceLoader = Agent.class.getClassLoader();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (!isAllowed(name)) {
                    throw new ClassNotFoundException("Access denied: " + name
                            + " (plugins may only use " + String.join("*, ", ALLOWED_PREFIXES) + "*)");
                }
                c = serviceLoader.loadClass(name);
            }
            if (resolve) resolveClass(c);
            return c;
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : ALLOWED_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }
}
