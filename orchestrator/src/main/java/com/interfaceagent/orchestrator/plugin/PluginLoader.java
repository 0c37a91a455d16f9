package com.interfaceagent.orchestrator.plugin;

import com.interfaceagent.orchestrator.agent.Agent;
import com.interfaceagent.orchestrator.agent.AgentException;
import com.interfaceagent.orchestrator.agent.AgentFactory;
import com.interfaceagent.orchestrator.agent.AgentRegistration;
import com.interfaceagent.orchestrator.agent.AgentRegistry;
import com.interfaceagent.orchestrator.model.AgentCategory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.jar.JarFile;

/**
 * Resolves agent implementations from external modules and registers them
 * with the {@link AgentRegistry}.
 *
 * <p>A module reference is one of:
 * <ul>
 *   <li>{@code classpath:}: the service's own class path;</li>
 *   <li>a path to a {@code .jar} file;</li>
 *   <li>a path to a directory of compiled classes.</li>
 * </ul>
 * The symbol is the fully qualified class name. Jar and directory modules get
 * their own {@link URLClassLoader} whose parent is a {@link RestrictedPluginClassLoader}.
 *
 * <p>The class either implements {@link Agent} or is duck-typed: it declares a
 * public {@code execute(Map)} returning a Map, and optionally
 * {@code validateInput(Map)} and {@code onError(..., Map)}. Either way it needs a
 * public constructor taking the configuration map, or a public no-arg constructor.
 *
 * <p>Resolved classes are cached by (module, symbol) until {@link #reload} or
 * {@link #unload} is called for that pair; nothing invalidates the cache implicitly.
 */
@Component
public class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    public static final String CLASSPATH_MODULE = "classpath:";

    private final AgentRegistry registry;

    private final Map<PluginKey, LoadedPlugin> cache = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    record PluginKey(String moduleRef, String symbol) {}

    /** What {@link #listLoaded} reports for one cached plugin. */
    public record PluginInfo(String moduleRef, String symbol, String className,
                             List<String> typeNames, Instant loadedAt) {}

    private static final class LoadedPlugin {
        final PluginKey      key;
        final Class<?>       type;
        final AgentFactory   baseFactory;
        final URLClassLoader loader;      // null for classpath: modules
        final Instant        loadedAt = Instant.now();
        // type name -> configuration it was registered with
        final Map<String, Map<String, Object>> bindings = new LinkedHashMap<>();
        final Map<String, AgentRegistration>   registrations = new HashMap<>();

        LoadedPlugin(PluginKey key, Class<?> type, AgentFactory baseFactory, URLClassLoader loader) {
            this.key         = key;
            this.type        = type;
            this.baseFactory = baseFactory;
            this.loader      = loader;
        }
    }

    public PluginLoader(AgentRegistry registry) {
        this.registry = registry;
    }

    // ------------------------------------------------------------------
    // Load / reload
    // ------------------------------------------------------------------

    /**
     * Resolve {@code symbol} from {@code moduleRef} and register it as {@code typeName}.
     * Instances receive {@code config} overlaid by the configuration passed to
     * {@link AgentRegistry#createAgent}.
     *
     * Loading the same (module, symbol, type name, config) again returns the
     * existing registration.
     *
     * @throws PluginException on resolution or contract failure
     * @throws com.interfaceagent.orchestrator.agent.AgentRegistryException DUPLICATE_TYPE
     *         if {@code typeName} is already bound to something else
     */
    public AgentRegistration load(String moduleRef, String symbol, String typeName, Map<String, Object> config) {
        PluginKey key = new PluginKey(moduleRef, symbol);
        Map<String, Object> baseConfig = config == null ? Map.of() : new LinkedHashMap<>(config);

        lock.readLock().lock();
        try {
            AgentRegistration existing = boundRegistration(cache.get(key), typeName, baseConfig);
            if (existing != null) return existing;
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            LoadedPlugin plugin = cache.get(key);
            AgentRegistration existing = boundRegistration(plugin, typeName, baseConfig);
            if (existing != null) return existing;

            boolean fresh = plugin == null;
            if (fresh) {
                plugin = resolve(key);
            }
            AgentRegistration registration = registrationFor(plugin, typeName, baseConfig);
            try {
                registry.register(registration);
            } catch (RuntimeException e) {
                if (fresh) closeQuietly(plugin);
                throw e;
            }
            plugin.bindings.put(typeName, baseConfig);
            plugin.registrations.put(typeName, registration);
            if (fresh) cache.put(key, plugin);

            log.info("Loaded plugin {} from {} as agent type '{}'", symbol, moduleRef, typeName);
            return registration;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drop the cached class for (module, symbol), resolve it again and rebind every
     * type name registered from it. If resolution fails the old binding stays in place.
     *
     * @return the type names that were rebound
     */
    public List<String> reload(String moduleRef, String symbol) {
        PluginKey key = new PluginKey(moduleRef, symbol);
        lock.writeLock().lock();
        try {
            LoadedPlugin old = cache.get(key);
            if (old == null) {
                throw new PluginException(PluginException.Kind.PLUGIN_NOT_FOUND, moduleRef, symbol,
                        "Plugin has not been loaded");
            }
            LoadedPlugin fresh = resolve(key);
            for (Map.Entry<String, Map<String, Object>> binding : old.bindings.entrySet()) {
                AgentRegistration registration = registrationFor(fresh, binding.getKey(), binding.getValue());
                registry.replace(registration);
                fresh.bindings.put(binding.getKey(), binding.getValue());
                fresh.registrations.put(binding.getKey(), registration);
            }
            cache.put(key, fresh);
            closeQuietly(old);

            log.info("Reloaded plugin {} from {}; rebound types {}", symbol, moduleRef, fresh.bindings.keySet());
            return List.copyOf(fresh.bindings.keySet());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forget the plugin for (module, symbol): its type names leave the registry and
     * its class loader is closed. Agent definitions bound to it load it again on next use.
     *
     * @return the type names that were unregistered
     * @throws PluginException PLUGIN_NOT_FOUND if the pair has not been loaded
     */
    public List<String> unload(String moduleRef, String symbol) {
        PluginKey key = new PluginKey(moduleRef, symbol);
        lock.writeLock().lock();
        try {
            LoadedPlugin plugin = cache.remove(key);
            if (plugin == null) {
                throw new PluginException(PluginException.Kind.PLUGIN_NOT_FOUND, moduleRef, symbol,
                        "Plugin has not been loaded");
            }
            for (String typeName : plugin.bindings.keySet()) {
                registry.unregister(typeName);
            }
            closeQuietly(plugin);

            log.info("Unloaded plugin {} from {}; removed types {}", symbol, moduleRef, plugin.bindings.keySet());
            return List.copyOf(plugin.bindings.keySet());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<PluginInfo> listLoaded() {
        lock.readLock().lock();
        try {
            List<PluginInfo> out = new ArrayList<>();
            for (LoadedPlugin p : cache.values()) {
                out.add(new PluginInfo(p.key.moduleRef(), p.key.symbol(), p.type.getName(),
                        List.copyOf(p.bindings.keySet()), p.loadedAt));
            }
            out.sort(Comparator.comparing(PluginInfo::moduleRef).thenComparing(PluginInfo::symbol));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void close() {
        lock.writeLock().lock();
        try {
            cache.values().forEach(this::closeQuietly);
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    private LoadedPlugin resolve(PluginKey key) {
        String moduleRef = key.moduleRef();
        String symbol    = key.symbol();
        if (moduleRef == null || moduleRef.isBlank() || symbol == null || symbol.isBlank()) {
            throw new PluginException(PluginException.Kind.PLUGIN_NOT_FOUND, moduleRef, symbol,
                    "Module reference and symbol are required");
        }

        URLClassLoader loader = null;
        ClassLoader classLoader;
        if (moduleRef.startsWith(CLASSPATH_MODULE)) {
            classLoader = PluginLoader.class.getClassLoader();
        } else {
            loader = openModule(moduleRef, symbol);
            classLoader = loader;
        }

        try {
            Class<?> type = Class.forName(symbol, true, classLoader);
            AgentFactory factory = factoryFor(type, moduleRef, symbol);
            return new LoadedPlugin(key, type, factory, loader);
        } catch (ClassNotFoundException e) {
            closeLoader(loader);
            throw new PluginException(PluginException.Kind.PLUGIN_NOT_FOUND, moduleRef, symbol,
                    "Class not found in module", e);
        } catch (LinkageError e) {
            // NoClassDefFoundError, ExceptionInInitializerError, UnsupportedClassVersionError, ...
            closeLoader(loader);
            throw new PluginException(PluginException.Kind.LOAD_ERROR, moduleRef, symbol,
                    "Failed to link plugin class: " + e, e);
        } catch (PluginException e) {
            closeLoader(loader);
            throw e;
        }
    }

    private static URLClassLoader openModule(String moduleRef, String symbol) {
        Path path;
        try {
            path = Path.of(moduleRef);
        } catch (InvalidPathException e) {
            throw new PluginException(PluginException.Kind.PLUGIN_NOT_FOUND, moduleRef, symbol,
                    "Invalid module path", e);
        }
        if (!Files.exists(path)) {
            throw new PluginException(PluginException.Kind.PLUGIN_NOT_FOUND, moduleRef, symbol,
                    "Module does not exist");
        }
        if (Files.isRegularFile(path)) {
            // Fail fast on a corrupt archive instead of on the first class lookup.
            try (JarFile ignored = new JarFile(path.toFile())) {
                log.debug("Opened plugin archive {}", path);
            } catch (IOException e) {
                throw new PluginException(PluginException.Kind.LOAD_ERROR, moduleRef, symbol,
                        "Malformed plugin archive: " + e.getMessage(), e);
            }
        }
        try {
            URL url = path.toUri().toURL();
            return new URLClassLoader(new URL[]{url}, new RestrictedPluginClassLoader());
        } catch (MalformedURLException e) {
            throw new PluginException(PluginException.Kind.LOAD_ERROR, moduleRef, symbol,
                    "Cannot build module URL: " + e.getMessage(), e);
        }
    }

    /**
     * Check the class against the agent contract and return a factory for it.
     */
    static AgentFactory factoryFor(Class<?> type, String moduleRef, String symbol) {
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new PluginException(PluginException.Kind.CONTRACT_VIOLATION, moduleRef, symbol,
                    type.getName() + " is not a concrete class");
        }
        if (!Modifier.isPublic(type.getModifiers())) {
            throw new PluginException(PluginException.Kind.CONTRACT_VIOLATION, moduleRef, symbol,
                    type.getName() + " is not public");
        }

        Constructor<?> withConfig = findConstructor(type, Map.class);
        Constructor<?> noArg      = findConstructor(type);
        if (withConfig == null && noArg == null) {
            throw new PluginException(PluginException.Kind.CONTRACT_VIOLATION, moduleRef, symbol,
                    type.getName() + " has neither a public (Map) nor a public no-arg constructor");
        }

        if (Agent.class.isAssignableFrom(type)) {
            return config -> (Agent) instantiate(withConfig, noArg, config, moduleRef, symbol);
        }

        Method execute = findMethod(type, "execute", Map.class);
        if (execute == null || !Map.class.isAssignableFrom(execute.getReturnType())) {
            throw new PluginException(PluginException.Kind.CONTRACT_VIOLATION, moduleRef, symbol,
                    type.getName() + " does not expose execute(Map) returning a Map");
        }
        Method validate = findMethod(type, "validateInput", Map.class);
        if (validate != null && validate.getReturnType() != boolean.class && validate.getReturnType() != Boolean.class) {
            throw new PluginException(PluginException.Kind.CONTRACT_VIOLATION, moduleRef, symbol,
                    type.getName() + ".validateInput(Map) must return boolean");
        }
        Method onError = findOnError(type);

        return config -> new ReflectiveAgentAdapter(
                instantiate(withConfig, noArg, config, moduleRef, symbol), execute, validate, onError);
    }

    private static Object instantiate(Constructor<?> withConfig, Constructor<?> noArg,
                                      Map<String, Object> config, String moduleRef, String symbol) {
        try {
            return withConfig != null ? withConfig.newInstance(config) : noArg.newInstance();
        } catch (InvocationTargetException e) {
            throw new PluginException(PluginException.Kind.LOAD_ERROR, moduleRef, symbol,
                    "Plugin constructor threw: " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new PluginException(PluginException.Kind.LOAD_ERROR, moduleRef, symbol,
                    "Cannot instantiate plugin: " + e.getMessage(), e);
        }
    }

    private static Constructor<?> findConstructor(Class<?> type, Class<?>... params) {
        try {
            return type.getConstructor(params);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Method findMethod(Class<?> type, String name, Class<?>... params) {
        try {
            return type.getMethod(name, params);
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    // onError(X, Map) where X accepts an AgentException, e.g. Exception or Throwable.
    private static Method findOnError(Class<?> type) {
        for (Method m : type.getMethods()) {
            Class<?>[] p = m.getParameterTypes();
            if (m.getName().equals("onError") && p.length == 2
                    && p[0].isAssignableFrom(AgentException.class) && p[1].isAssignableFrom(Map.class)) {
                return m;
            }
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AgentRegistration boundRegistration(LoadedPlugin plugin, String typeName,
                                                       Map<String, Object> config) {
        if (plugin == null) return null;
        Map<String, Object> bound = plugin.bindings.get(typeName);
        return Objects.equals(bound, config) ? plugin.registrations.get(typeName) : null;
    }

    private static AgentRegistration registrationFor(LoadedPlugin plugin, String typeName,
                                                     Map<String, Object> baseConfig) {
        AgentFactory base = plugin.baseFactory;
        AgentFactory overlaid = callConfig -> {
            Map<String, Object> merged = new LinkedHashMap<>(baseConfig);
            if (callConfig != null) merged.putAll(callConfig);
            return base.create(merged);
        };
        return new AgentRegistration(typeName, AgentCategory.CUSTOM, "plugin", false, overlaid);
    }

    private void closeQuietly(LoadedPlugin plugin) {
        closeLoader(plugin.loader);
    }

    private static void closeLoader(URLClassLoader loader) {
        if (loader == null) return;
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close plugin class loader: {}", e.getMessage());
        }
    }
}
