package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.exception.DuplicateToolException;
import com.deepansh.orchestrator.exception.ToolNotFoundException;
import com.deepansh.orchestrator.tool.impl.DefaultTools;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Ordered registry of tools, keyed by name.
 *
 * Registration order is preserved: tool listings in prompts and the help text
 * depend on it. Entries hold a factory; the instance is created on first lookup and
 * reused afterwards. All mutation happens under the write lock, so a registry can be
 * shared by concurrent runs.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ToolProperties toolProperties;

    public ToolRegistry() {
        this(new ToolProperties());
    }

    public ToolRegistry(ToolProperties toolProperties) {
        this.toolProperties = toolProperties;
    }

    /**
     * A registry pre-populated with factories for every built-in tool.
     */
    public static ToolRegistry withDefaults(ToolProperties toolProperties) {
        ToolRegistry registry = new ToolRegistry(toolProperties);
        DefaultTools.factories(toolProperties).forEach(registry::register);
        log.info("Default tools registered: {}", registry.list());
        return registry;
    }

    public void register(AgentTool tool) {
        register(tool.getName(), tool, false);
    }

    public void register(AgentTool tool, boolean override) {
        register(tool.getName(), tool, override);
    }

    public void register(String name, Supplier<? extends AgentTool> factory) {
        register(name, factory, false);
    }

    public void register(String name, Supplier<? extends AgentTool> factory, boolean override) {
        putRegistration(name, new Registration(factory, null), override);
    }

    private void register(String name, AgentTool instance, boolean override) {
        putRegistration(name, new Registration(() -> instance, instance), override);
    }

    private void putRegistration(String name, Registration registration, boolean override) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        lock.writeLock().lock();
        try {
            if (registrations.containsKey(name)) {
                if (!override) {
                    throw new DuplicateToolException(name);
                }
                log.info("Overriding tool registration: [{}]", name);
                // replace in place so the original position in the ordering is kept
                registrations.put(name, registration);
                return;
            }
            registrations.put(name, registration);
            log.debug("Registered tool: [{}]", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public AgentTool get(String name) {
        Registration registration;
        lock.readLock().lock();
        try {
            registration = registrations.get(name);
        } finally {
            lock.readLock().unlock();
        }
        if (registration == null) {
            throw new ToolNotFoundException(name);
        }
        return registration.instance(name);
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return registrations.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Tool names in registration order */
    public List<String> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(registrations.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (String name : list()) {
            definitions.add(ToolDefinition.from(get(name)));
        }
        return definitions;
    }

    /**
     * Fresh instances of every built-in tool, configured from this registry's
     * tool properties. The instances are not registered.
     */
    public List<AgentTool> createDefaultSet() {
        return DefaultTools.factories(toolProperties).values().stream()
                .map(Supplier::get)
                .toList();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return registrations.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static final class Registration {

        private final Supplier<? extends AgentTool> factory;
        private volatile AgentTool instance;

        private Registration(Supplier<? extends AgentTool> factory, AgentTool instance) {
            this.factory = factory;
            this.instance = instance;
        }

        private AgentTool instance(String name) {
            AgentTool current = instance;
            if (current != null) {
                return current;
            }
            synchronized (this) {
                if (instance == null) {
                    AgentTool created = factory.get();
                    if (created == null) {
                        throw new IllegalStateException("Factory for tool '" + name + "' returned null");
                    }
                    instance = created;
                }
                return instance;
            }
        }
    }
}
