package io.github.drompincen.lumenta.runtime.tools;

import io.github.drompincen.lumenta.protocol.mcp.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools discovered on the classpath through {@code META-INF/services}. Each tool's single-argument
 * {@code set*} methods are satisfied from the application context before registration.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        for (Tool tool : ServiceLoader.load(Tool.class)) {
            wire(tool);
            register(tool);
        }
        log.info("Loaded {} tools via SPI: {}", tools.size(), new TreeSet<>(tools.keySet()));
    }

    public void register(Tool tool) {
        Tool previous = tools.put(tool.name(), tool);
        if (previous != null) {
            log.warn("Tool {} registered twice; {} replaces {}", tool.name(),
                    tool.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
    }

    public Optional<Tool> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /** Descriptors sorted by tool name. */
    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .sorted(Comparator.comparing(Tool::name))
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.inputSchema()))
                .toList();
    }

    private void wire(Tool tool) {
        String toolType = tool.getClass().getSimpleName();
        for (Method setter : tool.getClass().getMethods()) {
            if (!setter.getName().startsWith("set") || setter.getParameterCount() != 1) {
                continue;
            }
            Class<?> dependency = setter.getParameterTypes()[0];
            ObjectProvider<?> provider = applicationContext.getBeanProvider(dependency);
            Object bean = provider.getIfUnique();
            if (bean == null) {
                log.warn("{}.{} left unset: no unique {} bean", toolType, setter.getName(), dependency.getSimpleName());
                continue;
            }
            try {
                setter.invoke(tool, bean);
            } catch (IllegalAccessException | InvocationTargetException e) {
                log.warn("Failed to inject {} into {}.{}: {}", dependency.getSimpleName(),
                        toolType, setter.getName(), e.getMessage());
            }
        }
    }
}
