package com.switchyard.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Collects every {@link LocalTool} bean at startup.
 */
@Component
public class LocalToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(LocalToolRegistry.class);

    static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private final Map<String, LocalTool> tools;

    public LocalToolRegistry(List<LocalTool> localTools) {
        var byName = new TreeMap<String, LocalTool>();
        var lowerNames = new TreeMap<String, String>();
        for (LocalTool tool : localTools) {
            String name = tool.name();
            if (name == null || !NAME_PATTERN.matcher(name).matches()) {
                throw new IllegalStateException("Invalid local tool name: '" + name + "'");
            }
            String previous = lowerNames.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
            if (previous != null) {
                throw new IllegalStateException("Duplicate local tool name: '" + name
                        + "' conflicts with '" + previous + "'");
            }
            byName.put(name, tool);
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("Registered {} local tools: {}", tools.size(), tools.keySet());
    }

    public Optional<LocalTool> lookup(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }
}
