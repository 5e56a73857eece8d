package com.switchyard.core.classifier;

import com.switchyard.core.model.Tier;
import com.switchyard.core.model.ToolDescriptor;
import com.switchyard.core.router.RouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static registry mapping tool names to their {@link ToolDescriptor}.
 * <p>
 * Built once from {@link RouterProperties} and read-only afterwards, so lookups
 * need no synchronisation. Unknown names are never guessed into a tier.
 */
@Service
public class ToolClassifier {

    private static final Logger log = LoggerFactory.getLogger(ToolClassifier.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    private final Map<String, ToolDescriptor> descriptors;

    public ToolClassifier(RouterProperties properties) {
        Map<Tier, RouterProperties.TierSettings> policies = new EnumMap<>(Tier.class);
        policies.put(Tier.SIMPLE, properties.getTiers().getSimple());
        policies.put(Tier.MEDIUM, properties.getTiers().getMedium());
        policies.put(Tier.COMPLEX, properties.getTiers().getComplex());

        var registered = new LinkedHashMap<String, ToolDescriptor>();
        Set<String> seenLower = new HashSet<>();
        for (var entry : properties.getTools().entrySet()) {
            String name = entry.getKey() == null ? "" : entry.getKey().trim();
            if (!NAME_PATTERN.matcher(name).matches()) {
                throw new IllegalStateException("Invalid tool name: '" + name + "'. Expected pattern "
                        + NAME_PATTERN.pattern());
            }
            if (!seenLower.add(name.toLowerCase(Locale.ROOT))) {
                throw new IllegalStateException("Duplicate tool name (case-insensitive): '" + name + "'");
            }
            Tier tier;
            try {
                tier = Tier.fromString(entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Tool '" + name + "' has unknown tier: " + entry.getValue(), e);
            }
            var descriptor = describe(name, tier, policies.get(tier));
            registered.put(name, descriptor);
            log.debug("Registered tool '{}' as {} (ttl={}, localTimeout={})",
                    name, tier, descriptor.cacheTtl(), descriptor.localTimeout());
        }
        this.descriptors = Collections.unmodifiableMap(registered);
        log.info("Tool classifier loaded {} tool(s)", descriptors.size());
    }

    private static ToolDescriptor describe(String name, Tier tier, RouterProperties.TierSettings settings) {
        Duration timeout = settings.getLocalTimeoutMs() > 0
                ? Duration.ofMillis(settings.getLocalTimeoutMs())
                : null;
        return new ToolDescriptor(name, tier, timeout,
                Duration.ofSeconds(settings.getCacheTtlSeconds()), settings.getPriority());
    }

    public Optional<ToolDescriptor> lookup(String tool) {
        if (tool == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(descriptors.get(tool));
    }

    /** Like {@link #lookup} but fails with {@link UnknownToolException}. */
    public ToolDescriptor require(String tool) {
        return lookup(tool).orElseThrow(() -> new UnknownToolException(tool));
    }

    public List<ToolDescriptor> all() {
        return List.copyOf(descriptors.values());
    }
}
