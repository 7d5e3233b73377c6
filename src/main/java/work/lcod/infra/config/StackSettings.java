package work.lcod.infra.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-stack settings: identity plus raw configuration values keyed as written ({@code key} or
 * {@code project:key}).
 */
public record StackSettings(String project, String stack, String organization, Map<String, Object> config) {
    public static final StackSettings EMPTY = new StackSettings("", "", "", Map.of());

    public StackSettings {
        project = project == null ? "" : project;
        stack = stack == null ? "" : stack;
        organization = organization == null ? "" : organization;
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * Looks up {@code name} under the project namespace first, then bare.
     */
    public Optional<Object> lookup(String projectName, String name) {
        if (projectName != null && !projectName.isEmpty()) {
            var namespaced = config.get(projectName + ":" + name);
            if (namespaced != null) {
                return Optional.of(namespaced);
            }
        }
        return Optional.ofNullable(config.get(name));
    }

    public Map<String, Object> localConfig(String projectName) {
        var result = new LinkedHashMap<String, Object>();
        var prefix = projectName == null || projectName.isEmpty() ? null : projectName + ":";
        config.forEach((key, value) -> {
            var local = prefix != null && key.startsWith(prefix) ? key.substring(prefix.length()) : key;
            result.putIfAbsent(local, value);
        });
        return result;
    }

    public StackSettings withConfig(Map<String, Object> extra) {
        var merged = new LinkedHashMap<>(config);
        merged.putAll(extra);
        return new StackSettings(project, stack, organization, merged);
    }
}
