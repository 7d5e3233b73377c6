package work.lcod.infra.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ResourceRegistration(
    String token,
    String name,
    ResourceKind kind,
    Map<String, Object> properties,
    ResourceOptions options
) {
    public ResourceRegistration {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        // insertion order is kept; values may be null
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        options = options == null ? ResourceOptions.NONE : options;
    }
}
