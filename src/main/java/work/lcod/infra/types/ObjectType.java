package work.lcod.infra.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Object with ordered named properties. Objects synthesized from literals carry an ad-hoc token
 * and are rendered structurally.
 */
public final class ObjectType implements Type {
    public static final String ADHOC_PREFIX = "pulumi:adhock:";

    private final String token;
    private final List<Property> properties;
    private final Map<String, Property> byName;

    public ObjectType(String token, List<Property> properties) {
        this.token = Objects.requireNonNull(token, "token");
        this.properties = List.copyOf(properties);
        var index = new LinkedHashMap<String, Property>();
        for (var property : this.properties) {
            index.put(property.name(), property);
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public static ObjectType adhoc(List<Property> properties) {
        var names = properties.stream().map(Property::name).collect(Collectors.joining("•"));
        return new ObjectType(ADHOC_PREFIX + names, properties);
    }

    public String token() {
        return token;
    }

    public List<Property> properties() {
        return properties;
    }

    public Map<String, Property> propertyMap() {
        return byName;
    }

    public Property property(String name) {
        return byName.get(name);
    }

    public boolean isAdhoc() {
        return token.startsWith(ADHOC_PREFIX);
    }

    @Override
    public String display() {
        if (!isAdhoc()) {
            return token;
        }
        return properties.stream()
            .map(p -> p.name() + ": " + p.type().display())
            .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ObjectType other && token.equals(other.token) && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, properties);
    }

    @Override
    public String toString() {
        return display();
    }
}
