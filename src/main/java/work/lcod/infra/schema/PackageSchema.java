package work.lcod.infra.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.infra.types.ObjectType;

public record PackageSchema(
    String name,
    String version,
    ResourceSchema provider,
    Map<String, ResourceSchema> resources,
    Map<String, FunctionSchema> functions
) {
    public PackageSchema {
        Objects.requireNonNull(name, "name");
        resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
        functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        if (provider == null) {
            var empty = new ObjectType("pulumi:providers:" + name, List.of());
            provider = new ResourceSchema("pulumi:providers:" + name, empty, empty, false, true);
        }
    }

    public ResourceSchema resource(String token) {
        return resources.get(token);
    }

    public FunctionSchema function(String token) {
        return functions.get(token);
    }
}
