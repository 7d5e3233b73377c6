package work.lcod.infra.schema;

import java.util.Objects;
import work.lcod.infra.types.ObjectType;
import work.lcod.infra.types.ResourceType;

public record ResourceSchema(String token, ObjectType inputs, ObjectType outputs, boolean component, boolean provider) {
    public ResourceSchema {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(outputs, "outputs");
    }

    public ResourceType toType() {
        return new ResourceType(token, outputs, component);
    }
}
