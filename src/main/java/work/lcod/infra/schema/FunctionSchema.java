package work.lcod.infra.schema;

import java.util.Objects;
import work.lcod.infra.types.ObjectType;

public record FunctionSchema(String token, ObjectType inputs, ObjectType outputs) {
    public FunctionSchema {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(outputs, "outputs");
    }
}
