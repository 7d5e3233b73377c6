package work.lcod.infra.types;

import java.util.Objects;

/**
 * Type of a resource declaration. Property access goes to {@code outputs}, plus the synthetic
 * {@code urn} and, for non-components, {@code id}.
 */
public record ResourceType(String token, ObjectType outputs, boolean component) implements Type {
    public ResourceType {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(outputs, "outputs");
    }

    @Override
    public String display() {
        return token;
    }

    @Override
    public String toString() {
        return display();
    }
}
