package work.lcod.infra.types;

import java.util.Objects;

public record OptionalType(Type element) implements Type {
    public OptionalType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public String display() {
        return element.display() + "?";
    }

    @Override
    public String toString() {
        return display();
    }
}
