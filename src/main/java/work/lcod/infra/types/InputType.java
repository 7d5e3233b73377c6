package work.lcod.infra.types;

import java.util.Objects;

public record InputType(Type element) implements Type {
    public InputType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public String display() {
        return element.display();
    }

    @Override
    public String toString() {
        return display();
    }
}
