package work.lcod.infra.types;

import java.util.Objects;

public record MapType(Type element) implements Type {
    public MapType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public String display() {
        return "Map<" + element.display() + ">";
    }

    @Override
    public String toString() {
        return display();
    }
}
