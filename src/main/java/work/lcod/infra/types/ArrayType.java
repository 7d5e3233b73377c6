package work.lcod.infra.types;

import java.util.Objects;

public record ArrayType(Type element) implements Type {
    public ArrayType {
        Objects.requireNonNull(element, "element");
    }

    @Override
    public String display() {
        return "List<" + element.display() + ">";
    }

    @Override
    public String toString() {
        return display();
    }
}
