package work.lcod.infra.types;

import java.util.List;
import java.util.stream.Collectors;

public record UnionType(List<Type> elements) implements Type {
    public UnionType {
        elements = List.copyOf(elements);
    }

    @Override
    public String display() {
        return elements.stream().map(Type::display).collect(Collectors.joining(", ", "Union<", ">"));
    }

    @Override
    public String toString() {
        return display();
    }
}
