package work.lcod.infra.types;

import java.util.List;
import java.util.Objects;
import work.lcod.infra.shared.Numbers;

public record EnumType(String token, Type element, List<EnumValue> values) implements Type {
    public EnumType {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(element, "element");
        values = List.copyOf(values);
    }

    @Override
    public String display() {
        return token;
    }

    @Override
    public String toString() {
        return display();
    }

    public record EnumValue(String name, Object value) {
        public String render() {
            String literal;
            if (value instanceof String s) {
                literal = "\"" + s + "\"";
            } else if (value instanceof Number n) {
                literal = Numbers.format(n);
            } else {
                literal = String.valueOf(value);
            }
            if (name == null || name.isEmpty() || name.equals(literal)) {
                return literal;
            }
            return name + " (" + literal + ")";
        }
    }
}
