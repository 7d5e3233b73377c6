package work.lcod.infra.ast;

import java.util.List;

public record PropertyAccess(List<PropertyAccessor> accessors) {
    public PropertyAccess {
        accessors = List.copyOf(accessors);
    }

    public String rootName() {
        return accessors.get(0).rootName();
    }

    public List<PropertyAccessor> tail() {
        return accessors.subList(1, accessors.size());
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var accessor : accessors) {
            if (accessor instanceof PropertyAccessor.Name n) {
                if (sb.length() != 0) {
                    sb.append('.');
                }
                sb.append(n.name());
            } else if (accessor instanceof PropertyAccessor.Subscript s) {
                if (s.index() instanceof String key) {
                    sb.append("[\"").append(key.replace("\"", "\\\"")).append("\"]");
                } else {
                    sb.append('[').append(s.index()).append(']');
                }
            }
        }
        return sb.toString();
    }
}
