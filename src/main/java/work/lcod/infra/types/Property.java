package work.lcod.infra.types;

import java.util.Objects;
import work.lcod.infra.syntax.SourceRange;

/**
 * Named member of an object type. {@code constValue} is the package-defined constant, if any;
 * {@code displayName} and {@code range} override what diagnostics show.
 */
public record Property(String name, Type type, boolean required, Object constValue, String displayName, SourceRange range) {
    public Property {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public static Property required(String name, Type type) {
        return new Property(name, type, true, null, null, null);
    }

    public static Property optional(String name, Type type) {
        return new Property(name, type, false, null, null, null);
    }

    public String shownName() {
        return displayName == null ? name : displayName;
    }
}
