package work.lcod.infra.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.lcod.infra.shared.Numbers;
import work.lcod.infra.types.ArrayType;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.Type;

/**
 * Configuration value types: {@code String}, {@code Number}, {@code Integer}, {@code Boolean} and
 * {@code List<T>} of those.
 */
public final class ConfigTypes {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<Object>> LIST_REF = new TypeReference<>() {};

    public static final String VALID_TYPES = "String, List<String>, Number, List<Number>, Integer, List<Integer>, Boolean, List<Boolean>";

    private ConfigTypes() {}

    public static Optional<Type> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        var s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.startsWith("list<") && s.endsWith(">")) {
            return parse(s.substring(5, s.length() - 1)).map(ArrayType::new);
        }
        return switch (s) {
            case "string" -> Optional.of(PrimitiveType.STRING);
            case "number" -> Optional.of(PrimitiveType.NUMBER);
            case "int", "integer" -> Optional.of(PrimitiveType.INT);
            case "boolean", "bool" -> Optional.of(PrimitiveType.BOOL);
            default -> Optional.empty();
        };
    }

    public static Type typeOf(Object value) {
        if (value instanceof String) {
            return PrimitiveType.STRING;
        }
        if (value instanceof Boolean) {
            return PrimitiveType.BOOL;
        }
        if (value instanceof Integer || value instanceof Long) {
            return PrimitiveType.INT;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == Math.rint(n.doubleValue()) ? PrimitiveType.INT : PrimitiveType.NUMBER;
        }
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                throw new IllegalArgumentException("empty list");
            }
            Type element = null;
            for (var item : list) {
                var itemType = typeOf(item);
                if (element != null && !element.equals(itemType)) {
                    if (isNumeric(element) && isNumeric(itemType)) {
                        element = PrimitiveType.NUMBER;
                        continue;
                    }
                    throw new IllegalArgumentException(String.format(
                        "heterogeneous typed lists are not allowed: found types %s and %s", element, itemType));
                }
                element = itemType;
            }
            return new ArrayType(element);
        }
        var found = value == null ? "null" : value.getClass().getSimpleName();
        throw new IllegalArgumentException(String.format(
            "unexpected configuration type '%s': valid types are %s", found, VALID_TYPES));
    }

    public static Object coerce(Object value, Type type) {
        if (type == PrimitiveType.STRING) {
            return value instanceof String ? value : String.valueOf(value);
        }
        if (type == PrimitiveType.INT) {
            if (value instanceof Number n && Numbers.fitsLong(n)) {
                return n.longValue();
            }
            if (value instanceof String s) {
                try {
                    return Long.parseLong(s.trim());
                } catch (NumberFormatException ex) {
                    throw mismatch(value, type);
                }
            }
            throw mismatch(value, type);
        }
        if (type == PrimitiveType.NUMBER) {
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            if (value instanceof String s) {
                try {
                    return Double.parseDouble(s.trim());
                } catch (NumberFormatException ex) {
                    throw mismatch(value, type);
                }
            }
            throw mismatch(value, type);
        }
        if (type == PrimitiveType.BOOL) {
            if (value instanceof Boolean) {
                return value;
            }
            if (value instanceof String s && ("true".equalsIgnoreCase(s.trim()) || "false".equalsIgnoreCase(s.trim()))) {
                return Boolean.parseBoolean(s.trim());
            }
            throw mismatch(value, type);
        }
        if (type instanceof ArrayType array) {
            List<?> items;
            if (value instanceof List<?> list) {
                items = list;
            } else if (value instanceof String s) {
                try {
                    items = JSON.readValue(s, LIST_REF);
                } catch (IOException ex) {
                    throw mismatch(value, type);
                }
            } else {
                throw mismatch(value, type);
            }
            var result = new ArrayList<Object>();
            for (var item : items) {
                result.add(coerce(item, array.element()));
            }
            return result;
        }
        return value;
    }

    private static boolean isNumeric(Type type) {
        return type == PrimitiveType.INT || type == PrimitiveType.NUMBER;
    }

    private static IllegalArgumentException mismatch(Object value, Type type) {
        return new IllegalArgumentException(String.format("value %s is not a valid %s", value, type.display()));
    }
}
