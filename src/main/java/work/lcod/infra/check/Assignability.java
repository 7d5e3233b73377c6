package work.lcod.infra.check;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.NumberExpr;
import work.lcod.infra.ast.ObjectExpr;
import work.lcod.infra.ast.StringExpr;
import work.lcod.infra.shared.FieldSuggestions;
import work.lcod.infra.types.ArrayType;
import work.lcod.infra.types.EnumType;
import work.lcod.infra.types.InvalidType;
import work.lcod.infra.types.MapType;
import work.lcod.infra.types.ObjectType;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.Property;
import work.lcod.infra.types.ResourceType;
import work.lcod.infra.types.TokenType;
import work.lcod.infra.types.Type;
import work.lcod.infra.types.Types;
import work.lcod.infra.types.UnionType;

/**
 * Structural assignability between types. A null result means the assignment is legal.
 */
final class Assignability {
    private final Typing typing;

    Assignability(Typing typing) {
        this.typing = typing;
    }

    NotAssignable check(Expr fromExpr, Type to) {
        var from = typing.exprType(fromExpr);
        if (from == null) {
            return NotAssignable.internal("unable to find type").withRange(fromExpr.range());
        }
        return check(fromExpr, from, to);
    }

    /**
     * Checks {@code from} against {@code to}. {@code fromExpr} is the expression that produced the
     * value; it supplies literals for enum checks, per-entry ranges for object literals and the
     * range of leaf failures.
     */
    NotAssignable check(Expr fromExpr, Type from, Type to) {
        from = Types.unwrap(from);
        to = Types.unwrap(to);
        if (from == InvalidType.INSTANCE || to == InvalidType.INSTANCE) {
            return null;
        }
        if (from == PrimitiveType.ANY || to == PrimitiveType.ANY) {
            return null;
        }
        var fail = NotAssignable.of(String.format("Cannot assign %s to %s", dispType(from), dispType(to)));

        if (from instanceof UnionType union) {
            var reasons = new ArrayList<NotAssignable>();
            for (var element : union.elements()) {
                var because = check(fromExpr, element, to);
                if (because != null) {
                    reasons.add(because);
                }
            }
            return reasons.isEmpty() ? null : fail.because(reasons);
        }
        if (from instanceof TokenType token) {
            if (token.underlying() == null) {
                return fail;
            }
            var because = check(fromExpr, token.underlying(), to);
            if (because == null) {
                return null;
            }
            return fail.because(because).appendReason(String.format(
                ". '%s' is a Token Type. Token types act like their underlying type", token.display()));
        }

        if (to instanceof PrimitiveType primitive) {
            return okIf(primitiveAccepts(primitive, from), fail);
        }
        if (to instanceof UnionType union) {
            var reasons = new ArrayList<NotAssignable>();
            for (var element : union.elements()) {
                var because = check(fromExpr, from, element);
                if (because == null) {
                    return null;
                }
                reasons.add(because);
            }
            return fail.because(reasons);
        }
        if (to instanceof ArrayType array) {
            if (!(from instanceof ArrayType fromArray)) {
                return fail;
            }
            return causedBy(fail, check(fromExpr, fromArray.element(), array.element()));
        }
        if (to instanceof MapType map) {
            return toMap(fromExpr, from, map, fail);
        }
        if (to instanceof ResourceType resource) {
            return okIf(from instanceof ResourceType r && r.token().equals(resource.token()), fail);
        }
        if (to instanceof EnumType enumType) {
            if (check(fromExpr, from, enumType.element()) != null) {
                return fail;
            }
            return causedBy(fail, enumValue(fromExpr, enumType.values()));
        }
        if (to instanceof ObjectType object) {
            return toObject(fromExpr, from, object, fail);
        }
        if (to instanceof TokenType token) {
            return causedBy(fail, check(fromExpr, from, token.underlyingOrAny()));
        }
        return NotAssignable.internal(String.format(
            "Unknown type: %s (%s)", to.display(), to.getClass().getSimpleName()));
    }

    private static boolean primitiveAccepts(PrimitiveType to, Type from) {
        return switch (to) {
            case ANY -> true;
            case NUMBER, INT -> from == PrimitiveType.NUMBER || from == PrimitiveType.INT;
            // resources coerce to their urn; scalars are rendered
            case STRING -> from instanceof ResourceType
                || from == PrimitiveType.STRING
                || from == PrimitiveType.NUMBER
                || from == PrimitiveType.INT
                || from == PrimitiveType.BOOL;
            case ASSET -> from == PrimitiveType.ASSET || from == PrimitiveType.ARCHIVE;
            case BOOL, ARCHIVE -> from == to;
        };
    }

    private NotAssignable toMap(Expr fromExpr, Type from, MapType to, NotAssignable fail) {
        if (from instanceof MapType map) {
            return causedBy(fail, check(fromExpr, map.element(), to.element()));
        }
        if (from instanceof ObjectType object) {
            // objects written in a template double as maps
            for (var property : object.properties()) {
                var because = check(fromExpr, property.type(), to.element());
                if (because != null) {
                    return fail.because(because.withProperty(property.name()));
                }
            }
            return null;
        }
        return fail;
    }

    private NotAssignable toObject(Expr fromExpr, Type from, ObjectType to, NotAssignable fail) {
        var failures = new ArrayList<NotAssignable>();
        if (from instanceof MapType map) {
            for (var property : to.properties()) {
                var because = check(fromExpr, map.element(), property.type());
                if (because != null) {
                    failures.add(because.withProperty(property.name()).withRange(fromExpr.range()));
                }
            }
            return failures.isEmpty() ? null : fail.because(failures).asTransitory();
        }
        if (!(from instanceof ObjectType source)) {
            return fail;
        }
        var literalEntries = literalEntries(fromExpr);
        for (var property : to.properties()) {
            var fromProperty = source.property(property.name());
            if (fromProperty == null) {
                if (property.required()) {
                    failures.add(NotAssignable.of(String.format("Missing required property '%s'", property.shownName()))
                        .withProperty(property.shownName())
                        .withRange(fromExpr.range()));
                }
                continue;
            }
            NotAssignable because;
            var entry = literalEntries.get(property.name());
            if (entry != null) {
                because = check(entry.value(), property.type());
                if (because != null) {
                    because = because.withRange(entry.value().range());
                }
            } else {
                because = check(fromExpr, fromProperty.type(), property.type());
                if (because != null) {
                    because = because.withRange(fromExpr.range());
                }
            }
            if (because != null) {
                failures.add(because.withProperty(property.shownName()));
            }
        }
        var fields = to.properties().stream().map(Property::name).toList();
        for (var property : source.properties()) {
            if (to.property(property.name()) != null) {
                continue;
            }
            var suggestions = FieldSuggestions.forProperties(dispType(to), fields);
            var range = fromExpr.range();
            var entry = literalEntries.get(property.name());
            if (entry != null && entry.key().range() != null) {
                range = entry.key().range();
            }
            failures.add(NotAssignable.of(suggestions.detail(property.name()))
                .withSummary(suggestions.summary("Property " + property.name()))
                .withRange(range));
        }
        return failures.isEmpty() ? null : fail.because(failures).asTransitory();
    }

    private static Map<String, ObjectExpr.Property> literalEntries(Expr fromExpr) {
        var result = new HashMap<String, ObjectExpr.Property>();
        if (fromExpr instanceof ObjectExpr object) {
            for (var entry : object.entries()) {
                if (entry.key() instanceof StringExpr key) {
                    result.putIfAbsent(key.value(), entry);
                }
            }
        }
        return result;
    }

    private static NotAssignable enumValue(Expr fromExpr, List<EnumType.EnumValue> values) {
        var range = fromExpr.range();
        for (var value : values) {
            if (fromExpr instanceof StringExpr s) {
                if (!(value.value() instanceof String expected)) {
                    return NotAssignable.internal("schema enum value was not a string").withRange(range);
                }
                if (s.value().equals(expected)) {
                    return null;
                }
            } else if (fromExpr instanceof NumberExpr n) {
                if (!(value.value() instanceof Number expected)) {
                    return NotAssignable.internal("schema enum value was not a number").withRange(range);
                }
                if (n.value() == expected.doubleValue()) {
                    return null;
                }
            } else {
                return null;
            }
        }
        var allowed = values.stream().map(EnumType.EnumValue::render).toList();
        return NotAssignable.of("Allowed values are " + String.join(", ", allowed)).withRange(range);
    }

    private static NotAssignable okIf(boolean condition, NotAssignable fail) {
        return condition ? null : fail;
    }

    private static NotAssignable causedBy(NotAssignable fail, NotAssignable cause) {
        return cause == null ? null : fail.because(cause);
    }

    static String dispType(Type type) {
        var prefix = type instanceof PrimitiveType ? "type " : "";
        return prefix + "'" + type.display() + "'";
    }
}
