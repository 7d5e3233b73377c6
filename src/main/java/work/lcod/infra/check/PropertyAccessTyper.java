package work.lcod.infra.check;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.infra.ast.PropertyAccessor;
import work.lcod.infra.shared.FieldSuggestions;
import work.lcod.infra.types.ArrayType;
import work.lcod.infra.types.InvalidType;
import work.lcod.infra.types.MapType;
import work.lcod.infra.types.ObjectType;
import work.lcod.infra.types.PrimitiveType;
import work.lcod.infra.types.ResourceType;
import work.lcod.infra.types.Type;
import work.lcod.infra.types.Types;
import work.lcod.infra.types.UnionType;

/**
 * Resolves the type reached by a chain of {@code .name} and {@code [index]} accessors.
 */
final class PropertyAccessTyper {
    @FunctionalInterface
    interface FailureSink {
        Type fail(String summary, String detail);
    }

    private PropertyAccessTyper() {}

    static Type resolve(Type root, String runningName, List<PropertyAccessor> accessors, FailureSink sink) {
        if (accessors.isEmpty()) {
            return root;
        }
        if (Types.unwrap(root) instanceof UnionType union) {
            return resolveUnion(union, runningName, accessors, sink);
        }
        var accessor = accessors.get(0);
        var rest = accessors.subList(1, accessors.size());
        var unwrapped = Types.unwrap(root);
        if (accessor instanceof PropertyAccessor.Name name) {
            Map<String, Type> properties = new LinkedHashMap<>();
            if (unwrapped instanceof ObjectType object) {
                object.properties().forEach(p -> properties.put(p.name(), p.type()));
            } else if (unwrapped instanceof MapType map) {
                return resolve(map.element(), runningName + "." + name.name(), rest, sink);
            } else if (unwrapped instanceof ResourceType resource) {
                resource.outputs().properties().forEach(p -> properties.put(p.name(), p.type()));
                if (!resource.component()) {
                    properties.put("id", PrimitiveType.STRING);
                }
                properties.put("urn", PrimitiveType.STRING);
            } else if (unwrapped == InvalidType.INSTANCE) {
                return unwrapped;
            } else if (unwrapped == PrimitiveType.ANY) {
                return PrimitiveType.ANY;
            } else {
                return sink.fail(
                    String.format("cannot access a property on '%s' (type %s)", runningName, unwrapped.display()),
                    "Property access is only allowed on Resources and Objects");
            }
            var next = properties.get(name.name());
            if (next == null) {
                var suggestions = FieldSuggestions.forProperties(runningName, properties.keySet());
                return sink.fail(suggestions.summary(name.name()), suggestions.detail(name.name()));
            }
            return resolve(next, runningName + "." + name.name(), rest, sink);
        }
        var subscript = (PropertyAccessor.Subscript) accessor;
        if (unwrapped instanceof ArrayType array) {
            if (subscript.isString()) {
                return indexError(sink, " via string", runningName, unwrapped, "Index via string is only allowed on Maps");
            }
            return resolve(array.element(), runningName + "[" + subscript.index() + "]", rest, sink);
        }
        if (unwrapped instanceof MapType map) {
            if (!subscript.isString()) {
                return indexError(sink, " via number", runningName, unwrapped, "Index via number is only allowed on Arrays");
            }
            return resolve(map.element(), runningName + "[\"" + subscript.index() + "\"]", rest, sink);
        }
        if (unwrapped instanceof ObjectType object && subscript.isString()) {
            // ["key"] on an object is the quoted form of .key
            var property = object.property((String) subscript.index());
            if (property != null) {
                return resolve(property.type(), runningName + "[\"" + subscript.index() + "\"]", rest, sink);
            }
        }
        if (unwrapped == InvalidType.INSTANCE) {
            return unwrapped;
        }
        if (unwrapped == PrimitiveType.ANY) {
            return PrimitiveType.ANY;
        }
        return indexError(sink, "", runningName, unwrapped, "Index property access is only allowed on Maps and Lists");
    }

    private static Type indexError(FailureSink sink, String via, String runningName, Type root, String detail) {
        return sink.fail(String.format("Cannot index%s into '%s' (type %s)", via, runningName, root.display()), detail);
    }

    /**
     * Resolves against each alternative and joins the ones that succeed. Fails only when none does.
     */
    private static Type resolveUnion(UnionType union, String runningName, List<PropertyAccessor> accessors, FailureSink sink) {
        var possibilities = new ArrayList<Type>();
        var errors = new ArrayList<NotAssignable>();
        for (var element : union.elements()) {
            var type = resolve(element, runningName, accessors, (summary, detail) -> {
                errors.add(NotAssignable.of(summary).withProperty(element.display()));
                return InvalidType.INSTANCE;
            });
            if (type != InvalidType.INSTANCE) {
                possibilities.add(type);
            }
        }
        if (possibilities.isEmpty() && !errors.isEmpty()) {
            var op = accessors.get(0) instanceof PropertyAccessor.Subscript ? "index" : "access";
            var detail = NotAssignable.of(String.format("'%s' could be a type that does not support %sing", runningName, op))
                .because(errors);
            return sink.fail(
                String.format("Cannot %s into %s of type %s", op, runningName, union.display()),
                detail.toString());
        }
        return Types.union(possibilities);
    }
}
