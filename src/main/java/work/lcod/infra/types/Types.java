package work.lcod.infra.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

public final class Types {
    private Types() {}

    public static Type union(Collection<? extends Type> types) {
        var set = new ArrayList<Type>();
        for (var type : types) {
            addFlattened(set, type);
        }
        if (set.isEmpty()) {
            return InvalidType.INSTANCE;
        }
        if (set.size() == 1) {
            return set.get(0);
        }
        return new UnionType(set);
    }

    public static Type union(Type... types) {
        return union(Arrays.asList(types));
    }

    private static void addFlattened(List<Type> set, Type type) {
        if (type instanceof UnionType u) {
            for (var element : u.elements()) {
                addFlattened(set, element);
            }
            return;
        }
        for (var existing : set) {
            if (existing == type || existing.equals(type)) {
                return;
            }
        }
        set.add(type);
    }

    public static Type unwrap(Type type) {
        var current = type;
        while (true) {
            if (current instanceof OptionalType o) {
                current = o.element();
            } else if (current instanceof InputType i) {
                current = i.element();
            } else {
                return current;
            }
        }
    }

    public static boolean isInvalid(Type type) {
        return type == null || unwrap(type) == InvalidType.INSTANCE;
    }

    public static boolean isOptional(Type type) {
        var current = type;
        while (current instanceof InputType i) {
            current = i.element();
        }
        return current instanceof OptionalType;
    }

    public static String display(Type type) {
        return type == null ? "unknown" : type.display();
    }
}
