package work.lcod.infra.ast;

public interface PropertyAccessor {
    String rootName();

    record Name(String name) implements PropertyAccessor {
        @Override
        public String rootName() {
            return name;
        }
    }

    /**
     * Subscript whose index is either a {@link String} or an {@link Integer}.
     */
    record Subscript(Object index) implements PropertyAccessor {
        public boolean isString() {
            return index instanceof String;
        }

        @Override
        public String rootName() {
            return index instanceof String s ? s : String.valueOf(index);
        }
    }
}
