package work.lcod.infra.types;

/**
 * Marks an expression whose type could not be computed. The failure has already been reported,
 * so every check involving this type succeeds silently.
 */
public enum InvalidType implements Type {
    INSTANCE;

    @Override
    public String display() {
        return "invalid";
    }

    @Override
    public String toString() {
        return display();
    }
}
