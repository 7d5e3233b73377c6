package work.lcod.infra.types;

public enum PrimitiveType implements Type {
    STRING("string"),
    NUMBER("number"),
    INT("int"),
    BOOL("boolean"),
    ASSET("asset"),
    ARCHIVE("archive"),
    ANY("any");

    private final String display;

    PrimitiveType(String display) {
        this.display = display;
    }

    @Override
    public String display() {
        return display;
    }

    @Override
    public String toString() {
        return display;
    }
}
