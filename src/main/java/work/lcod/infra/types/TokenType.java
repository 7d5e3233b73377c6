package work.lcod.infra.types;

import java.util.Objects;

public record TokenType(String token, Type underlying) implements Type {
    public TokenType {
        Objects.requireNonNull(token, "token");
    }

    public Type underlyingOrAny() {
        return underlying == null ? PrimitiveType.ANY : underlying;
    }

    @Override
    public String display() {
        return token + "<type = " + underlyingOrAny().display() + ">";
    }

    @Override
    public String toString() {
        return display();
    }
}
