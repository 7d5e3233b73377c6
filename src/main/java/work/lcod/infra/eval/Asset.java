package work.lcod.infra.eval;

import java.util.Objects;

public record Asset(Kind kind, String source) {
    public Asset {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
    }

    public enum Kind {
        STRING,
        FILE,
        REMOTE
    }
}
