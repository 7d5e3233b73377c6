package work.lcod.infra.eval;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public record Archive(Kind kind, String source, Map<String, Object> assets) {
    public Archive {
        Objects.requireNonNull(kind, "kind");
        assets = assets == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(assets));
    }

    public static Archive ofAssets(Map<String, Object> assets) {
        return new Archive(Kind.ASSETS, null, assets);
    }

    public enum Kind {
        FILE,
        REMOTE,
        ASSETS
    }
}
