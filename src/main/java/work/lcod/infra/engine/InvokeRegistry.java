package work.lcod.infra.engine;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InvokeRegistry {
    private final Map<String, Entry> functions = new ConcurrentHashMap<>();

    public InvokeRegistry register(String token, InvokeHandler handler) {
        functions.put(token, new Entry(token, handler));
        return this;
    }

    public Entry get(String token) {
        return functions.get(token);
    }

    public void unregister(String token) {
        if (token != null) {
            functions.remove(token);
        }
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(functions);
    }

    public record Entry(String token, InvokeHandler handler) {}
}
