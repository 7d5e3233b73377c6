package work.lcod.infra.eval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.infra.engine.RemoteResource;
import work.lcod.infra.shared.Numbers;

/**
 * Helpers over runtime values: null, Boolean, Number, String, List, Map, {@link RemoteResource},
 * {@link Asset}, {@link Archive} and {@link Output}.
 */
public final class Values {
    private Values() {}

    public static String typeString(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean) {
            return "a boolean";
        }
        if (value instanceof Integer || value instanceof Long) {
            return "an integer";
        }
        if (value instanceof Number) {
            return "a number";
        }
        if (value instanceof String) {
            return "a string";
        }
        if (value instanceof List<?>) {
            return "a list";
        }
        if (value instanceof Map<?, ?>) {
            return "an object";
        }
        if (value instanceof RemoteResource) {
            return "a resource";
        }
        if (value instanceof Asset) {
            return "an asset";
        }
        if (value instanceof Archive) {
            return "an archive";
        }
        if (value instanceof Output) {
            return "a deferred value";
        }
        return value.getClass().getSimpleName();
    }

    public static boolean isIntegral(Number number) {
        return Numbers.isIntegral(number);
    }

    public static String formatNumber(Number number) {
        return Numbers.format(number);
    }

    public static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number n) {
            return formatNumber(n);
        }
        if (value instanceof Boolean b) {
            return b.toString();
        }
        if (value instanceof RemoteResource resource) {
            return resource.urn();
        }
        return null;
    }

    /**
     * Plain JSON-compatible tree: integral numbers within range become longs, resources their urn, assets and
     * archives descriptive maps. Deferred values must already be resolved.
     */
    public static Object toPlain(Object value) {
        if (value instanceof Number n) {
            return Numbers.fitsLong(n) ? (Object) n.longValue() : (Object) n.doubleValue();
        }
        if (value instanceof List<?> list) {
            var result = new ArrayList<Object>(list.size());
            for (var item : list) {
                result.add(toPlain(item));
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            var result = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> result.put(String.valueOf(k), toPlain(v)));
            return result;
        }
        if (value instanceof RemoteResource resource) {
            return resource.urn();
        }
        if (value instanceof Asset asset) {
            var result = new LinkedHashMap<String, Object>();
            result.put("asset", asset.kind().name().toLowerCase());
            result.put("source", asset.source());
            return result;
        }
        if (value instanceof Archive archive) {
            var result = new LinkedHashMap<String, Object>();
            result.put("archive", archive.kind().name().toLowerCase());
            if (archive.source() != null) {
                result.put("source", archive.source());
            }
            if (!archive.assets().isEmpty()) {
                result.put("assets", toPlain(archive.assets()));
            }
            return result;
        }
        return value;
    }

    public static boolean containsOutput(Object value) {
        if (value instanceof Output) {
            return true;
        }
        if (value instanceof List<?> list) {
            return list.stream().anyMatch(Values::containsOutput);
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().anyMatch(Values::containsOutput);
        }
        return false;
    }
}
