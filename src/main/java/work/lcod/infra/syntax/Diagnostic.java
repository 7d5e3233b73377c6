package work.lcod.infra.syntax;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Diagnostic(Severity severity, String summary, String detail, SourceRange range) {
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(summary, "summary");
        detail = detail == null ? "" : detail;
    }

    public static Diagnostic error(SourceRange range, String summary, String detail) {
        return new Diagnostic(Severity.ERROR, summary, detail, range);
    }

    public static Diagnostic error(SourceRange range, String summary) {
        return error(range, summary, "");
    }

    public static Diagnostic warning(SourceRange range, String summary, String detail) {
        return new Diagnostic(Severity.WARNING, summary, detail, range);
    }

    public static Diagnostic warning(SourceRange range, String summary) {
        return warning(range, summary, "");
    }

    public static Diagnostic unexpectedCasing(SourceRange range, String expected, String found) {
        if (expected.equals(found)) {
            return null;
        }
        return warning(range,
            String.format("'%s' looks like a miscapitalization of '%s'", found, expected),
            "A future version will enforce camelCase fields.");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("severity", severity.name().toLowerCase());
        map.put("summary", summary);
        if (!detail.isEmpty()) {
            map.put("detail", detail);
        }
        if (range != null) {
            map.put("range", range.toString());
        }
        return map;
    }

    @Override
    public String toString() {
        var where = range == null ? "" : range + ": ";
        var tail = detail.isEmpty() ? "" : "; " + detail;
        return where + severity.name().toLowerCase() + ": " + summary + tail;
    }
}
