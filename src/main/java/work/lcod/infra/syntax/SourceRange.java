package work.lcod.infra.syntax;

import java.util.Collection;
import java.util.Objects;

public record SourceRange(String file, SourcePosition start, SourcePosition end) {
    public SourceRange {
        file = file == null ? "" : file;
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static SourceRange of(String file, int startLine, int startColumn, int endLine, int endColumn) {
        return new SourceRange(file, new SourcePosition(startLine, startColumn), new SourcePosition(endLine, endColumn));
    }

    public static SourceRange union(SourceRange a, SourceRange b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        var start = a.start.compareTo(b.start) <= 0 ? a.start : b.start;
        var end = a.end.compareTo(b.end) >= 0 ? a.end : b.end;
        return new SourceRange(a.file.isEmpty() ? b.file : a.file, start, end);
    }

    public static SourceRange unionAll(Collection<SourceRange> ranges) {
        SourceRange acc = null;
        for (var range : ranges) {
            acc = union(acc, range);
        }
        return acc;
    }

    @Override
    public String toString() {
        var prefix = file.isEmpty() ? "" : file + ":";
        return prefix + start + "-" + end;
    }
}
