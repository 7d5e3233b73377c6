package work.lcod.infra.check;

import java.util.ArrayList;
import java.util.List;
import work.lcod.infra.syntax.SourceRange;

/**
 * Explanation of why a value cannot be assigned to a destination type. Nodes are immutable; the
 * {@code with*} methods return modified copies.
 */
public final class NotAssignable {
    private final String reason;
    private final List<NotAssignable> because;
    private final boolean internal;
    private final boolean transitory;
    private final String property;
    private final SourceRange range;
    private final String summary;

    private NotAssignable(
        String reason,
        List<NotAssignable> because,
        boolean internal,
        boolean transitory,
        String property,
        SourceRange range,
        String summary
    ) {
        this.reason = reason == null ? "" : reason;
        this.because = List.copyOf(because);
        this.internal = internal;
        this.transitory = transitory;
        this.property = property;
        this.range = range;
        this.summary = summary;
    }

    public static NotAssignable of(String reason) {
        return new NotAssignable(reason, List.of(), false, false, null, null, null);
    }

    public static NotAssignable internal(String reason) {
        return new NotAssignable(reason, List.of(), true, false, null, null, null);
    }

    public NotAssignable because(List<NotAssignable> causes) {
        return new NotAssignable(reason, causes, internal, transitory, property, range, summary);
    }

    public NotAssignable because(NotAssignable cause) {
        return because(List.of(cause));
    }

    public NotAssignable withProperty(String name) {
        return new NotAssignable(reason, because, internal, transitory, name, range, summary);
    }

    public NotAssignable withRange(SourceRange newRange) {
        if (newRange == null) {
            return this;
        }
        return new NotAssignable(reason, because, internal, transitory, property, newRange, summary);
    }

    public NotAssignable withSummary(String text) {
        return new NotAssignable(reason, because, internal, transitory, property, range, text);
    }

    public NotAssignable appendReason(String suffix) {
        return new NotAssignable(reason + suffix, because, internal, transitory, property, range, summary);
    }

    public NotAssignable asTransitory() {
        return new NotAssignable(reason, because, internal, true, property, range, summary);
    }

    public String reason() {
        return reason;
    }

    public List<NotAssignable> causes() {
        return because;
    }

    public String property() {
        return property;
    }

    public boolean isTransitory() {
        return transitory;
    }

    public boolean isInternal() {
        if (internal) {
            return true;
        }
        for (var cause : because) {
            if (cause.isInternal()) {
                return true;
            }
        }
        return false;
    }

    public String summary() {
        if (summary != null && !summary.isEmpty()) {
            return summary;
        }
        if (because.size() == 1) {
            return because.get(0).summary();
        }
        return "";
    }

    public SourceRange range() {
        if (range != null) {
            return range;
        }
        var ranges = new ArrayList<SourceRange>();
        for (var cause : because) {
            var r = cause.range();
            if (r != null) {
                ranges.add(r);
            }
        }
        return SourceRange.unionAll(ranges);
    }

    public String headline() {
        return property == null || property.isEmpty() ? reason : property + ": " + reason;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        append(sb, 0);
        return sb.toString();
    }

    private void append(StringBuilder sb, int indent) {
        sb.append("  ".repeat(indent)).append(headline());
        if (!because.isEmpty()) {
            sb.append(':');
        }
        for (var cause : because) {
            sb.append('\n');
            cause.append(sb, indent + 1);
        }
    }
}
