package work.lcod.infra.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe accumulator shared by the scheduler, the checker and the evaluator. Deferred
 * continuations may report into it concurrently with the main evaluation path.
 */
public final class Diagnostics {
    private final List<Diagnostic> items = new ArrayList<>();

    public Diagnostics add(Diagnostic diagnostic) {
        if (diagnostic != null) {
            synchronized (items) {
                items.add(diagnostic);
            }
        }
        return this;
    }

    public Diagnostics addAll(Iterable<Diagnostic> diagnostics) {
        for (var diagnostic : diagnostics) {
            add(diagnostic);
        }
        return this;
    }

    public Diagnostics error(SourceRange range, String summary) {
        return add(Diagnostic.error(range, summary));
    }

    public Diagnostics error(SourceRange range, String summary, String detail) {
        return add(Diagnostic.error(range, summary, detail));
    }

    public Diagnostics warning(SourceRange range, String summary, String detail) {
        return add(Diagnostic.warning(range, summary, detail));
    }

    public boolean hasErrors() {
        synchronized (items) {
            return items.stream().anyMatch(Diagnostic::isError);
        }
    }

    public int size() {
        synchronized (items) {
            return items.size();
        }
    }

    public List<Diagnostic> snapshot() {
        synchronized (items) {
            return List.copyOf(items);
        }
    }

    public List<Diagnostic> errors() {
        return snapshot().stream().filter(Diagnostic::isError).toList();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (var diagnostic : snapshot()) {
            sb.append(diagnostic).append('\n');
        }
        return sb.toString();
    }
}
