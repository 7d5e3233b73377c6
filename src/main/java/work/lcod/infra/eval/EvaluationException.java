package work.lcod.infra.eval;

import work.lcod.infra.syntax.Diagnostic;
import work.lcod.infra.syntax.SourceRange;

public final class EvaluationException extends RuntimeException {
    private final SourceRange range;
    private final String detail;

    public EvaluationException(SourceRange range, String message) {
        this(range, message, "", null);
    }

    public EvaluationException(SourceRange range, String message, String detail) {
        this(range, message, detail, null);
    }

    public EvaluationException(SourceRange range, String message, String detail, Throwable cause) {
        super(message, cause);
        this.range = range;
        this.detail = detail == null ? "" : detail;
    }

    public SourceRange range() {
        return range;
    }

    public String detail() {
        return detail;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.error(range, getMessage(), detail);
    }
}
