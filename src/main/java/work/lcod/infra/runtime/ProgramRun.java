package work.lcod.infra.runtime;

import java.util.List;
import work.lcod.infra.check.Typing;
import work.lcod.infra.eval.EvaluationResult;
import work.lcod.infra.graph.SortResult;
import work.lcod.infra.syntax.Diagnostic;

/**
 * Result of each phase of one run. {@code typing} and {@code evaluation} are null when an earlier
 * phase reported errors.
 */
public record ProgramRun(SortResult order, Typing typing, EvaluationResult evaluation, List<Diagnostic> diagnostics) {
    public ProgramRun {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean evaluated() {
        return evaluation != null;
    }
}
