package work.lcod.infra.graph;

import java.util.List;
import work.lcod.infra.syntax.Diagnostic;

public record SortResult(List<GraphNode> order, List<Diagnostic> diagnostics) {
    public SortResult {
        order = List.copyOf(order);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public List<String> keys() {
        return order.stream().map(GraphNode::key).toList();
    }
}
