package work.lcod.infra.ast;

import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public final class ListExpr extends Expr {
    private final List<Expr> elements;

    public ListExpr(SourceRange range, List<Expr> elements) {
        super(range);
        this.elements = List.copyOf(elements);
    }

    public List<Expr> elements() {
        return elements;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.LIST;
    }
}
