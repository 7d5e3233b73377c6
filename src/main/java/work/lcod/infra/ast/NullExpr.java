package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class NullExpr extends Expr {
    public NullExpr(SourceRange range) {
        super(range);
    }

    @Override
    public ExprKind kind() {
        return ExprKind.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
