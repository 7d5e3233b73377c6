package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class BooleanExpr extends Expr {
    private final boolean value;

    public BooleanExpr(SourceRange range, boolean value) {
        super(range);
        this.value = value;
    }

    public boolean value() {
        return value;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.BOOLEAN;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
