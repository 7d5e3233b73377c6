package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class StringExpr extends Expr {
    private final String value;

    public StringExpr(SourceRange range, String value) {
        super(range);
        this.value = value == null ? "" : value;
    }

    public String value() {
        return value;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.STRING;
    }

    @Override
    public String toString() {
        return value;
    }
}
