package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class ToBase64Expr extends BuiltinExpr {
    private final Expr value;

    public ToBase64Expr(SourceRange range, StringExpr name, Expr value) {
        super(range, name, value);
        this.value = value;
    }

    public Expr value() {
        return value;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.TO_BASE64;
    }
}
