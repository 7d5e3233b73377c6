package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class SecretExpr extends BuiltinExpr {
    private final Expr value;

    public SecretExpr(SourceRange range, StringExpr name, Expr value) {
        super(range, name, value);
        this.value = value;
    }

    public Expr value() {
        return value;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SECRET;
    }
}
