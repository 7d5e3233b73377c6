package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class SymbolExpr extends Expr {
    private final PropertyAccess access;

    public SymbolExpr(SourceRange range, PropertyAccess access) {
        super(range);
        this.access = access;
    }

    public PropertyAccess access() {
        return access;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SYMBOL;
    }

    @Override
    public String toString() {
        return "${" + access + "}";
    }
}
