package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class SelectExpr extends BuiltinExpr {
    private final Expr index;
    private final Expr values;

    public SelectExpr(SourceRange range, StringExpr name, ListExpr args) {
        super(range, name, args);
        this.index = args.elements().get(0);
        this.values = args.elements().get(1);
    }

    public Expr index() {
        return index;
    }

    public Expr values() {
        return values;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SELECT;
    }
}
