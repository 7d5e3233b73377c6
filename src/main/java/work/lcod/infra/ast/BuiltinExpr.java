package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public abstract class BuiltinExpr extends Expr {
    private final StringExpr name;
    private final Expr args;

    protected BuiltinExpr(SourceRange range, StringExpr name, Expr args) {
        super(range);
        this.name = name;
        this.args = args;
    }

    public StringExpr name() {
        return name;
    }

    public Expr args() {
        return args;
    }
}
