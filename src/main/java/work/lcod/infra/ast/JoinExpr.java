package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class JoinExpr extends BuiltinExpr {
    private final Expr delimiter;
    private final Expr values;

    public JoinExpr(SourceRange range, StringExpr name, ListExpr args) {
        super(range, name, args);
        this.delimiter = args.elements().get(0);
        this.values = args.elements().get(1);
    }

    public Expr delimiter() {
        return delimiter;
    }

    public Expr values() {
        return values;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.JOIN;
    }
}
