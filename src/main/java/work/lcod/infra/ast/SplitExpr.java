package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class SplitExpr extends BuiltinExpr {
    private final Expr delimiter;
    private final Expr source;

    public SplitExpr(SourceRange range, StringExpr name, ListExpr args) {
        super(range, name, args);
        this.delimiter = args.elements().get(0);
        this.source = args.elements().get(1);
    }

    public Expr delimiter() {
        return delimiter;
    }

    public Expr source() {
        return source;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.SPLIT;
    }
}
