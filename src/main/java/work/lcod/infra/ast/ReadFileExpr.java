package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

/** Reads a file relative to the working directory. */
public final class ReadFileExpr extends BuiltinExpr {
    private final Expr path;

    public ReadFileExpr(SourceRange range, StringExpr name, Expr path) {
        super(range, name, path);
        this.path = path;
    }

    public Expr path() {
        return path;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.READ_FILE;
    }
}
