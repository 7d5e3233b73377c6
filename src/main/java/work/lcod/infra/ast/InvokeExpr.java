package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class InvokeExpr extends BuiltinExpr {
    private final StringExpr token;
    private final ObjectExpr callArgs;
    private final InvokeOptionsDecl callOpts;
    private final StringExpr returnField;

    public InvokeExpr(
        SourceRange range,
        StringExpr name,
        ObjectExpr args,
        StringExpr token,
        ObjectExpr callArgs,
        InvokeOptionsDecl callOpts,
        StringExpr returnField
    ) {
        super(range, name, args);
        this.token = token;
        this.callArgs = callArgs;
        this.callOpts = callOpts == null ? InvokeOptionsDecl.EMPTY : callOpts;
        this.returnField = returnField;
    }

    public StringExpr token() {
        return token;
    }

    public ObjectExpr callArgs() {
        return callArgs;
    }

    public InvokeOptionsDecl callOpts() {
        return callOpts;
    }

    public StringExpr returnField() {
        return returnField;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.INVOKE;
    }
}
