package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class StackReferenceExpr extends BuiltinExpr {
    private final StringExpr stackName;
    private final Expr propertyName;

    public StackReferenceExpr(SourceRange range, StringExpr name, ListExpr args, StringExpr stackName, Expr propertyName) {
        super(range, name, args);
        this.stackName = stackName;
        this.propertyName = propertyName;
    }

    public StringExpr stackName() {
        return stackName;
    }

    public Expr propertyName() {
        return propertyName;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.STACK_REFERENCE;
    }
}
