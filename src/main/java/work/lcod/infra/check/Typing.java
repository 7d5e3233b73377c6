package work.lcod.infra.check;

import work.lcod.infra.ast.Expr;
import work.lcod.infra.types.Type;

/**
 * Types computed by {@link TypeChecker}. Every lookup returns null for names or expressions the
 * checker never reached.
 */
public interface Typing {
    Type resourceType(String name);

    Type variableType(String name);

    Type configType(String name);

    Type outputType(String name);

    /**
     * Identity lookup: structurally equal expressions at different places may have different types.
     */
    Type exprType(Expr expr);
}
