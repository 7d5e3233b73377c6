package work.lcod.infra.ast;

import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public record ConfigParamDecl(SourceRange range, StringExpr type, Expr defaultValue, BooleanExpr secret) {
    static final List<String> FIELDS = List.of("type", "default", "secret");

    public boolean isSecret() {
        return secret != null && secret.value();
    }
}
