package work.lcod.infra.ast;

import java.util.ArrayList;
import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public record InvokeOptionsDecl(
    SourceRange range,
    Expr parent,
    Expr provider,
    Expr dependsOn,
    StringExpr version,
    StringExpr pluginDownloadUrl
) {
    public static final InvokeOptionsDecl EMPTY = new InvokeOptionsDecl(null, null, null, null, null, null);

    static final List<String> FIELDS = List.of("parent", "provider", "dependsOn", "version", "pluginDownloadURL");

    public List<Expr> references() {
        var refs = new ArrayList<Expr>();
        if (parent != null) {
            refs.add(parent);
        }
        if (provider != null) {
            refs.add(provider);
        }
        if (dependsOn != null) {
            refs.add(dependsOn);
        }
        return refs;
    }
}
