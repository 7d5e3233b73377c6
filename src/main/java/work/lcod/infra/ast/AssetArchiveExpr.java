package work.lcod.infra.ast;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import work.lcod.infra.syntax.SourceRange;

/**
 * Archive built from named assets and archives. Entries are held in lexicographic key order so
 * the resulting archive does not depend on how the source map was written.
 */
public final class AssetArchiveExpr extends BuiltinExpr {
    private final Map<String, Expr> entries;

    public AssetArchiveExpr(SourceRange range, StringExpr name, ObjectExpr args, Map<String, Expr> entries) {
        super(range, name, args);
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public Map<String, Expr> entries() {
        return entries;
    }

    @Override
    public ExprKind kind() {
        return ExprKind.ASSET_ARCHIVE;
    }
}
