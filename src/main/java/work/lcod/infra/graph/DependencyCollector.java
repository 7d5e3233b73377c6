package work.lcod.infra.graph;

import java.util.ArrayList;
import java.util.List;
import work.lcod.infra.ast.AssetArchiveExpr;
import work.lcod.infra.ast.AssetExpr;
import work.lcod.infra.ast.BuiltinExpr;
import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.InterpolateExpr;
import work.lcod.infra.ast.InvokeExpr;
import work.lcod.infra.ast.ListExpr;
import work.lcod.infra.ast.ObjectExpr;
import work.lcod.infra.ast.ResourceDecl;
import work.lcod.infra.ast.SymbolExpr;

public final class DependencyCollector {
    private DependencyCollector() {}

    public static List<Dependency> ofResource(ResourceDecl resource) {
        var deps = new ArrayList<Dependency>();
        for (var property : resource.properties()) {
            collect(deps, property.value());
        }
        for (var option : resource.options().references()) {
            collect(deps, option);
        }
        if (resource.get() != null) {
            collect(deps, resource.get().id());
            for (var state : resource.get().state()) {
                collect(deps, state.value());
            }
        }
        return deps;
    }

    public static List<Dependency> ofExpr(Expr expr) {
        var deps = new ArrayList<Dependency>();
        collect(deps, expr);
        return deps;
    }

    private static void collect(List<Dependency> deps, Expr expr) {
        if (expr == null) {
            return;
        }
        switch (expr.kind()) {
            case NULL, BOOLEAN, NUMBER, STRING -> {
            }
            case SYMBOL -> {
                var symbol = (SymbolExpr) expr;
                deps.add(new Dependency(symbol.access().rootName(), symbol.range()));
            }
            case INTERPOLATE -> {
                for (var part : ((InterpolateExpr) expr).parts()) {
                    if (part.value() != null) {
                        deps.add(new Dependency(part.value().rootName(), expr.range()));
                    }
                }
            }
            case LIST -> ((ListExpr) expr).elements().forEach(e -> collect(deps, e));
            case OBJECT -> {
                for (var entry : ((ObjectExpr) expr).entries()) {
                    collect(deps, entry.key());
                    collect(deps, entry.value());
                }
            }
            case INVOKE -> {
                var invoke = (InvokeExpr) expr;
                collect(deps, invoke.callArgs());
                invoke.callOpts().references().forEach(e -> collect(deps, e));
            }
            case ASSET_ARCHIVE -> ((AssetArchiveExpr) expr).entries().values().forEach(e -> collect(deps, e));
            case STRING_ASSET, FILE_ASSET, REMOTE_ASSET, FILE_ARCHIVE, REMOTE_ARCHIVE ->
                collect(deps, ((AssetExpr) expr).source());
            case JOIN, SPLIT, SELECT, TO_JSON, TO_BASE64, FROM_BASE64, SECRET, READ_FILE, STACK_REFERENCE ->
                collect(deps, ((BuiltinExpr) expr).args());
        }
    }
}
