package work.lcod.infra.graph;

import java.util.List;
import work.lcod.infra.ast.AssetArchiveExpr;
import work.lcod.infra.ast.BuiltinExpr;
import work.lcod.infra.ast.CustomTimeoutsDecl;
import work.lcod.infra.ast.Expr;
import work.lcod.infra.ast.ListExpr;
import work.lcod.infra.ast.ObjectExpr;
import work.lcod.infra.ast.PropertyEntry;
import work.lcod.infra.ast.ResourceDecl;
import work.lcod.infra.ast.ResourceOptionsDecl;

public final class ProgramWalker {
    private final ProgramVisitor visitor;

    private ProgramWalker(ProgramVisitor visitor) {
        this.visitor = visitor;
    }

    public static boolean walk(List<GraphNode> order, List<PropertyEntry> outputs, ProgramVisitor visitor) {
        var walker = new ProgramWalker(visitor);
        for (var node : order) {
            if (!walker.visitNode(node)) {
                return false;
            }
        }
        for (var output : outputs) {
            if (!walker.walkEntry(output) || !visitor.visitOutput(output)) {
                return false;
            }
        }
        return true;
    }

    private boolean visitNode(GraphNode node) {
        if (node instanceof GraphNode.ConfigNode config) {
            var param = config.entry().param();
            return walk(config.entry().key())
                && walk(param.defaultValue())
                && walk(param.secret())
                && walk(param.type())
                && visitor.visitConfig(config);
        }
        if (node instanceof GraphNode.ExternalConfigNode external) {
            return visitor.visitExternalConfig(external);
        }
        if (node instanceof GraphNode.VariableNode variable) {
            return walkEntry(variable.entry()) && visitor.visitVariable(variable);
        }
        if (node instanceof GraphNode.ResourceNode resource) {
            return walk(resource.entry().key())
                && walkResource(resource.resource())
                && visitor.visitResource(resource);
        }
        if (node instanceof GraphNode.MissingNode missing) {
            return visitor.visitMissing(missing);
        }
        throw new IllegalStateException("Unknown graph node " + node.getClass().getSimpleName());
    }

    private boolean walkResource(ResourceDecl resource) {
        if (!walk(resource.type()) || !walk(resource.defaultProvider())) {
            return false;
        }
        for (var entry : resource.properties()) {
            if (!walkEntry(entry)) {
                return false;
            }
        }
        if (!walkOptions(resource.options())) {
            return false;
        }
        var get = resource.get();
        if (get != null) {
            if (!walk(get.id())) {
                return false;
            }
            for (var entry : get.state()) {
                if (!walkEntry(entry)) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean walkOptions(ResourceOptionsDecl options) {
        var exprs = new Expr[] {
            options.additionalSecretOutputs(), options.aliases(), options.deleteBeforeReplace(),
            options.dependsOn(), options.ignoreChanges(), options.importId(), options.parent(),
            options.protect(), options.provider(), options.providers(), options.version(),
            options.pluginDownloadUrl(), options.replaceOnChanges(), options.retainOnDelete(),
            options.deletedWith(),
        };
        for (var expr : exprs) {
            if (!walk(expr)) {
                return false;
            }
        }
        CustomTimeoutsDecl timeouts = options.customTimeouts();
        return timeouts == null
            || walk(timeouts.create()) && walk(timeouts.update()) && walk(timeouts.delete());
    }

    private boolean walkEntry(PropertyEntry entry) {
        return walk(entry.key()) && walk(entry.value());
    }

    private boolean walk(Expr expr) {
        if (expr == null || !visitor.walksExpressions()) {
            return true;
        }
        boolean ok = switch (expr.kind()) {
            case NULL, BOOLEAN, NUMBER, STRING, INTERPOLATE, SYMBOL -> true;
            case LIST -> walkAll(((ListExpr) expr).elements());
            case OBJECT -> walkObject((ObjectExpr) expr);
            case ASSET_ARCHIVE -> {
                var archive = (AssetArchiveExpr) expr;
                yield walk(archive.name()) && walkAll(List.copyOf(archive.entries().values()));
            }
            case INVOKE, JOIN, SPLIT, SELECT, TO_JSON, TO_BASE64, FROM_BASE64, SECRET, READ_FILE,
                STACK_REFERENCE, STRING_ASSET, FILE_ASSET, REMOTE_ASSET, FILE_ARCHIVE, REMOTE_ARCHIVE -> {
                var builtin = (BuiltinExpr) expr;
                yield walk(builtin.name()) && walk(builtin.args());
            }
        };
        return ok && visitor.visitExpr(expr);
    }

    private boolean walkAll(List<Expr> exprs) {
        for (var expr : exprs) {
            if (!walk(expr)) {
                return false;
            }
        }
        return true;
    }

    private boolean walkObject(ObjectExpr object) {
        for (var entry : object.entries()) {
            if (!walk(entry.key()) || !walk(entry.value())) {
                return false;
            }
        }
        return true;
    }
}
