package work.lcod.infra.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import work.lcod.infra.syntax.Diagnostic;
import work.lcod.infra.syntax.Diagnostics;
import work.lcod.infra.syntax.SourceRange;
import work.lcod.infra.syntax.SyntaxNode;

/**
 * Reads the template sections and declaration records. Each record lists its known field names;
 * keys are matched ignoring case (with a casing warning) and unknown keys produce a warning.
 */
public final class TemplateParser {
    private final Diagnostics diags;
    private final ExpressionParser expressions;

    public TemplateParser(Diagnostics diags) {
        this.diags = diags;
        this.expressions = new ExpressionParser(diags);
    }

    public static TemplateDecl parse(SyntaxNode root, Diagnostics diags) {
        return new TemplateParser(diags).parseTemplate(root);
    }

    public TemplateDecl parseTemplate(SyntaxNode root) {
        var name = new StringExpr[1];
        var runtime = new StringExpr[1];
        var description = new StringExpr[1];
        var configuration = new ArrayList<TemplateDecl.ConfigEntry>();
        var variables = new ArrayList<PropertyEntry>();
        var resources = new ArrayList<TemplateDecl.ResourceEntry>();
        var outputs = new ArrayList<PropertyEntry>();

        forEachField("template", root, TemplateDecl.FIELDS, (field, value) -> {
            switch (field) {
                case "name" -> name[0] = expectString(field, value);
                case "runtime" -> runtime[0] = expectString(field, value);
                case "description" -> description[0] = expectString(field, value);
                case "configuration", "config" -> forEachEntry(field, value, (key, node) ->
                    configuration.add(new TemplateDecl.ConfigEntry(key, parseConfigParam(key.value(), node))));
                case "variables" -> forEachEntry(field, value, (key, node) ->
                    variables.add(new PropertyEntry(key, expressions.parse(node))));
                case "resources" -> forEachEntry(field, value, (key, node) ->
                    resources.add(new TemplateDecl.ResourceEntry(key, parseResource(key.value(), node))));
                case "outputs" -> forEachEntry(field, value, (key, node) ->
                    outputs.add(new PropertyEntry(key, expressions.parse(node))));
                default -> throw new IllegalStateException("Unhandled template field " + field);
            }
        });
        return new TemplateDecl(root.range(), name[0], runtime[0], description[0],
            configuration, variables, resources, outputs);
    }

    ConfigParamDecl parseConfigParam(String name, SyntaxNode node) {
        var type = new StringExpr[1];
        var defaultValue = new Expr[1];
        var secret = new BooleanExpr[1];
        forEachField(name, node, ConfigParamDecl.FIELDS, (field, value) -> {
            switch (field) {
                case "type" -> type[0] = expectString(field, value);
                case "default" -> defaultValue[0] = expressions.parse(value);
                case "secret" -> secret[0] = expectBoolean(field, value);
                default -> throw new IllegalStateException("Unhandled config field " + field);
            }
        });
        return new ConfigParamDecl(node.range(), type[0], defaultValue[0], secret[0]);
    }

    ResourceDecl parseResource(String name, SyntaxNode node) {
        var type = new StringExpr[1];
        var defaultProvider = new BooleanExpr[1];
        var properties = new ArrayList<PropertyEntry>();
        var options = new ResourceOptionsDecl[] {ResourceOptionsDecl.EMPTY};
        var get = new GetResourceDecl[1];
        forEachField(name, node, ResourceDecl.FIELDS, (field, value) -> {
            switch (field) {
                case "type" -> type[0] = expectString(field, value);
                case "defaultProvider" -> defaultProvider[0] = expectBoolean(field, value);
                case "properties" -> forEachEntry(field, value, (key, v) ->
                    properties.add(new PropertyEntry(key, expressions.parse(v))));
                case "options" -> options[0] = parseResourceOptions(value);
                case "get" -> get[0] = parseGet(value);
                default -> throw new IllegalStateException("Unhandled resource field " + field);
            }
        });
        if (type[0] == null && node instanceof SyntaxNode.ObjectNode) {
            diags.error(node.range(), "Required field 'type' is missing on resource \"" + name + "\"");
        }
        return new ResourceDecl(node.range(), type[0], defaultProvider[0], properties, options[0], get[0]);
    }

    ResourceOptionsDecl parseResourceOptions(SyntaxNode node) {
        var builder = ResourceOptionsDecl.builder().range(node.range());
        forEachField("resourceOptions", node, ResourceOptionsDecl.FIELDS, (field, value) -> {
            switch (field) {
                case "additionalSecretOutputs" -> builder.additionalSecretOutputs(expressions.parse(value));
                case "aliases" -> builder.aliases(expressions.parse(value));
                case "customTimeouts" -> builder.customTimeouts(parseCustomTimeouts(value));
                case "deleteBeforeReplace" -> builder.deleteBeforeReplace(expressions.parse(value));
                case "dependsOn" -> builder.dependsOn(expressions.parse(value));
                case "ignoreChanges" -> builder.ignoreChanges(expressions.parse(value));
                case "import" -> builder.importId(expressions.parse(value));
                case "parent" -> builder.parent(expressions.parse(value));
                case "protect" -> builder.protect(expressions.parse(value));
                case "provider" -> builder.provider(expressions.parse(value));
                case "providers" -> builder.providers(expressions.parse(value));
                case "version" -> builder.version(expectString(field, value));
                case "pluginDownloadURL" -> builder.pluginDownloadUrl(expectString(field, value));
                case "replaceOnChanges" -> builder.replaceOnChanges(expressions.parse(value));
                case "retainOnDelete" -> builder.retainOnDelete(expressions.parse(value));
                case "deletedWith" -> builder.deletedWith(expressions.parse(value));
                default -> throw new IllegalStateException("Unhandled option " + field);
            }
        });
        return builder.build();
    }

    InvokeOptionsDecl parseInvokeOptions(SyntaxNode node) {
        var exprs = new Expr[3];
        var strings = new StringExpr[2];
        forEachField("invokeOptions", node, InvokeOptionsDecl.FIELDS, (field, value) -> {
            switch (field) {
                case "parent" -> exprs[0] = expressions.parse(value);
                case "provider" -> exprs[1] = expressions.parse(value);
                case "dependsOn" -> exprs[2] = expressions.parse(value);
                case "version" -> strings[0] = expectString(field, value);
                case "pluginDownloadURL" -> strings[1] = expectString(field, value);
                default -> throw new IllegalStateException("Unhandled invoke option " + field);
            }
        });
        return new InvokeOptionsDecl(node.range(), exprs[0], exprs[1], exprs[2], strings[0], strings[1]);
    }

    private CustomTimeoutsDecl parseCustomTimeouts(SyntaxNode node) {
        var values = new StringExpr[3];
        forEachField("customTimeouts", node, CustomTimeoutsDecl.FIELDS, (field, value) -> {
            switch (field) {
                case "create" -> values[0] = expectString(field, value);
                case "update" -> values[1] = expectString(field, value);
                case "delete" -> values[2] = expectString(field, value);
                default -> throw new IllegalStateException("Unhandled timeout " + field);
            }
        });
        return new CustomTimeoutsDecl(node.range(), values[0], values[1], values[2]);
    }

    private GetResourceDecl parseGet(SyntaxNode node) {
        var id = new Expr[1];
        var state = new ArrayList<PropertyEntry>();
        forEachField("get", node, GetResourceDecl.FIELDS, (field, value) -> {
            switch (field) {
                case "id" -> id[0] = expressions.parse(value);
                case "state" -> forEachEntry(field, value, (key, v) -> state.add(new PropertyEntry(key, expressions.parse(v))));
                default -> throw new IllegalStateException("Unhandled get field " + field);
            }
        });
        if (id[0] == null) {
            diags.error(node.range(), "Required field 'id' is missing on get");
        }
        return new GetResourceDecl(node.range(), id[0], state);
    }

    private StringExpr expectString(String field, SyntaxNode node) {
        var expr = expressions.parse(node);
        if (expr instanceof StringExpr s) {
            return s;
        }
        diags.error(expr.range(), field + " must be a string");
        return null;
    }

    private BooleanExpr expectBoolean(String field, SyntaxNode node) {
        var expr = expressions.parse(node);
        if (expr instanceof BooleanExpr b) {
            return b;
        }
        diags.error(expr.range(), field + " must be a boolean value");
        return null;
    }

    private void forEachEntry(String objName, SyntaxNode node, EntryHandler handler) {
        if (node instanceof SyntaxNode.NullNode) {
            return;
        }
        if (!(node instanceof SyntaxNode.ObjectNode obj)) {
            diags.error(node.range(), objName + " must be an object");
            return;
        }
        for (var entry : obj.entries()) {
            var key = new StringExpr(entry.key().range(), entry.key().value());
            handler.accept(key, entry.value());
        }
    }

    private void forEachField(String objName, SyntaxNode node, List<String> fields, FieldHandler handler) {
        if (!(node instanceof SyntaxNode.ObjectNode obj)) {
            diags.error(node.range(), objName + " must be an object");
            return;
        }
        for (var entry : obj.entries()) {
            var key = entry.key().value();
            var match = fields.stream().filter(f -> f.equalsIgnoreCase(key)).findFirst();
            if (match.isEmpty()) {
                diags.add(unknownField(objName, key, entry.key().range(), fields));
                continue;
            }
            diags.add(Diagnostic.unexpectedCasing(entry.key().range(), match.get(), key));
            handler.accept(match.get(), entry.value());
        }
    }

    private static Diagnostic unknownField(String objName, String key, SourceRange range, List<String> fields) {
        var detail = fields.isEmpty()
            ? "note: '" + objName + "' has no fields"
            : "note: available fields are: " + fields.stream().map(f -> "'" + f + "'").collect(Collectors.joining(", "));
        return Diagnostic.warning(range, String.format("Object '%s' has no field named '%s'", objName, key), detail);
    }

    @FunctionalInterface
    private interface FieldHandler {
        void accept(String field, SyntaxNode value);
    }

    @FunctionalInterface
    private interface EntryHandler {
        void accept(StringExpr key, SyntaxNode value);
    }
}
