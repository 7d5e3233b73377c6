package work.lcod.infra.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import work.lcod.infra.syntax.Diagnostic;
import work.lcod.infra.syntax.Diagnostics;
import work.lcod.infra.syntax.SourceRange;
import work.lcod.infra.syntax.SyntaxNode;

/**
 * Turns raw syntax nodes into expressions.
 *
 * <p>Strings become string literals, symbols ({@code "${a.b}"}) or interpolations. Single-key
 * objects whose key names a builtin become the matching builtin expression; asset and archive
 * keys must stand alone in their object.
 */
public final class ExpressionParser {
    private static final Pattern INVOKE_SHORTHAND = Pattern.compile("fn::[^:]+:[^:]+(:[^:]+)?$");

    private static final Map<String, ExprKind> BUILTINS = new LinkedHashMap<>();
    private static final Map<String, ExprKind> ASSETS = new LinkedHashMap<>();

    static {
        for (var kind : ExprKind.values()) {
            if (!kind.isBuiltin()) {
                continue;
            }
            var key = kind.label().toLowerCase(Locale.ROOT);
            if (AssetExpr.isAssetOrArchive(kind) && kind != ExprKind.ASSET_ARCHIVE) {
                ASSETS.put(key, kind);
            } else {
                BUILTINS.put(key, kind);
            }
        }
    }

    private final Diagnostics diags;

    public ExpressionParser(Diagnostics diags) {
        this.diags = diags;
    }

    public Expr parse(SyntaxNode node) {
        if (node instanceof SyntaxNode.NullNode n) {
            return new NullExpr(n.range());
        }
        if (node instanceof SyntaxNode.BooleanNode b) {
            return new BooleanExpr(b.range(), b.value());
        }
        if (node instanceof SyntaxNode.NumberNode n) {
            return new NumberExpr(n.range(), n.value());
        }
        if (node instanceof SyntaxNode.StringNode s) {
            return parseString(s);
        }
        if (node instanceof SyntaxNode.ListNode l) {
            var elements = new ArrayList<Expr>();
            for (var element : l.elements()) {
                elements.add(parse(element));
            }
            return new ListExpr(l.range(), elements);
        }
        if (node instanceof SyntaxNode.ObjectNode o) {
            return parseObject(o);
        }
        diags.error(node.range(), "unexpected syntax node " + node.getClass().getSimpleName());
        return new NullExpr(node.range());
    }

    /**
     * Parses {@code "${name}"} style references; anything else is reported and yields null.
     */
    public SymbolExpr parseSubstitution(SyntaxNode.StringNode node) {
        var expr = parseString(node);
        if (expr instanceof SymbolExpr symbol) {
            return symbol;
        }
        diags.error(node.range(), "Must be a valid substitution, e.g.: like ${resourceName}");
        return null;
    }

    private Expr parseString(SyntaxNode.StringNode node) {
        var parts = InterpolationParser.parse(node.value(), node.range(), diags);
        if (parts == null) {
            return new StringExpr(node.range(), node.value());
        }
        if (parts.isEmpty()) {
            return new StringExpr(node.range(), "");
        }
        if (parts.size() == 1) {
            var only = parts.get(0);
            if (only.value() == null) {
                return new StringExpr(node.range(), only.text());
            }
            if (only.text().isEmpty()) {
                return new SymbolExpr(node.range(), only.value());
            }
        }
        return new InterpolateExpr(node.range(), parts);
    }

    private Expr parseObject(SyntaxNode.ObjectNode node) {
        if (node.entries().size() == 1) {
            var builtin = tryParseBuiltin(node);
            if (builtin != null) {
                return builtin;
            }
        }
        var entries = new ArrayList<ObjectExpr.Property>();
        for (var entry : node.entries()) {
            var keyName = entry.key().value();
            var assetKind = ASSETS.get(keyName.toLowerCase(Locale.ROOT));
            if (assetKind != null) {
                diags.add(Diagnostic.unexpectedCasing(entry.key().range(), assetKind.label(), keyName));
                if (node.entries().size() != 1) {
                    diags.error(node.range(), keyName + " must have its own object");
                    continue;
                }
                var name = new StringExpr(entry.key().range(), keyName);
                return new AssetExpr(node.range(), name, assetKind, parse(entry.value()));
            }
            entries.add(new ObjectExpr.Property(parseString(entry.key()), parse(entry.value())));
        }
        return new ObjectExpr(node.range(), entries);
    }

    private Expr tryParseBuiltin(SyntaxNode.ObjectNode node) {
        var entry = node.entries().get(0);
        var key = entry.key().value();
        var lower = key.toLowerCase(Locale.ROOT);
        if (ASSETS.containsKey(lower)) {
            return null;
        }
        var kind = BUILTINS.get(lower);
        var valueNode = entry.value();
        var name = new StringExpr(entry.key().range(), key);
        if (kind == null) {
            if (INVOKE_SHORTHAND.matcher(lower).matches()) {
                var token = new StringExpr(entry.key().range(), key.substring(4));
                var args = parse(valueNode);
                var callArgs = args instanceof ObjectExpr o ? o : null;
                if (callArgs == null && !(args instanceof NullExpr)) {
                    diags.error(args.range(), "function arguments ('arguments') must be an object");
                    return asObject(node, name, args);
                }
                return new InvokeExpr(node.range(), name, callArgs, token, callArgs, InvokeOptionsDecl.EMPTY, null);
            }
            if (lower.startsWith("fn::")) {
                diags.warning(entry.key().range(), "'fn::' is a reserved prefix",
                    String.format("If you need to use the raw key '%s', quote it differently or rename it", key));
            }
            return null;
        }
        diags.add(Diagnostic.unexpectedCasing(entry.key().range(), kind.label(), key));
        if (kind == ExprKind.STACK_REFERENCE) {
            diags.warning(entry.key().range(),
                "'fn::stackReference' is deprecated; please use 'pulumi:pulumi:StackReference' instead", "");
        }
        var args = parse(valueNode);
        var range = node.range();
        Expr parsed = switch (kind) {
            case INVOKE -> parseInvoke(range, name, args, valueNode);
            case JOIN -> {
                var list = twoValued(kind, args);
                yield list == null ? null : new JoinExpr(range, name, list);
            }
            case SPLIT -> {
                var list = twoValued(kind, args);
                yield list == null ? null : new SplitExpr(range, name, list);
            }
            case SELECT -> {
                var list = twoValued(kind, args);
                yield list == null ? null : new SelectExpr(range, name, list);
            }
            case TO_JSON -> new ToJsonExpr(range, name, args);
            case TO_BASE64 -> new ToBase64Expr(range, name, args);
            case FROM_BASE64 -> new FromBase64Expr(range, name, args);
            case SECRET -> new SecretExpr(range, name, args);
            case READ_FILE -> new ReadFileExpr(range, name, args);
            case STACK_REFERENCE -> parseStackReference(range, name, args);
            case ASSET_ARCHIVE -> parseAssetArchive(range, name, args);
            default -> throw new IllegalStateException("Unhandled builtin " + kind);
        };
        return parsed != null ? parsed : asObject(node, name, args);
    }

    private static ObjectExpr asObject(SyntaxNode.ObjectNode node, StringExpr name, Expr args) {
        return new ObjectExpr(node.range(), List.of(new ObjectExpr.Property(name, args)));
    }

    private ListExpr twoValued(ExprKind kind, Expr args) {
        if (args instanceof ListExpr list && list.elements().size() == 2) {
            return list;
        }
        diags.error(args.range(), "the argument to " + kind.label() + " must be a two-valued list");
        return null;
    }

    private Expr parseInvoke(SourceRange range, StringExpr name, Expr args, SyntaxNode argsNode) {
        if (!(args instanceof ObjectExpr obj) || !(argsNode instanceof SyntaxNode.ObjectNode objNode)) {
            diags.error(args.range(),
                "the argument to fn::invoke must be an object containing 'function', 'arguments', 'options', and 'return'");
            return null;
        }
        Expr function = null;
        Expr arguments = null;
        Expr returnExpr = null;
        var options = InvokeOptionsDecl.EMPTY;
        int before = diags.errors().size();
        for (int i = 0; i < obj.entries().size(); i++) {
            var entry = obj.entries().get(i);
            if (!(entry.key() instanceof StringExpr key)) {
                continue;
            }
            var keyRange = key.range();
            switch (key.value().toLowerCase(Locale.ROOT)) {
                case "function" -> {
                    diags.add(Diagnostic.unexpectedCasing(keyRange, "function", key.value()));
                    function = entry.value();
                }
                case "arguments" -> {
                    diags.add(Diagnostic.unexpectedCasing(keyRange, "arguments", key.value()));
                    arguments = entry.value();
                }
                case "options" -> {
                    diags.add(Diagnostic.unexpectedCasing(keyRange, "options", key.value()));
                    options = new TemplateParser(diags).parseInvokeOptions(objNode.entries().get(i).value());
                }
                case "return" -> {
                    diags.add(Diagnostic.unexpectedCasing(keyRange, "return", key.value()));
                    returnExpr = entry.value();
                }
                default -> {
                }
            }
        }
        if (!(function instanceof StringExpr)) {
            if (function == null) {
                diags.error(obj.range(), "missing function name ('function')");
            } else {
                diags.error(function.range(), "function name must be a string literal");
            }
        }
        if (arguments != null && !(arguments instanceof ObjectExpr)) {
            diags.error(arguments.range(), "function arguments ('arguments') must be an object");
        }
        if (returnExpr != null && !(returnExpr instanceof StringExpr)) {
            diags.error(returnExpr.range(), "return directive must be a string literal");
        }
        if (diags.errors().size() > before) {
            return null;
        }
        return new InvokeExpr(range, name, obj, (StringExpr) function, (ObjectExpr) arguments, options,
            (StringExpr) returnExpr);
    }

    private Expr parseStackReference(SourceRange range, StringExpr name, Expr args) {
        var list = twoValued(ExprKind.STACK_REFERENCE, args);
        if (list == null) {
            return null;
        }
        if (!(list.elements().get(0) instanceof StringExpr stackName)) {
            diags.error(args.range(), "the first argument to fn::stackReference must be a string literal");
            return null;
        }
        return new StackReferenceExpr(range, name, list, stackName, list.elements().get(1));
    }

    private Expr parseAssetArchive(SourceRange range, StringExpr name, Expr args) {
        if (!(args instanceof ObjectExpr obj)) {
            diags.error(args.range(), "the argument to fn::assetArchive must be an object");
            return null;
        }
        var entries = new LinkedHashMap<String, Expr>();
        boolean ok = true;
        for (var entry : obj.entries()) {
            if (!(entry.key() instanceof StringExpr key)) {
                diags.error(entry.key().range(), "keys in fn::assetArchive arguments must be string literals");
                ok = false;
                continue;
            }
            var value = entry.value();
            if (!AssetExpr.isAssetOrArchive(value.kind())) {
                diags.error(value.range(), "value must be an asset or an archive, not " + value.kind().describe());
                ok = false;
                continue;
            }
            entries.put(key.value(), value);
        }
        return ok ? new AssetArchiveExpr(range, name, obj, entries) : null;
    }
}
