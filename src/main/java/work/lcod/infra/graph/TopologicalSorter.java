package work.lcod.infra.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.schema.TypeTokens;
import work.lcod.infra.syntax.Diagnostic;
import work.lcod.infra.syntax.SourceRange;

/**
 * Orders configuration, variables and resources so that every node follows its dependencies.
 *
 * <p>Configuration is emitted first in declaration order. Everything else is visited depth-first,
 * picking the next unvisited node in declaration order so the output is reproducible. A cycle is
 * reported once, at the node that closes it; only the nodes on that branch are dropped. References
 * made by outputs are resolved last, under the same missing-reference policy.
 */
public final class TopologicalSorter {
    private static final Logger log = LoggerFactory.getLogger(TopologicalSorter.class);

    public static final String RESERVED_NAME = "pulumi";

    private final TemplateDecl template;
    private final MissingReferencePolicy missingPolicy;
    private final List<Diagnostic> diags = new ArrayList<>();

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<Dependency>> dependencies = new HashMap<>();
    private final Map<String, String> defaultProviders = new HashMap<>();

    private final Set<String> visiting = new HashSet<>();
    private final Set<String> visited = new HashSet<>();
    private final Set<String> failed = new HashSet<>();
    private final List<GraphNode> sorted = new ArrayList<>();

    private TopologicalSorter(TemplateDecl template, MissingReferencePolicy missingPolicy) {
        this.template = template;
        this.missingPolicy = missingPolicy;
    }

    public static SortResult sort(TemplateDecl template) {
        return sort(template, List.of(), MissingReferencePolicy.ERROR);
    }

    public static SortResult sort(
        TemplateDecl template,
        List<GraphNode.ExternalConfigNode> externalConfig,
        MissingReferencePolicy missingPolicy
    ) {
        return new TopologicalSorter(template, missingPolicy).run(externalConfig);
    }

    private SortResult run(List<GraphNode.ExternalConfigNode> externalConfig) {
        var configNodes = new ArrayList<GraphNode>();
        template.configuration().forEach(entry -> configNodes.add(new GraphNode.ConfigNode(entry)));
        for (var node : configNodes) {
            if (register(node, List.of())) {
                visited.add(node.key());
                sorted.add(node);
            }
        }
        for (var node : externalConfig) {
            // declared configuration takes precedence over the raw stack value
            if (!nodes.containsKey(node.key()) && !RESERVED_NAME.equals(node.key())) {
                nodes.put(node.key(), node);
                dependencies.put(node.key(), List.of());
                visited.add(node.key());
                sorted.add(node);
            }
        }

        for (var entry : template.resources()) {
            var node = new GraphNode.ResourceNode(entry);
            var resource = entry.resource();
            if (resource.isDefaultProvider()) {
                registerDefaultProvider(node);
            }
            register(node, DependencyCollector.ofResource(resource));
        }
        for (var entry : template.variables()) {
            var node = new GraphNode.VariableNode(entry);
            register(node, DependencyCollector.ofExpr(entry.value()));
        }

        if (hasErrors()) {
            return new SortResult(sorted, diags);
        }

        for (var key : new ArrayList<>(nodes.keySet())) {
            if (!visited.contains(key) && !failed.contains(key)) {
                visit(key, nodes.get(key).range());
            }
        }
        // outputs are not nodes, but their references must resolve like any other
        for (var output : template.outputs()) {
            for (var dep : DependencyCollector.ofExpr(output.value())) {
                if (!RESERVED_NAME.equals(dep.name())) {
                    visit(dep.name(), dep.range());
                }
            }
        }
        log.debug("Scheduled {} nodes: {}", sorted.size(), sorted.stream().map(GraphNode::key).toList());
        return new SortResult(sorted, diags);
    }

    private boolean hasErrors() {
        return diags.stream().anyMatch(Diagnostic::isError);
    }

    private boolean register(GraphNode node, List<Dependency> deps) {
        var name = node.key();
        if (RESERVED_NAME.equals(name)) {
            diags.add(Diagnostic.error(node.range(),
                String.format("%s %s uses the reserved name pulumi", node.kind(), name)));
            return false;
        }
        var other = nodes.get(name);
        if (other instanceof GraphNode.ExternalConfigNode) {
            // a declaration shadows an undeclared stack setting of the same name
            sorted.remove(other);
            visited.remove(name);
            other = null;
        }
        if (other != null) {
            if (other.kind().equals(node.kind())) {
                diags.add(Diagnostic.error(node.range(), String.format("found duplicate %s %s", node.kind(), name)));
            } else {
                diags.add(Diagnostic.error(node.range(), String.format(
                    "%s %s cannot have the same name as %s %s", node.kind(), name, other.kind(), name)));
            }
            return false;
        }
        nodes.put(name, node);
        dependencies.put(name, deps);
        return true;
    }

    private void registerDefaultProvider(GraphNode.ResourceNode node) {
        var token = node.resource().typeToken();
        if (!TypeTokens.isProviderToken(token)) {
            diags.add(Diagnostic.error(node.range(), String.format(
                "resource %s is marked defaultProvider but its type %s is not a provider type", node.key(), token)));
            return;
        }
        var pkg = TypeTokens.packageName(token);
        var previous = defaultProviders.putIfAbsent(pkg, node.key());
        if (previous != null && !previous.equals(node.key())) {
            diags.add(Diagnostic.error(node.range(), String.format(
                "package %s has more than one default provider: %s and %s", pkg, previous, node.key())));
        }
    }

    private boolean visit(String name, SourceRange referenceRange) {
        var node = resolve(name, referenceRange);
        if (node == null) {
            return false;
        }
        var key = node.key();
        if (failed.contains(key)) {
            return false;
        }
        if (visiting.contains(key)) {
            diags.add(Diagnostic.error(referenceRange, String.format(
                "circular dependency of %s '%s' transitively on itself", node.kind(), key)));
            return false;
        }
        if (visited.contains(key)) {
            return true;
        }
        visiting.add(key);
        boolean ok = true;
        for (var dep : dependencies.getOrDefault(key, List.of())) {
            if (RESERVED_NAME.equals(dep.name())) {
                continue;
            }
            if (!visit(dep.name(), dep.range())) {
                ok = false;
                break;
            }
        }
        if (ok && node instanceof GraphNode.ResourceNode resourceNode) {
            ok = visitDefaultProvider(resourceNode);
        }
        visiting.remove(key);
        if (!ok) {
            failed.add(key);
            return false;
        }
        visited.add(key);
        sorted.add(node);
        return true;
    }

    private boolean visitDefaultProvider(GraphNode.ResourceNode node) {
        var resource = node.resource();
        if (resource.isDefaultProvider() || resource.options().provider() != null) {
            return true;
        }
        var token = resource.typeToken();
        int colon = token.indexOf(':');
        if (colon < 0) {
            return true;
        }
        var provider = defaultProviders.get(token.substring(0, colon));
        return provider == null || visit(provider, node.range());
    }

    private GraphNode resolve(String name, SourceRange referenceRange) {
        var node = nodes.get(name);
        if (node != null) {
            return node;
        }
        var project = template.projectName();
        if (!project.isEmpty() && name.startsWith(project + ":")) {
            var stripped = nodes.get(name.substring(project.length() + 1));
            if (stripped != null) {
                return stripped;
            }
        }
        if (missingPolicy == MissingReferencePolicy.ERROR) {
            diags.add(Diagnostic.error(referenceRange,
                String.format("resource, variable, or config value \"%s\" not found", name)));
            var missing = new GraphNode.MissingNode(name, referenceRange);
            nodes.put(name, missing);
            failed.add(name);
            return null;
        }
        var missing = new GraphNode.MissingNode(name, referenceRange);
        nodes.put(name, missing);
        dependencies.put(name, List.of());
        return missing;
    }
}
