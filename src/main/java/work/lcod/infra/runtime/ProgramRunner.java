package work.lcod.infra.runtime;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.check.TypeChecker;
import work.lcod.infra.check.Typing;
import work.lcod.infra.eval.EvaluationResult;
import work.lcod.infra.eval.Evaluator;
import work.lcod.infra.graph.GraphNode;
import work.lcod.infra.graph.MissingReferencePolicy;
import work.lcod.infra.graph.SortResult;
import work.lcod.infra.graph.TopologicalSorter;

/**
 * Runs the three phases in order: schedule, type check, evaluate. A phase that reports an error
 * stops the run before the next one starts.
 */
public final class ProgramRunner {
    private static final Logger log = LoggerFactory.getLogger(ProgramRunner.class);

    private ProgramRunner() {}

    public static ProgramRun run(TemplateDecl template, ExecutionContext ctx, MissingReferencePolicy missingPolicy) {
        var diags = ctx.diagnostics();
        if (diags.hasErrors()) {
            log.debug("Template has errors before scheduling; skipping run");
            return new ProgramRun(null, null, null, diags.snapshot());
        }

        SortResult order = TopologicalSorter.sort(template, externalConfig(template, ctx), missingPolicy);
        diags.addAll(order.diagnostics());
        log.debug("Scheduled {}", order.keys());
        if (order.hasErrors()) {
            return new ProgramRun(order, null, null, diags.snapshot());
        }

        Typing typing = TypeChecker.check(template, order, ctx.schemas(), diags);
        if (diags.hasErrors()) {
            log.debug("Type check reported {} errors", diags.errors().size());
            return new ProgramRun(order, typing, null, diags.snapshot());
        }

        EvaluationResult evaluation = Evaluator.evaluate(template, order, ctx);
        return new ProgramRun(order, typing, evaluation, diags.snapshot());
    }

    static List<GraphNode.ExternalConfigNode> externalConfig(TemplateDecl template, ExecutionContext ctx) {
        var declared = new HashSet<String>();
        template.configuration().forEach(entry -> declared.add(entry.name()));
        var result = new ArrayList<GraphNode.ExternalConfigNode>();
        ctx.settings().localConfig(ctx.project()).forEach((key, value) -> {
            if (!declared.contains(key)) {
                result.add(new GraphNode.ExternalConfigNode(key, value));
            }
        });
        return result;
    }
}
