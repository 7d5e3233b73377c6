package work.lcod.infra.support;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.config.StackSettings;
import work.lcod.infra.engine.Engine;
import work.lcod.infra.engine.InMemoryEngine;
import work.lcod.infra.engine.InvokeRegistry;
import work.lcod.infra.eval.Output;
import work.lcod.infra.graph.MissingReferencePolicy;
import work.lcod.infra.runtime.ExecutionContext;
import work.lcod.infra.runtime.ProgramRun;
import work.lcod.infra.runtime.ProgramRunner;
import work.lcod.infra.runtime.TemplateLoader;
import work.lcod.infra.schema.SchemaReader;
import work.lcod.infra.schema.SchemaRegistry;
import work.lcod.infra.syntax.Diagnostic;
import work.lcod.infra.syntax.Diagnostics;

/**
 * Shared helpers for the runtime test suites: fixture paths, the {@code test} package schema and a
 * one-call way to schedule, check and evaluate an inline template.
 */
public final class InfraTestSupport {
    private InfraTestSupport() {}

    public static Path fixture(String... parts) {
        var path = Path.of("src", "test", "resources");
        for (var part : parts) {
            path = path.resolve(part);
        }
        return path.toAbsolutePath();
    }

    public static SchemaRegistry testSchemas() {
        return SchemaRegistry.of(SchemaReader.readFile(fixture("schemas", "test.json")));
    }

    public static TemplateDecl parse(String yaml, Diagnostics diags) {
        return TemplateLoader.parse("test.yaml", yaml, diags);
    }

    /**
     * Functions of the {@code test} package: {@code getZones} answers three zones per region and
     * {@code echo} returns its argument.
     */
    public static InvokeRegistry testInvokes() {
        return new InvokeRegistry()
            .register("test:index:getZones", args -> {
                var region = String.valueOf(args.get("region"));
                var names = List.of(region + "a", region + "b", region + "c");
                return Map.of("names", names, "count", names.size());
            })
            .register("test:index:echo", args -> Map.of("value", String.valueOf(args.get("value"))));
    }

    public static InMemoryEngine engine() {
        return InMemoryEngine.builder().invokes(testInvokes()).build();
    }

    public static ProgramRun run(String yaml) {
        return run(yaml, engine(), StackSettings.EMPTY);
    }

    public static ProgramRun run(String yaml, Engine engine) {
        return run(yaml, engine, StackSettings.EMPTY);
    }

    public static ProgramRun run(String yaml, Engine engine, StackSettings settings) {
        return run(yaml, engine, settings, Path.of("").toAbsolutePath(), MissingReferencePolicy.ERROR);
    }

    public static ProgramRun run(String yaml, Engine engine, StackSettings settings, Path workingDirectory,
                                 MissingReferencePolicy policy) {
        var diags = new Diagnostics();
        var template = parse(yaml, diags);
        var ctx = new ExecutionContext(engine, testSchemas(), diags, settings, template.projectName(),
            workingDirectory, workingDirectory);
        return ProgramRunner.run(template, ctx, policy);
    }

    /**
     * Resolution of a runtime value, waiting briefly when it is deferred.
     */
    public static Output.Resolution resolve(Object value) {
        if (!(value instanceof Output output)) {
            return new Output.Resolution(value, true, false);
        }
        try {
            return output.toFuture().get(5, TimeUnit.SECONDS);
        } catch (Exception ex) {
            throw new AssertionError("output did not resolve: " + Output.rootCause(ex).getMessage(), ex);
        }
    }

    public static Object value(Object value) {
        return resolve(value).value();
    }

    public static Object output(ProgramRun run, String name) {
        if (run.evaluation() == null) {
            throw new AssertionError("program was not evaluated:\n" + summaries(run.diagnostics()));
        }
        return value(run.evaluation().outputs().get(name));
    }

    public static String summaries(List<Diagnostic> diagnostics) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics) {
            sb.append(diagnostic).append('\n');
        }
        return sb.toString();
    }

    public static List<String> errorSummaries(List<Diagnostic> diagnostics) {
        return diagnostics.stream().filter(Diagnostic::isError).map(Diagnostic::summary).toList();
    }
}
