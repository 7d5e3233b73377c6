package work.lcod.infra.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.config.StackSettings;
import work.lcod.infra.config.StackSettingsLoader;
import work.lcod.infra.engine.InMemoryEngine;
import work.lcod.infra.eval.Output;
import work.lcod.infra.eval.Values;
import work.lcod.infra.runtime.ExecutionContext;
import work.lcod.infra.runtime.ProgramRunner;
import work.lcod.infra.runtime.TemplateLoader;
import work.lcod.infra.schema.DirectoryPackageResolver;
import work.lcod.infra.schema.PackageResolver;
import work.lcod.infra.schema.SchemaRegistry;
import work.lcod.infra.syntax.Diagnostics;

/**
 * Public entry point for embedding the runtime: loads a template, runs it against an engine and
 * collects the stack outputs.
 */
public final class InfraRunner {
    private static final Logger log = LoggerFactory.getLogger(InfraRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    static final String UNKNOWN_OUTPUT = "[unknown]";
    static final String SECRET_OUTPUT = "[secret]";

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var diags = new Diagnostics();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("template", configuration.target().display());
        metadata.put("logLevel", configuration.logLevel().name());
        try {
            configuration.logLevel().apply();
            var template = loadTemplate(configuration, diags);
            var settings = stackSettings(configuration, template);
            metadata.put("project", settings.project());
            metadata.put("stack", settings.stack());
            var engine = configuration.engine().orElseGet(() -> InMemoryEngine.builder()
                .project(settings.project())
                .stack(settings.stack())
                .preview(configuration.preview())
                .build());
            var ctx = new ExecutionContext(engine, schemaRegistry(configuration), diags, settings,
                settings.project(), configuration.workingDirectory(), rootDirectory(configuration));

            var run = ProgramRunner.run(template, ctx, configuration.missingPolicy());
            if (!run.evaluated()) {
                metadata.put("diagnostics", diags.size());
                return RunResult.failure("template has errors", diags.snapshot(), metadata, started);
            }
            var outputs = collectOutputs(run.evaluation().outputs(), configuration);
            metadata.put("resourceCount", run.evaluation().resources().size());
            metadata.put("diagnostics", diags.size());
            if (!run.evaluation().completed() || diags.hasErrors()) {
                return RunResult.failure("evaluation failed", diags.snapshot(), metadata, started);
            }
            log.info("Run of {} finished with {} resources", settings.project(), run.evaluation().resources().size());
            return engine.isPreview()
                ? RunResult.planned(outputs, diags.snapshot(), metadata, started)
                : RunResult.success(outputs, diags.snapshot(), metadata, started);
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (Boolean.getBoolean("infra.debug")) {
                ex.printStackTrace();
            }
            log.error("Run of {} failed", configuration.target().display(), ex);
            return RunResult.failure(ex.getMessage(), diags.snapshot(), metadata, started);
        }
    }

    public RunResult runToJson(RunConfiguration configuration) {
        var result = run(configuration);
        try {
            var json = JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toSerializableMap());
            return result.withSerializedPayload(json);
        } catch (JsonProcessingException ex) {
            return RunResult.failure("Unable to serialize result payload: " + ex.getMessage(), result.diagnostics(), Map.of(), result.startedAt());
        }
    }

    private TemplateDecl loadTemplate(RunConfiguration configuration, Diagnostics diags) {
        var target = configuration.target();
        return target.remoteUri()
            .map(uri -> TemplateLoader.loadFromHttp(uri, diags))
            .orElseGet(() -> TemplateLoader.loadFromLocalFile(
                configuration.workingDirectory().resolve(target.localPath().orElseThrow()), diags));
    }

    private static Path rootDirectory(RunConfiguration configuration) {
        var local = configuration.target().localPath();
        if (local.isEmpty()) {
            return configuration.workingDirectory();
        }
        var parent = configuration.workingDirectory().resolve(local.get()).toAbsolutePath().getParent();
        return parent == null ? configuration.workingDirectory() : parent;
    }

    /**
     * Settings file first, then explicit values from the configuration, then the template name as project.
     */
    private StackSettings stackSettings(RunConfiguration configuration, TemplateDecl template) {
        var base = configuration.stackSettingsFile()
            .map(file -> StackSettingsLoader.load(configuration.workingDirectory().resolve(file)))
            .orElse(StackSettings.EMPTY);
        var project = firstNonEmpty(configuration.project(), template.projectName(), base.project());
        var stack = firstNonEmpty(configuration.stack(), base.stack(), "dev");
        var organization = firstNonEmpty(configuration.organization(), base.organization());
        return new StackSettings(project, stack, organization, base.config()).withConfig(configuration.config());
    }

    private static String firstNonEmpty(String... values) {
        for (var value : values) {
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private SchemaRegistry schemaRegistry(RunConfiguration configuration) {
        PackageResolver resolver = configuration.schemaDirectory()
            .<PackageResolver>map(dir -> new DirectoryPackageResolver(configuration.workingDirectory().resolve(dir)))
            .orElse(name -> Optional.empty());
        return new SchemaRegistry(resolver);
    }

    /**
     * Waits for every stack output. Unknown values render as {@value #UNKNOWN_OUTPUT}, secrets as
     * {@value #SECRET_OUTPUT}; failed outputs are left out since their error is already a diagnostic.
     */
    private Map<String, Object> collectOutputs(Map<String, Object> outputs, RunConfiguration configuration)
        throws InterruptedException, TimeoutException {
        var result = new LinkedHashMap<String, Object>();
        for (var entry : outputs.entrySet()) {
            if (!(entry.getValue() instanceof Output output)) {
                result.put(entry.getKey(), Values.toPlain(entry.getValue()));
                continue;
            }
            try {
                var future = output.toFuture();
                var resolution = configuration.timeout().isPresent()
                    ? future.get(configuration.timeout().get().toMillis(), TimeUnit.MILLISECONDS)
                    : future.get();
                if (!resolution.known()) {
                    result.put(entry.getKey(), UNKNOWN_OUTPUT);
                } else if (resolution.secret()) {
                    result.put(entry.getKey(), SECRET_OUTPUT);
                } else {
                    result.put(entry.getKey(), Values.toPlain(resolution.value()));
                }
            } catch (ExecutionException ex) {
                log.warn("Output {} failed: {}", entry.getKey(), Output.rootCause(ex).getMessage());
            }
        }
        return result;
    }
}
