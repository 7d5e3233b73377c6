package work.lcod.infra.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.infra.engine.Engine;
import work.lcod.infra.graph.MissingReferencePolicy;

/**
 * Immutable settings for one {@link InfraRunner} run.
 *
 * <p>{@code project}, {@code stack} and {@code organization} override the stack-settings file when
 * non-empty; {@code config} entries are layered on top of its {@code [config]} table. Without an
 * explicit {@code engine} the run uses an in-memory engine.
 */
public record RunConfiguration(
    TemplateTarget target,
    Path workingDirectory,
    String project,
    String stack,
    String organization,
    boolean preview,
    MissingReferencePolicy missingPolicy,
    Map<String, Object> config,
    Optional<Path> stackSettingsFile,
    Optional<Path> schemaDirectory,
    Optional<Engine> engine,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public RunConfiguration {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(missingPolicy, "missingPolicy");
        Objects.requireNonNull(stackSettingsFile, "stackSettingsFile");
        Objects.requireNonNull(schemaDirectory, "schemaDirectory");
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        project = project == null ? "" : project;
        stack = stack == null ? "" : stack;
        organization = organization == null ? "" : organization;
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config == null ? Map.of() : config));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TemplateTarget target;
        private Path workingDirectory = Paths.get("");
        private String project = "";
        private String stack = "";
        private String organization = "";
        private boolean preview;
        private MissingReferencePolicy missingPolicy = MissingReferencePolicy.ERROR;
        private final Map<String, Object> config = new LinkedHashMap<>();
        private Optional<Path> stackSettingsFile = Optional.empty();
        private Optional<Path> schemaDirectory = Optional.empty();
        private Optional<Engine> engine = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder target(TemplateTarget target) {
            this.target = target;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder stack(String stack) {
            this.stack = stack;
            return this;
        }

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder preview(boolean preview) {
            this.preview = preview;
            return this;
        }

        public Builder missingPolicy(MissingReferencePolicy missingPolicy) {
            this.missingPolicy = missingPolicy;
            return this;
        }

        public Builder config(String key, Object value) {
            this.config.put(key, value);
            return this;
        }

        public Builder config(Map<String, Object> values) {
            this.config.putAll(values);
            return this;
        }

        public Builder stackSettingsFile(Path file) {
            this.stackSettingsFile = Optional.ofNullable(file);
            return this;
        }

        public Builder schemaDirectory(Path directory) {
            this.schemaDirectory = Optional.ofNullable(directory);
            return this;
        }

        public Builder engine(Engine engine) {
            this.engine = Optional.ofNullable(engine);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Optional.ofNullable(timeout);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                target,
                workingDirectory,
                project,
                stack,
                organization,
                preview,
                missingPolicy,
                config,
                stackSettingsFile,
                schemaDirectory,
                engine,
                timeout,
                logLevel
            );
        }
    }
}
