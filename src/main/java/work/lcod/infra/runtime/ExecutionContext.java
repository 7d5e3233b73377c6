package work.lcod.infra.runtime;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import work.lcod.infra.config.StackSettings;
import work.lcod.infra.engine.Engine;
import work.lcod.infra.schema.SchemaRegistry;
import work.lcod.infra.syntax.Diagnostics;

/**
 * Everything one program run needs besides the template: the engine, schemas, stack identity and
 * settings, the diagnostic sink and the directories relative paths resolve against.
 */
public final class ExecutionContext {
    private final Engine engine;
    private final SchemaRegistry schemas;
    private final Diagnostics diagnostics;
    private final StackSettings settings;
    private final String project;
    private final Path workingDirectory;
    private final Path rootDirectory;

    public ExecutionContext(Engine engine, SchemaRegistry schemas, Diagnostics diagnostics, StackSettings settings,
                            String project, Path workingDirectory, Path rootDirectory) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.diagnostics = diagnostics == null ? new Diagnostics() : diagnostics;
        this.settings = settings == null ? StackSettings.EMPTY : settings;
        this.project = project == null ? "" : project;
        this.workingDirectory = normalize(workingDirectory);
        this.rootDirectory = rootDirectory == null ? this.workingDirectory : normalize(rootDirectory);
    }

    private static Path normalize(Path path) {
        var base = path == null ? Paths.get("") : path;
        return base.toAbsolutePath().normalize();
    }

    public Engine engine() {
        return engine;
    }

    public SchemaRegistry schemas() {
        return schemas;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }

    public StackSettings settings() {
        return settings;
    }

    public String project() {
        return project.isEmpty() ? settings.project() : project;
    }

    public String stack() {
        return settings.stack();
    }

    public String organization() {
        return settings.organization();
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public Path rootDirectory() {
        return rootDirectory;
    }
}
