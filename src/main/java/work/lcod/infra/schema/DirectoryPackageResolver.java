package work.lcod.infra.schema;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class DirectoryPackageResolver implements PackageResolver {
    private final Path directory;

    public DirectoryPackageResolver(Path directory) {
        this.directory = directory;
    }

    @Override
    public Optional<PackageSchema> load(String packageName) {
        var file = directory.resolve(packageName + ".json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(SchemaReader.readFile(file));
    }
}
