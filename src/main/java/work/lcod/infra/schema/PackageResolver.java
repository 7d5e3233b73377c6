package work.lcod.infra.schema;

import java.util.Optional;

@FunctionalInterface
public interface PackageResolver {
    Optional<PackageSchema> load(String packageName);
}
