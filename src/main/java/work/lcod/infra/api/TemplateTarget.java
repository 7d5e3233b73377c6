package work.lcod.infra.api;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public record TemplateTarget(Optional<Path> localPath, Optional<URI> remoteUri) {
    public TemplateTarget {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isEmpty() && remoteUri.isEmpty()) {
            throw new IllegalArgumentException("Either localPath or remoteUri must be present.");
        }
    }

    public static TemplateTarget forLocal(Path path) {
        return new TemplateTarget(Optional.of(path), Optional.empty());
    }

    public static TemplateTarget forRemote(URI uri) {
        return new TemplateTarget(Optional.empty(), Optional.of(uri));
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return localPath.map(Path::toString).or(() -> remoteUri.map(URI::toString)).orElse("unknown");
    }
}
