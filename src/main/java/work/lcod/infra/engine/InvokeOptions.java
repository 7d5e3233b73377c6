package work.lcod.infra.engine;

import java.util.List;

public record InvokeOptions(
    RemoteResource parent,
    RemoteResource provider,
    List<RemoteResource> dependsOn,
    String version,
    String pluginDownloadUrl
) {
    public static final InvokeOptions NONE = new InvokeOptions(null, null, List.of(), null, null);

    public InvokeOptions {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
