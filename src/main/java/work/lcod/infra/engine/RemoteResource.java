package work.lcod.infra.engine;

import work.lcod.infra.eval.Output;

/**
 * Engine-side state of a registered or read resource. Outputs are deferred until the engine replies.
 */
public interface RemoteResource {
    String name();

    String token();

    ResourceKind kind();

    String urn();

    /**
     * Provider-assigned id; resolves to null for components.
     */
    Output id();

    Output output(String key);

    Output outputs();
}
