package work.lcod.infra.engine;

import java.util.Map;
import work.lcod.infra.eval.Output;
import work.lcod.infra.syntax.Severity;

/**
 * Orchestration engine the evaluator drives. Calls are made synchronously in evaluation order;
 * the engine resolves the returned outputs whenever remote state becomes known, possibly on
 * another thread.
 */
public interface Engine {
    RemoteResource registerResource(ResourceRegistration registration);

    RemoteResource readResource(ResourceRegistration registration, Object id);

    /**
     * Calls a provider function. {@code args} is concrete: the evaluator waits for deferred arguments first.
     */
    Output invoke(String token, Map<String, Object> args, InvokeOptions options);

    StackReference stackReference(String stackName);

    void log(Severity severity, String message);

    boolean isPreview();
}
