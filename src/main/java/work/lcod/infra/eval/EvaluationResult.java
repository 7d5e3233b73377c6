package work.lcod.infra.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.infra.engine.RemoteResource;

/**
 * What an evaluation produced. Output values may still be deferred.
 *
 * @param completed false when evaluation stopped at a failing declaration
 */
public record EvaluationResult(Map<String, Object> outputs, Map<String, RemoteResource> resources, boolean completed) {
    public EvaluationResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }
}
