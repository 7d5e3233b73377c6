package work.lcod.infra.engine;

import java.util.Map;

@FunctionalInterface
public interface InvokeHandler {
    Map<String, Object> invoke(Map<String, Object> args) throws Exception;
}
