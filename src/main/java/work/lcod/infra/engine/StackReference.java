package work.lcod.infra.engine;

import work.lcod.infra.eval.Output;

public interface StackReference {
    String stackName();

    Output output(String name);
}
