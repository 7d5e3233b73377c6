package work.lcod.infra.engine;

public enum ResourceKind {
    CUSTOM,
    PROVIDER,
    COMPONENT
}
