package work.lcod.infra.syntax;

public enum Severity {
    ERROR,
    WARNING
}
