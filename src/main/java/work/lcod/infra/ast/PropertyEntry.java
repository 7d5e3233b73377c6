package work.lcod.infra.ast;

public record PropertyEntry(StringExpr key, Expr value) {
    public String name() {
        return key.value();
    }
}
