package work.lcod.infra.ast;

public record Interpolation(String text, PropertyAccess value) {
    public Interpolation {
        text = text == null ? "" : text;
    }
}
