package work.lcod.infra.schema;

public class SchemaResolutionException extends RuntimeException {
    public SchemaResolutionException(String message) {
        super(message);
    }
}
