package work.lcod.infra.ast;

/**
 * Closed set of expression kinds. Every consumer dispatches with an exhaustive switch over this enum.
 */
public enum ExprKind {
    NULL("null", false),
    BOOLEAN("a boolean value", false),
    NUMBER("a number", false),
    STRING("a string", false),
    INTERPOLATE("an interpolated string", false),
    SYMBOL("a symbol", false),
    LIST("a list", false),
    OBJECT("an object", false),
    INVOKE("fn::invoke", true),
    JOIN("fn::join", true),
    SPLIT("fn::split", true),
    SELECT("fn::select", true),
    TO_JSON("fn::toJSON", true),
    TO_BASE64("fn::toBase64", true),
    FROM_BASE64("fn::fromBase64", true),
    SECRET("fn::secret", true),
    READ_FILE("fn::readFile", true),
    STACK_REFERENCE("fn::stackReference", true),
    ASSET_ARCHIVE("fn::assetArchive", true),
    STRING_ASSET("fn::stringAsset", true),
    FILE_ASSET("fn::fileAsset", true),
    REMOTE_ASSET("fn::remoteAsset", true),
    FILE_ARCHIVE("fn::fileArchive", true),
    REMOTE_ARCHIVE("fn::remoteArchive", true);

    private final String label;
    private final boolean builtin;

    ExprKind(String label, boolean builtin) {
        this.label = label;
        this.builtin = builtin;
    }

    public String label() {
        return label;
    }

    public boolean isBuiltin() {
        return builtin;
    }

    public String describe() {
        return builtin ? "a builtin function call" : label;
    }
}
