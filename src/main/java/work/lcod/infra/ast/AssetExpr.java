package work.lcod.infra.ast;

import work.lcod.infra.syntax.SourceRange;

public final class AssetExpr extends BuiltinExpr {
    private final ExprKind kind;
    private final Expr source;

    public AssetExpr(SourceRange range, StringExpr name, ExprKind kind, Expr source) {
        super(range, name, source);
        if (!isAssetOrArchive(kind) || kind == ExprKind.ASSET_ARCHIVE) {
            throw new IllegalArgumentException("Not an asset kind: " + kind);
        }
        this.kind = kind;
        this.source = source;
    }

    static boolean isAssetOrArchive(ExprKind kind) {
        return switch (kind) {
            case STRING_ASSET, FILE_ASSET, REMOTE_ASSET, FILE_ARCHIVE, REMOTE_ARCHIVE, ASSET_ARCHIVE -> true;
            default -> false;
        };
    }

    public Expr source() {
        return source;
    }

    public boolean isArchive() {
        return kind == ExprKind.FILE_ARCHIVE || kind == ExprKind.REMOTE_ARCHIVE;
    }

    @Override
    public ExprKind kind() {
        return kind;
    }
}
