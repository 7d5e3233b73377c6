package work.lcod.infra.ast;

import java.util.ArrayList;
import java.util.List;
import work.lcod.infra.syntax.SourceRange;

public record ResourceOptionsDecl(
    SourceRange range,
    Expr additionalSecretOutputs,
    Expr aliases,
    CustomTimeoutsDecl customTimeouts,
    Expr deleteBeforeReplace,
    Expr dependsOn,
    Expr ignoreChanges,
    Expr importId,
    Expr parent,
    Expr protect,
    Expr provider,
    Expr providers,
    StringExpr version,
    StringExpr pluginDownloadUrl,
    Expr replaceOnChanges,
    Expr retainOnDelete,
    Expr deletedWith
) {
    public static final ResourceOptionsDecl EMPTY = builder().build();

    static final List<String> FIELDS = List.of(
        "additionalSecretOutputs", "aliases", "customTimeouts", "deleteBeforeReplace", "dependsOn",
        "ignoreChanges", "import", "parent", "protect", "provider", "providers", "version",
        "pluginDownloadURL", "replaceOnChanges", "retainOnDelete", "deletedWith");

    public List<Expr> references() {
        var refs = new ArrayList<Expr>();
        for (var expr : new Expr[] {dependsOn, parent, provider, providers, deletedWith}) {
            if (expr != null) {
                refs.add(expr);
            }
        }
        return refs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SourceRange range;
        private Expr additionalSecretOutputs;
        private Expr aliases;
        private CustomTimeoutsDecl customTimeouts;
        private Expr deleteBeforeReplace;
        private Expr dependsOn;
        private Expr ignoreChanges;
        private Expr importId;
        private Expr parent;
        private Expr protect;
        private Expr provider;
        private Expr providers;
        private StringExpr version;
        private StringExpr pluginDownloadUrl;
        private Expr replaceOnChanges;
        private Expr retainOnDelete;
        private Expr deletedWith;

        public Builder range(SourceRange range) {
            this.range = range;
            return this;
        }

        public Builder additionalSecretOutputs(Expr value) {
            this.additionalSecretOutputs = value;
            return this;
        }

        public Builder aliases(Expr value) {
            this.aliases = value;
            return this;
        }

        public Builder customTimeouts(CustomTimeoutsDecl value) {
            this.customTimeouts = value;
            return this;
        }

        public Builder deleteBeforeReplace(Expr value) {
            this.deleteBeforeReplace = value;
            return this;
        }

        public Builder dependsOn(Expr value) {
            this.dependsOn = value;
            return this;
        }

        public Builder ignoreChanges(Expr value) {
            this.ignoreChanges = value;
            return this;
        }

        public Builder importId(Expr value) {
            this.importId = value;
            return this;
        }

        public Builder parent(Expr value) {
            this.parent = value;
            return this;
        }

        public Builder protect(Expr value) {
            this.protect = value;
            return this;
        }

        public Builder provider(Expr value) {
            this.provider = value;
            return this;
        }

        public Builder providers(Expr value) {
            this.providers = value;
            return this;
        }

        public Builder version(StringExpr value) {
            this.version = value;
            return this;
        }

        public Builder pluginDownloadUrl(StringExpr value) {
            this.pluginDownloadUrl = value;
            return this;
        }

        public Builder replaceOnChanges(Expr value) {
            this.replaceOnChanges = value;
            return this;
        }

        public Builder retainOnDelete(Expr value) {
            this.retainOnDelete = value;
            return this;
        }

        public Builder deletedWith(Expr value) {
            this.deletedWith = value;
            return this;
        }

        public ResourceOptionsDecl build() {
            return new ResourceOptionsDecl(
                range,
                additionalSecretOutputs,
                aliases,
                customTimeouts,
                deleteBeforeReplace,
                dependsOn,
                ignoreChanges,
                importId,
                parent,
                protect,
                provider,
                providers,
                version,
                pluginDownloadUrl,
                replaceOnChanges,
                retainOnDelete,
                deletedWith
            );
        }
    }
}
