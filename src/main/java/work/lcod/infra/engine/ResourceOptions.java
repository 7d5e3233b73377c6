package work.lcod.infra.engine;

import java.time.Duration;
import java.util.List;
import java.util.Map;

public record ResourceOptions(
    RemoteResource parent,
    RemoteResource provider,
    Map<String, RemoteResource> providers,
    List<RemoteResource> dependsOn,
    RemoteResource deletedWith,
    boolean protect,
    boolean deleteBeforeReplace,
    boolean retainOnDelete,
    List<String> ignoreChanges,
    List<String> replaceOnChanges,
    List<String> additionalSecretOutputs,
    List<Object> aliases,
    Map<String, Duration> customTimeouts,
    String importId,
    String version,
    String pluginDownloadUrl
) {
    public static final ResourceOptions NONE = builder().build();

    public ResourceOptions {
        providers = providers == null ? Map.of() : Map.copyOf(providers);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        ignoreChanges = ignoreChanges == null ? List.of() : List.copyOf(ignoreChanges);
        replaceOnChanges = replaceOnChanges == null ? List.of() : List.copyOf(replaceOnChanges);
        additionalSecretOutputs = additionalSecretOutputs == null ? List.of() : List.copyOf(additionalSecretOutputs);
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        customTimeouts = customTimeouts == null ? Map.of() : Map.copyOf(customTimeouts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RemoteResource parent;
        private RemoteResource provider;
        private Map<String, RemoteResource> providers;
        private List<RemoteResource> dependsOn;
        private RemoteResource deletedWith;
        private boolean protect;
        private boolean deleteBeforeReplace;
        private boolean retainOnDelete;
        private List<String> ignoreChanges;
        private List<String> replaceOnChanges;
        private List<String> additionalSecretOutputs;
        private List<Object> aliases;
        private Map<String, Duration> customTimeouts;
        private String importId;
        private String version;
        private String pluginDownloadUrl;

        public Builder parent(RemoteResource value) {
            this.parent = value;
            return this;
        }

        public Builder provider(RemoteResource value) {
            this.provider = value;
            return this;
        }

        public Builder providers(Map<String, RemoteResource> value) {
            this.providers = value;
            return this;
        }

        public Builder dependsOn(List<RemoteResource> value) {
            this.dependsOn = value;
            return this;
        }

        public Builder deletedWith(RemoteResource value) {
            this.deletedWith = value;
            return this;
        }

        public Builder protect(boolean value) {
            this.protect = value;
            return this;
        }

        public Builder deleteBeforeReplace(boolean value) {
            this.deleteBeforeReplace = value;
            return this;
        }

        public Builder retainOnDelete(boolean value) {
            this.retainOnDelete = value;
            return this;
        }

        public Builder ignoreChanges(List<String> value) {
            this.ignoreChanges = value;
            return this;
        }

        public Builder replaceOnChanges(List<String> value) {
            this.replaceOnChanges = value;
            return this;
        }

        public Builder additionalSecretOutputs(List<String> value) {
            this.additionalSecretOutputs = value;
            return this;
        }

        public Builder aliases(List<Object> value) {
            this.aliases = value;
            return this;
        }

        public Builder customTimeouts(Map<String, Duration> value) {
            this.customTimeouts = value;
            return this;
        }

        public Builder importId(String value) {
            this.importId = value;
            return this;
        }

        public Builder version(String value) {
            this.version = value;
            return this;
        }

        public Builder pluginDownloadUrl(String value) {
            this.pluginDownloadUrl = value;
            return this;
        }

        public ResourceOptions build() {
            return new ResourceOptions(
                parent,
                provider,
                providers,
                dependsOn,
                deletedWith,
                protect,
                deleteBeforeReplace,
                retainOnDelete,
                ignoreChanges,
                replaceOnChanges,
                additionalSecretOutputs,
                aliases,
                customTimeouts,
                importId,
                version,
                pluginDownloadUrl
            );
        }
    }
}
