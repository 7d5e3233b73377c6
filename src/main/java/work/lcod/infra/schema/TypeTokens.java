package work.lcod.infra.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class TypeTokens {
    public static final String PROVIDER_PREFIX = "pulumi:providers:";

    private TypeTokens() {}

    public static String packageName(String token) {
        var parts = token.split(":", -1);
        if (isProviderToken(token)) {
            return parts[2];
        }
        return parts[0];
    }

    public static boolean isProviderToken(String token) {
        var parts = token.split(":", -1);
        return parts.length == 3 && "pulumi".equals(parts[0]) && "providers".equals(parts[1]);
    }

    public static void validate(String token) {
        var parts = token.split(":", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw new SchemaResolutionException(String.format("invalid type token \"%s\"", token));
        }
    }

    /**
     * Lookup order after an exact miss: {@code pkg:index:name} for two-label tokens, then
     * {@code pkg:mod/lowerCamel(Name):Name}.
     */
    public static List<String> alternates(String token) {
        var parts = token.split(":", -1);
        var result = new ArrayList<String>();
        if (parts.length == 2) {
            result.add(parts[0] + ":index:" + parts[1]);
            parts = new String[] {parts[0], "index", parts[1]};
        }
        if (parts.length == 3) {
            result.add(parts[0] + ":" + parts[1] + "/" + lowerCamel(parts[2]) + ":" + parts[2]);
        }
        return result;
    }

    static String lowerCamel(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return name.substring(0, 1).toLowerCase(Locale.ROOT) + name.substring(1);
    }
}
