package work.lcod.infra.shared;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;

/**
 * Formats "X does not exist on Y" messages, listing the closest existing names first.
 */
public final class FieldSuggestions {
    private final String parentLabel;
    private final List<String> fields;
    private final int maxElements;
    private final boolean properties;

    public FieldSuggestions(String parentLabel, Collection<String> fields, int maxElements, boolean properties) {
        this.parentLabel = parentLabel;
        this.fields = List.copyOf(fields);
        this.maxElements = maxElements;
        this.properties = properties;
    }

    public static FieldSuggestions forProperties(String parentLabel, Collection<String> fields) {
        return new FieldSuggestions(parentLabel, fields, 5, true);
    }

    public static FieldSuggestions forFields(String parentLabel, Collection<String> fields) {
        return new FieldSuggestions(parentLabel, fields, 5, false);
    }

    public String summary(String fieldLabel) {
        return String.format("%s does not exist on %s.", fieldLabel, parentLabel);
    }

    public String detail(String field) {
        var existing = sortedByDistance(field);
        var noun = properties ? "properties" : "fields";
        if (existing.isEmpty()) {
            return String.format("%s has no %s", parentLabel, noun);
        }
        String list;
        if (maxElements != 0 && existing.size() > maxElements) {
            list = String.join(", ", existing.subList(0, maxElements))
                + " and " + (existing.size() - maxElements) + " others";
        } else {
            list = String.join(", ", existing);
        }
        return String.format("Existing %s are: %s", noun, list);
    }

    public String message(String field, String fieldLabel) {
        return summary(fieldLabel) + " " + detail(field);
    }

    public String closest(String field) {
        var sorted = sortedByDistance(field);
        return sorted.isEmpty() ? null : sorted.get(0);
    }

    List<String> sortedByDistance(String field) {
        var distances = new HashMap<String, Integer>();
        var sorted = new ArrayList<>(fields);
        sorted.sort(Comparator.naturalOrder());
        sorted.sort(Comparator.comparingInt(w -> distances.computeIfAbsent(w, k -> editDistance(k, field))));
        return sorted;
    }

    public static int editDistance(String a, String b) {
        int[][] d = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
            }
        }
        return d[a.length()][b.length()];
    }
}
