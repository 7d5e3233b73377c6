package work.lcod.infra.ast;

import java.util.ArrayList;
import java.util.List;
import work.lcod.infra.syntax.Diagnostics;
import work.lcod.infra.syntax.SourceRange;

/**
 * Splits {@code "text ${a.b} more"} into {@link Interpolation} parts and parses each property access.
 *
 * <p>Accepted access grammar: a root name or quoted subscript, followed by any number of
 * {@code .name}, {@code ["quoted"]} or {@code [123]} accessors. {@code $$} escapes a dollar sign.
 */
final class InterpolationParser {
    private final SourceRange range;
    private final Diagnostics diags;

    private InterpolationParser(SourceRange range, Diagnostics diags) {
        this.range = range;
        this.diags = diags;
    }

    /**
     * Returns null when the string is malformed; the problem is reported to {@code diags}.
     */
    static List<Interpolation> parse(String text, SourceRange range, Diagnostics diags) {
        return new InterpolationParser(range, diags).parseParts(text);
    }

    private List<Interpolation> parseParts(String remaining) {
        var parts = new ArrayList<Interpolation>();
        var str = new StringBuilder();
        int i = 0;
        while (i < remaining.length()) {
            char c = remaining.charAt(i);
            if (c == '$' && i + 1 < remaining.length()) {
                char next = remaining.charAt(i + 1);
                if (next == '$') {
                    str.append('$');
                    i += 2;
                    continue;
                }
                if (next == '{') {
                    var access = new ArrayList<PropertyAccessor>();
                    int end = parseAccess(remaining, i + 2, access);
                    if (end < 0) {
                        return null;
                    }
                    if (access.isEmpty()) {
                        diags.error(range, "Property access expressions cannot be empty");
                        return null;
                    }
                    parts.add(new Interpolation(str.toString(), new PropertyAccess(access)));
                    str.setLength(0);
                    i = end;
                    continue;
                }
            }
            str.append(c);
            i++;
        }
        if (str.length() > 0) {
            parts.add(new Interpolation(str.toString(), null));
        }
        return parts;
    }

    private int parseAccess(String s, int i, List<PropertyAccessor> out) {
        while (i < s.length()) {
            char c = s.charAt(i);
            switch (c) {
                case '}' -> {
                    return i + 1;
                }
                case '.' -> i++;
                case '[' -> {
                    if (i + 1 < s.length() && s.charAt(i + 1) == '"') {
                        var key = new StringBuilder();
                        int j = i + 2;
                        while (true) {
                            if (j >= s.length()) {
                                diags.error(range, "missing closing quote in property name");
                                return -1;
                            }
                            char k = s.charAt(j);
                            if (k == '"') {
                                j++;
                                break;
                            }
                            if (k == '\\' && j + 1 < s.length() && s.charAt(j + 1) == '"') {
                                key.append('"');
                                j += 2;
                            } else {
                                key.append(k);
                                j++;
                            }
                        }
                        if (j >= s.length() || s.charAt(j) != ']') {
                            diags.error(range, "missing closing bracket in property access");
                            return -1;
                        }
                        out.add(new PropertyAccessor.Subscript(key.toString()));
                        i = j + 1;
                    } else {
                        int close = s.indexOf(']', i);
                        if (close < 0) {
                            diags.error(range, "missing closing bracket in list index");
                            return -1;
                        }
                        int index;
                        try {
                            index = Integer.parseInt(s.substring(i + 1, close));
                        } catch (NumberFormatException ex) {
                            diags.error(range, "invalid list index");
                            return -1;
                        }
                        if (out.isEmpty()) {
                            diags.error(range, "the root property must be a string subscript or a name");
                            return -1;
                        }
                        out.add(new PropertyAccessor.Subscript(index));
                        i = close + 1;
                    }
                }
                default -> {
                    int j = i;
                    while (j < s.length() && ".[}".indexOf(s.charAt(j)) < 0) {
                        j++;
                    }
                    out.add(new PropertyAccessor.Name(s.substring(i, j)));
                    i = j;
                }
            }
        }
        diags.error(range, "unterminated interpolation");
        return -1;
    }
}
