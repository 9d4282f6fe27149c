package org.livo.warehouse.util;

/**
 * Helpers for user-supplied LIKE / ILIKE search terms.
 */
public final class LikePatternUtil {

    private LikePatternUtil() {
    }

    /**
     * Escape {@code \}, {@code %} and {@code _} with the default backslash escape,
     * so the term only ever matches literally.
     */
    public static String escape(String term) {
        if (term == null) {
            return null;
        }
        StringBuilder escaped = new StringBuilder(term.length() + 4);
        for (char c : term.toCharArray()) {
            if (c == '\\' || c == '%' || c == '_') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Escaped term wrapped for a substring match.
     */
    public static String contains(String term) {
        return "%" + escape(term) + "%";
    }
}
