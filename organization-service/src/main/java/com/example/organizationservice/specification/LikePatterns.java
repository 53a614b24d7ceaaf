package com.example.organizationservice.specification;

import java.util.Locale;

/**
 * LIKE helpers. Values are always matched literally as a substring; the
 * wildcard characters only ever appear in the patterns built here.
 */
public final class LikePatterns {

    public static final char ESCAPE_CHAR = '\\';

    private LikePatterns() {
    }

    /**
     * Escape {@code \ % _ ~} so the value matches literally inside a LIKE pattern.
     */
    public static String escape(String raw) {
        StringBuilder escaped = new StringBuilder(raw.length() + 8);
        for (char c : raw.toCharArray()) {
            if (c == ESCAPE_CHAR || c == '%' || c == '_' || c == '~') {
                escaped.append(ESCAPE_CHAR);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Unanchored "contains" pattern for a literal value.
     */
    public static String contains(String raw) {
        return "%" + escape(raw) + "%";
    }

    /**
     * In-memory counterpart of {@link #contains(String)}: true when the text
     * holds the value as a literal substring. Case folding uses the root locale,
     * as SQL {@code lower()} does for the ILIKE translation.
     */
    public static boolean containsMatch(String text, String value, boolean ignoreCase) {
        if (text == null) {
            return false;
        }
        if (ignoreCase) {
            return text.toLowerCase(Locale.ROOT).contains(value.toLowerCase(Locale.ROOT));
        }
        return text.contains(value);
    }
}
