package com.walkerbrain.portal.modules.query.application;

/**
 * Escapes user text for a LIKE pattern with {@code ESCAPE '\'}. Besides the LIKE wildcards, the
 * characters {@code ( ) . ,} are escaped too, since they are significant in filter-expression syntaxes
 * the pattern may pass through.
 */
public final class LikeEscaper {

    public static final char ESCAPE = '\\';
    private static final String SPECIAL = "\\%_().,";

    private LikeEscaper() {
    }

    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (SPECIAL.indexOf(c) >= 0) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static String containsPattern(String text) {
        return "%" + escape(text) + "%";
    }
}
