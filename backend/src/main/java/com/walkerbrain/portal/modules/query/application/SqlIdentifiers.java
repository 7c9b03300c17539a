package com.walkerbrain.portal.modules.query.application;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Table, column and procedure names are the only text embedded in SQL; each must pass this check.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private SqlIdentifiers() {
    }

    public static boolean isValid(String identifier) {
        return identifier != null && IDENTIFIER.matcher(identifier).matches();
    }

    public static String require(String identifier) {
        if (!isValid(identifier)) {
            throw new QueryException(QueryException.Reason.BAD_FILTER,
                    new IllegalArgumentException("Illegal identifier: " + identifier));
        }
        return identifier;
    }

    public static void requireAll(Collection<String> identifiers) {
        identifiers.forEach(SqlIdentifiers::require);
    }
}
