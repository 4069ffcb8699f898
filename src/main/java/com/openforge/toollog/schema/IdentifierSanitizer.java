package com.openforge.toollog.schema;

import java.util.regex.Pattern;

/**
 * Gatekeeper for SQL identifiers built from tool definitions.
 *
 * Identifiers cannot be bound as statement parameters, so every table and
 * column name that reaches SQL text must pass {@link #isValidIdentifier}
 * first. Only then is it quoted and embedded. Names are ASCII, so the
 * character limit equals the server's byte limit.
 */
public final class IdentifierSanitizer {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    /** PostgreSQL NAMEDATALEN - 1; longer names are silently truncated by the server. */
    public static final int MAX_LENGTH = 63;

    private IdentifierSanitizer() {}

    public static boolean isValidIdentifier(String name) {
        return name != null
                && name.length() <= MAX_LENGTH
                && IDENTIFIER.matcher(name).matches();
    }

    /**
     * @param what short description used in the error message, e.g. "table name"
     * @throws InvalidIdentifierException if {@code name} is not a valid identifier
     */
    public static String requireValidIdentifier(String name, String what) {
        if (!isValidIdentifier(name)) {
            throw new InvalidIdentifierException("Invalid %s: %s".formatted(what, name));
        }
        return name;
    }

    /** Double-quotes an identifier that has already passed validation. */
    public static String quote(String name) {
        return "\"" + requireValidIdentifier(name, "identifier") + "\"";
    }
}
