package com.pgost.migration.util;

import com.pgost.migration.exception.ConfigurationException;

import java.util.regex.Pattern;

/**
 * Utility class for validating identifiers that are interpolated into SQL.
 */
public class SqlValidator {
    
    /** Unquoted PostgreSQL identifier in its folded (lower case) form, at most 63 bytes. */
    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_$]{0,62}$");
    
    public static final int MAX_IDENTIFIER_LENGTH = 63;
    
    private SqlValidator() {
        // Utility class - prevent instantiation
    }
    
    public static boolean isValidIdentifier(String identifier) {
        return identifier != null && SIMPLE_IDENTIFIER.matcher(identifier).matches();
    }
    
    /**
     * Throws exception if a configured schema name is not a plain identifier.
     */
    public static void validateSchemaName(String schemaName) {
        if (!isValidIdentifier(schemaName)) {
            throw new ConfigurationException("Invalid schema name: " + schemaName);
        }
    }
    
    /**
     * Append a suffix to a base name, shortening the base so the result fits PostgreSQL's
     * 63-byte identifier limit and the suffix survives.
     */
    public static String suffixedIdentifier(String base, String suffix) {
        int room = MAX_IDENTIFIER_LENGTH - suffix.length();
        return (base.length() > room ? base.substring(0, room) : base) + suffix;
    }
}
