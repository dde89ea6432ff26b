package com.pgost.migration.ddl;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL script on top-level semicolons.
 * Quoted identifiers, string literals, dollar-quoted bodies and comments are respected;
 * comments are dropped from the output.
 */
public final class SqlStatementSplitter {
    
    private SqlStatementSplitter() {
        // Utility class - prevent instantiation
    }
    
    public static List<String> split(String sql) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        int length = sql.length();
        
        while (i < length) {
            char c = sql.charAt(i);
            
            if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, c);
                current.append(sql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? length : end;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
                current.append(' ');
            } else if (c == '$') {
                String tag = dollarTag(sql, i);
                if (tag == null) {
                    current.append(c);
                    i++;
                } else {
                    int close = sql.indexOf(tag, i + tag.length());
                    int end = close < 0 ? length : close + tag.length();
                    current.append(sql, i, end);
                    i = end;
                }
            } else if (c == ';') {
                addIfNotBlank(statements, current);
                current.setLength(0);
                i++;
            } else {
                current.append(c);
                i++;
            }
        }
        addIfNotBlank(statements, current);
        return statements;
    }
    
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // Doubled quote is an escaped quote
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
    
    /**
     * Returns the full opening tag ($$ or $name$) starting at the given position, or null.
     */
    private static String dollarTag(String sql, int start) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '$') {
                return sql.substring(start, i + 1);
            }
            if (!(Character.isLetterOrDigit(c) || c == '_')) {
                return null;
            }
            i++;
        }
        return null;
    }
    
    private static void addIfNotBlank(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
    }
}
