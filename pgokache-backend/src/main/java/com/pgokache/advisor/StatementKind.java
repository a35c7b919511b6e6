package com.pgokache.advisor;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Coarse classification of normalized statement text by its leading keyword.
 */
public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    OTHER;

    private static final Pattern LEADING_NOISE = Pattern.compile("^(?:\\s+|--[^\\n]*(?:\\n|$)|/\\*.*?\\*/|\\()+", Pattern.DOTALL);
    private static final Pattern DATA_MODIFYING = Pattern.compile("\\b(INSERT|UPDATE|DELETE|MERGE)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Classify a statement. A {@code WITH} query counts as SELECT unless it contains a
     * data-modifying clause, in which case the first such clause decides.
     *
     * @param query normalized text
     * @return kind
     */
    public static StatementKind of(String query) {
        if (query == null) {
            return OTHER;
        }
        String text = LEADING_NOISE.matcher(query).replaceFirst("");
        String keyword = firstWord(text).toUpperCase(Locale.ROOT);
        switch (keyword) {
            case "SELECT":
            case "TABLE":
            case "VALUES":
                return SELECT;
            case "INSERT":
                return INSERT;
            case "UPDATE":
                return UPDATE;
            case "DELETE":
                return DELETE;
            case "WITH":
                var m = DATA_MODIFYING.matcher(text);
                if (m.find()) {
                    String dml = m.group(1).toUpperCase(Locale.ROOT);
                    return "MERGE".equals(dml) ? OTHER : valueOf(dml);
                }
                return SELECT;
            default:
                return OTHER;
        }
    }

    public boolean isRead() {
        return this == SELECT;
    }

    /**
     * Whether an index can speed up locating the rows this statement touches.
     *
     * @return true for reads, updates and deletes
     */
    public boolean isIndexable() {
        return this == SELECT || this == UPDATE || this == DELETE;
    }

    private static String firstWord(String text) {
        int end = 0;
        while (end < text.length() && Character.isLetter(text.charAt(end))) {
            end++;
        }
        return text.substring(0, end);
    }
}
