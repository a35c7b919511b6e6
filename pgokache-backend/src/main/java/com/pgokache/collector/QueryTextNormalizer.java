package com.pgokache.collector;

import com.pgokache.config.PgOkacheProperties;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Redacts literals and caps the length of statement text before it is stored.
 *
 * <p>pg_stat_statements already replaces most constants with {@code $n}; utility statements and
 * some older servers keep literals, which may carry sensitive values.
 */
@Component
public class QueryTextNormalizer {
    static final String TRUNCATION_MARKER = "…";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:''|[^'])*'");
    // Leaves $1 placeholders and identifiers such as t1 alone.
    private static final Pattern NUMBER_LITERAL = Pattern.compile("(?<![\\w$.])\\d+(?:\\.\\d+)?(?![\\w.])");

    private final int maxLength;
    private final boolean storeFullText;

    public QueryTextNormalizer(PgOkacheProperties properties) {
        this(properties.getCollector().getMaxQueryLength(), properties.getCollector().isStoreFullQueryText());
    }

    QueryTextNormalizer(int maxLength, boolean storeFullText) {
        this.maxLength = maxLength;
        this.storeFullText = storeFullText;
    }

    public String normalize(String query) {
        if (query == null) {
            return "";
        }
        String text = storeFullText ? query.strip() : redact(query);
        return truncate(text);
    }

    static String redact(String query) {
        String compact = WHITESPACE.matcher(query).replaceAll(" ").strip();
        compact = STRING_LITERAL.matcher(compact).replaceAll("?");
        return NUMBER_LITERAL.matcher(compact).replaceAll("?");
    }

    private String truncate(String text) {
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }
}
