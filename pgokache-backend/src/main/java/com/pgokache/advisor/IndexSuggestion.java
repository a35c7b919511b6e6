package com.pgokache.advisor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a best-effort {@code CREATE INDEX} statement from normalized query text.
 *
 * <p>Text based only: picks the first table after FROM/UPDATE and the columns compared in the
 * WHERE clause, equality columns first. A qualified column only counts when its qualifier is that
 * table's alias or name, so filters on joined tables are not attributed to it. Returns an empty
 * string when nothing usable is found.
 */
public final class IndexSuggestion {
    private static final int MAX_COLUMNS = 3;

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "\\b(?:FROM|UPDATE)\\s+(?:ONLY\\s+)?((?>(?:\"?[A-Za-z_][\\w$]*\"?\\.)?\"?[A-Za-z_][\\w$]*\"?))(?!\\s*\\()",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ALIAS_PATTERN = Pattern.compile(
            "\\s+(?:AS\\s+)?(\"?[A-Za-z_][\\w$]*\"?)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern WHERE_PATTERN = Pattern.compile(
            "\\bWHERE\\b(.*?)(?:\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bLIMIT\\b|\\bRETURNING\\b|\\bFOR\\s+UPDATE\\b|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private static final Pattern EQUALITY_PATTERN = Pattern.compile(
            "(?:\\b(\"?[A-Za-z_]\\w*\"?)\\.)?(\"?[A-Za-z_]\\w*\"?)\\s*(?:=|\\bIN\\b|\\bIS\\s+NULL\\b)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern RANGE_PATTERN = Pattern.compile(
            "(?:\\b(\"?[A-Za-z_]\\w*\"?)\\.)?(\"?[A-Za-z_]\\w*\"?)\\s*(?:<=|>=|<|>|\\bBETWEEN\\b|\\bLIKE\\b|\\bILIKE\\b)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "null", "true", "false", "is", "in", "exists", "any", "all", "select", "case", "when", "then", "else", "end"
    );

    /** Words that may follow a table name without being its alias. */
    private static final Set<String> CLAUSE_WORDS = Set.of(
            "where", "join", "inner", "left", "right", "full", "cross", "natural", "on", "using", "set", "group",
            "order", "limit", "offset", "returning", "for", "union", "except", "intersect", "window", "having",
            "tablesample", "lateral", "fetch"
    );

    private IndexSuggestion() {
    }

    public static String forQuery(String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        Matcher table = TABLE_PATTERN.matcher(query);
        if (!table.find()) {
            return "";
        }
        String tableName = table.group(1);
        if (tableName.toLowerCase(Locale.ROOT).startsWith("pg_")) {
            return "";
        }
        List<String> columns = filterColumns(query, qualifiersOf(query, tableName, table.end()));
        if (columns.isEmpty()) {
            return "";
        }
        return "CREATE INDEX CONCURRENTLY ON " + tableName + " (" + String.join(", ", columns) + ");";
    }

    /**
     * Names a column of the chosen table may be qualified with: its alias when present, its
     * name and, for schema-qualified tables, the bare table name.
     */
    static Set<String> qualifiersOf(String query, String tableName, int tableEnd) {
        Set<String> qualifiers = new LinkedHashSet<>();
        String name = unquote(tableName);
        qualifiers.add(name);
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            qualifiers.add(name.substring(dot + 1));
        }
        Matcher alias = ALIAS_PATTERN.matcher(query).region(tableEnd, query.length());
        if (alias.lookingAt()) {
            String candidate = unquote(alias.group(1));
            if (!CLAUSE_WORDS.contains(candidate)) {
                qualifiers.add(candidate);
            }
        }
        return qualifiers;
    }

    /**
     * WHERE columns of the query, keeping unqualified ones and those qualified with one of
     * {@code qualifiers}.
     */
    static List<String> filterColumns(String query, Set<String> qualifiers) {
        Matcher where = WHERE_PATTERN.matcher(query);
        if (!where.find()) {
            return List.of();
        }
        String clause = where.group(1);
        Set<String> columns = new LinkedHashSet<>();
        collect(EQUALITY_PATTERN, clause, qualifiers, columns);
        collect(RANGE_PATTERN, clause, qualifiers, columns);
        List<String> out = new ArrayList<>(columns);
        return out.size() > MAX_COLUMNS ? out.subList(0, MAX_COLUMNS) : out;
    }

    private static void collect(Pattern pattern, String clause, Set<String> qualifiers, Set<String> into) {
        Matcher m = pattern.matcher(clause);
        while (m.find()) {
            String qualifier = m.group(1);
            if (qualifier != null && !qualifiers.contains(unquote(qualifier))) {
                continue;
            }
            String column = m.group(2);
            if (!KEYWORDS.contains(column.toLowerCase(Locale.ROOT)) && !column.startsWith("$")) {
                into.add(column);
            }
        }
    }

    private static String unquote(String identifier) {
        if (identifier.indexOf('"') >= 0) {
            return identifier.replace("\"", "");
        }
        return identifier.toLowerCase(Locale.ROOT);
    }
}
