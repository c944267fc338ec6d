package org.carball.litepilot.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort lexical scan of SQL text for the columns an index could serve.
 * <p>
 * This is deliberately not a parser: it recognises the plain query shapes produced by query
 * builders and hand-written CRUD statements and may miss columns in exotic SQL, but it always gives
 * the same answer for the same text. The recommendation thresholds are tuned against its output.
 */
public class SqlPatternExtractor {

    public static final String UNKNOWN_TABLE = "unknown";

    private static final String IDENTIFIER = "(?:[\"`\\[]?\\w+[\"`\\]]?\\.)?[\"`\\[]?(\\w+)[\"`\\]]?";

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern NUMBERED_PARAMETER = Pattern.compile("[$?]\\d+");
    private static final Pattern NAMED_PARAMETER = Pattern.compile("(?<![\\w:@])[:@][A-Za-z_]\\w*");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern FROM_TABLE = Pattern.compile("\\bFROM\\s+" + IDENTIFIER, Pattern.CASE_INSENSITIVE);
    private static final Pattern UPDATE_TABLE = Pattern.compile(
            "^\\s*UPDATE\\s+(?:OR\\s+\\w+\\s+)?" + IDENTIFIER, Pattern.CASE_INSENSITIVE);
    private static final Pattern INSERT_TABLE = Pattern.compile(
            "^\\s*(?:INSERT|REPLACE)\\s+(?:OR\\s+\\w+\\s+)?INTO\\s+" + IDENTIFIER, Pattern.CASE_INSENSITIVE);

    private static final Pattern WHERE_CLAUSE = Pattern.compile(
            "\\bWHERE\\s+(.+?)(?=\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bHAVING\\b|\\bLIMIT\\b|\\bRETURNING\\b|;|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMPARED_COLUMN = Pattern.compile(
            "([\\w.\"`\\[\\]]+)\\s*(?:=|==|!=|<>|<=|>=|<|>|\\s(?:NOT\\s+)?(?:LIKE|IN|BETWEEN|GLOB)\\b|\\sIS\\b)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ORDER_BY_CLAUSE = Pattern.compile(
            "\\bORDER\\s+BY\\s+(.+?)(?=\\bLIMIT\\b|\\bOFFSET\\b|\\)|;|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern ORDER_MODIFIERS = Pattern.compile(
            "\\s+(?:COLLATE\\s+\\w+|ASC|DESC|NULLS\\s+(?:FIRST|LAST))\\b.*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern JOIN_CONDITION = Pattern.compile(
            "\\bJOIN\\s+[\\w.\"`\\[\\]]+(?:\\s+(?:AS\\s+)?(?!ON\\b)\\w+)?\\s+ON\\s+(.+?)"
                    + "(?=\\b(?:INNER\\s+|LEFT\\s+|RIGHT\\s+|FULL\\s+|CROSS\\s+|OUTER\\s+)*JOIN\\b|\\bWHERE\\b"
                    + "|\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bLIMIT\\b|;|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern EQUATED_COLUMN = Pattern.compile("([\\w.\"`\\[\\]]+)\\s*==?(?!=)");

    private static final Set<String> KEYWORDS = Set.of(
            "and", "or", "not", "null", "is", "in", "like", "between", "exists", "case", "when", "then",
            "else", "end", "true", "false", "select", "from", "where", "on", "as");

    private SqlPatternExtractor() {
        // Utility class - prevent instantiation
    }

    /**
     * Folds literals and placeholders to {@code ?}, collapses whitespace and lowercases, so that
     * executions differing only in their values share one key.
     */
    public static String normalize(String sql) {
        String normalized = STRING_LITERAL.matcher(sql).replaceAll("?");
        normalized = NUMBERED_PARAMETER.matcher(normalized).replaceAll("?");
        normalized = NAMED_PARAMETER.matcher(normalized).replaceAll("?");
        normalized = NUMBER.matcher(normalized).replaceAll("?");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
        return normalized.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Target of an UPDATE or INSERT, otherwise the first table after FROM, otherwise
     * {@value #UNKNOWN_TABLE}.
     */
    public static String extractTable(String sql) {
        for (Pattern pattern : List.of(UPDATE_TABLE, INSERT_TABLE, FROM_TABLE)) {
            Matcher matcher = pattern.matcher(sql);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return UNKNOWN_TABLE;
    }

    /**
     * Columns compared in the WHERE clause, in order of appearance.
     */
    public static List<String> extractWhereColumns(String sql) {
        Matcher where = WHERE_CLAUSE.matcher(sql);
        if (!where.find()) {
            return List.of();
        }
        return collectColumns(COMPARED_COLUMN.matcher(where.group(1)));
    }

    /**
     * Plain column references of the ORDER BY list; expressions and positions are skipped.
     */
    public static List<String> extractOrderByColumns(String sql) {
        Matcher orderBy = ORDER_BY_CLAUSE.matcher(sql);
        if (!orderBy.find()) {
            return List.of();
        }
        Map<String, String> columns = new LinkedHashMap<>();
        for (String term : orderBy.group(1).split(",")) {
            String column = ORDER_MODIFIERS.matcher(term.trim()).replaceAll("");
            addColumn(columns, column);
        }
        return new ArrayList<>(columns.values());
    }

    /**
     * Left-hand columns of the equalities inside each {@code JOIN ... ON} condition.
     */
    public static List<String> extractJoinColumns(String sql) {
        Matcher join = JOIN_CONDITION.matcher(sql);
        Map<String, String> columns = new LinkedHashMap<>();
        while (join.find()) {
            Matcher equated = EQUATED_COLUMN.matcher(join.group(1));
            while (equated.find()) {
                addColumn(columns, equated.group(1));
            }
        }
        return new ArrayList<>(columns.values());
    }

    private static List<String> collectColumns(Matcher matcher) {
        Map<String, String> columns = new LinkedHashMap<>();
        while (matcher.find()) {
            addColumn(columns, matcher.group(1));
        }
        return new ArrayList<>(columns.values());
    }

    // Keyed case-insensitively, keeps the first spelling seen
    private static void addColumn(Map<String, String> columns, String token) {
        String column = cleanIdentifier(token);
        if (column == null) {
            return;
        }
        columns.putIfAbsent(column.toLowerCase(Locale.ROOT), column);
    }

    static String cleanIdentifier(String token) {
        if (token == null) {
            return null;
        }
        String column = token.trim();
        int dot = column.lastIndexOf('.');
        if (dot >= 0) {
            column = column.substring(dot + 1);
        }
        column = column.replaceAll("[\\[\\]`\"]", "");
        if (!column.matches("[A-Za-z_]\\w*") || KEYWORDS.contains(column.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return column;
    }
}
