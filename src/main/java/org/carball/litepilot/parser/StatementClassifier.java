package org.carball.litepilot.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a statement may modify the database, which is what the write mutex guards.
 */
@Slf4j
public class StatementClassifier {

    private static final Pattern LEADING_KEYWORD = Pattern.compile("^\\s*(?:--[^\\n]*\\n\\s*)*([A-Za-z]+)");

    private static final Pattern PRAGMA_NAME = Pattern.compile("(?i)^\\s*PRAGMA\\s+(?:\\w+\\.)?(\\w+)");

    private static final Set<String> READ_KEYWORDS = Set.of("SELECT", "WITH", "VALUES", "EXPLAIN");

    // Pragmas that change the database even when called without a value
    private static final Set<String> MUTATING_PRAGMAS = Set.of("optimize", "wal_checkpoint", "incremental_vacuum");

    private StatementClassifier() {
        // Utility class - prevent instantiation
    }

    public static boolean isWrite(String sql) {
        return !isRead(sql);
    }

    public static boolean isRead(String sql) {
        String keyword = leadingKeyword(sql);

        if ("PRAGMA".equals(keyword)) {
            // PRAGMA x = y changes state, PRAGMA x / PRAGMA x(arg) only reports
            return !sql.contains("=") && !MUTATING_PRAGMAS.contains(pragmaName(sql));
        }
        if ("EXPLAIN".equals(keyword)) {
            return true;
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            return statement instanceof Select;
        } catch (JSQLParserException e) {
            log.debug("Falling back to keyword classification for '{}': {}", abbreviate(sql), e.getMessage());
            return READ_KEYWORDS.contains(keyword);
        }
    }

    /**
     * First keyword of the statement in upper case, skipping leading line comments.
     */
    public static String leadingKeyword(String sql) {
        if (sql == null) {
            return "";
        }
        Matcher matcher = LEADING_KEYWORD.matcher(sql);
        return matcher.find() ? matcher.group(1).toUpperCase(Locale.ROOT) : "";
    }

    private static String pragmaName(String sql) {
        Matcher matcher = PRAGMA_NAME.matcher(sql);
        return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : "";
    }

    private static String abbreviate(String sql) {
        String flat = sql.replaceAll("\\s+", " ").trim();
        return flat.length() > 80 ? flat.substring(0, 80) + "..." : flat;
    }
}
