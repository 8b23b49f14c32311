package io.sqlpulse.monitor.engine.connect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * JDBC backed session. Refuses anything but SELECT, SHOW and WITH statements, and any statement
 * carrying a data-changing keyword outside literals and comments (MySQL 8 allows {@code WITH ... UPDATE}).
 */
public class JdbcSession implements Session {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSession.class);

    private static final Set<String> READ_ONLY_KEYWORDS = Set.of("SELECT", "SHOW", "WITH");
    private static final String SEPARATOR = ";";
    private static final Set<String> WRITE_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "TRUNCATE",
            "CREATE", "ALTER", "DROP", "RENAME", "GRANT", "REVOKE", "LOAD", "CALL", "OUTFILE", "DUMPFILE");

    private final Connection connection;
    private final int queryTimeoutSeconds;

    public JdbcSession(Connection connection, int queryTimeoutSeconds) {
        this.connection = connection;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public List<Map<String, Object>> execute(String statement) throws QueryException {
        if (!isReadOnlyStatement(statement)) {
            throw new QueryException("Refusing to execute a statement that is not read-only", statement);
        }

        logger.debug("Executing: {}", statement);
        try (Statement stmt = connection.createStatement()) {
            if (queryTimeoutSeconds > 0) {
                stmt.setQueryTimeout(queryTimeoutSeconds);
            }
            try (ResultSet rs = stmt.executeQuery(statement)) {
                return readRows(rs);
            }
        } catch (SQLException e) {
            throw new QueryException(e.getMessage(), statement, e);
        }
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            for (int i = 1; i <= columns; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    /**
     * True when the first keyword after leading whitespace and comments is SELECT, SHOW or WITH,
     * no later word is a data-changing keyword and nothing follows a statement separator.
     */
    public static boolean isReadOnlyStatement(String statement) {
        if (statement == null) {
            return false;
        }
        List<String> words = keywords(statement);
        if (words.isEmpty() || !READ_ONLY_KEYWORDS.contains(words.get(0))) {
            return false;
        }
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            if (WRITE_KEYWORDS.contains(word) || (SEPARATOR.equals(word) && i + 1 < words.size()
                    && !SEPARATOR.equals(words.get(i + 1)))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Upper-cased bare words of a statement plus {@code ;} separators, skipping comments, string literals
     * and quoted identifiers. The body of a MySQL executable comment ({@code /*!50000 ...}) is kept.
     */
    static List<String> keywords(String statement) {
        List<String> words = new ArrayList<>();
        int length = statement.length();
        int i = 0;
        while (i < length) {
            char c = statement.charAt(i);
            if (c == '/' && statement.startsWith("/*!", i)) {
                i += 3;
            } else if (c == '/' && i + 1 < length && statement.charAt(i + 1) == '*') {
                int close = statement.indexOf("*/", i + 2);
                i = close < 0 ? length : close + 2;
            } else if (c == '#' || (c == '-' && i + 1 < length && statement.charAt(i + 1) == '-')) {
                int newline = statement.indexOf('\n', i);
                i = newline < 0 ? length : newline + 1;
            } else if (c == ';') {
                words.add(SEPARATOR);
                i++;
            } else if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(statement, i, c);
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(statement.charAt(i)) || statement.charAt(i) == '_'
                        || statement.charAt(i) == '$')) {
                    i++;
                }
                words.add(statement.substring(start, i).toUpperCase(Locale.ROOT));
            } else if (Character.isDigit(c)) {
                while (i < length && (Character.isLetterOrDigit(statement.charAt(i)) || statement.charAt(i) == '.')) {
                    i++;
                }
            } else {
                i++;
            }
        }
        return words;
    }

    private static int skipQuoted(String statement, int open, char quote) {
        int i = open + 1;
        while (i < statement.length()) {
            char c = statement.charAt(i);
            if (c == '\\' && quote != '`') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < statement.length() && statement.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return statement.length();
    }

    @Override
    public void close() {
        try {
            connection.close();
            logger.debug("Session closed");
        } catch (SQLException e) {
            logger.warn("Failed to close database session: {}", e.getMessage());
        }
    }
}
