package io.sqlpulse.monitor.engine.collector;

import io.sqlpulse.monitor.engine.connect.QueryException;
import io.sqlpulse.monitor.engine.connect.Session;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Helpers for the name/value row sets returned by SHOW STATUS and SHOW VARIABLES
 */
final class StatusRows {

    private StatusRows() {
    }

    /**
     * Runs a SHOW STATUS or SHOW VARIABLES statement and folds it into a case-insensitive map
     */
    static Map<String, String> variables(Session session, String statement) throws QueryException {
        Map<String, String> variables = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map<String, Object> row : session.execute(statement)) {
            Object name = row.get("Variable_name");
            if (name != null) {
                Object value = row.get("Value");
                variables.put(name.toString(), value == null ? "" : value.toString());
            }
        }
        return variables;
    }

    static OptionalDouble number(Map<String, String> variables, String name) {
        return parseNumber(variables.get(name));
    }

    static OptionalDouble parseNumber(Object raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(new BigDecimal(raw.toString().trim()).doubleValue());
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    static double numberOrZero(Map<String, Object> row, String column) {
        return parseNumber(row.get(column)).orElse(0.0);
    }

    static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? "" : value.toString();
    }

    static boolean isOn(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return "ON".equals(normalized) || "1".equals(normalized) || "TRUE".equals(normalized);
    }

    /**
     * Parses TIME text ("HH:MM:SS[.ffffff]", hours may exceed 23) or a plain number of seconds.
     * Select TIME columns as text: {@link java.sql.Time} drops fractions and wraps at 24h.
     */
    static Duration parseTime(Object raw) {
        if (raw == null) {
            return Duration.ZERO;
        }
        if (raw instanceof Duration) {
            return (Duration) raw;
        }
        String text = raw.toString().trim();
        String[] parts = text.split(":");
        try {
            if (parts.length == 3) {
                long hours = Long.parseLong(parts[0]);
                long minutes = Long.parseLong(parts[1]);
                double seconds = Double.parseDouble(parts[2]);
                return Duration.ofHours(hours).plusMinutes(minutes).plusMillis(Math.round(seconds * 1000.0));
            }
            return Duration.ofMillis(Math.round(Double.parseDouble(text) * 1000.0));
        } catch (NumberFormatException e) {
            return Duration.ZERO;
        }
    }

    static int count(List<Map<String, Object>> rows, String column, String expected) {
        int count = 0;
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value != null && expected.equalsIgnoreCase(value.toString())) {
                count++;
            }
        }
        return count;
    }
}
