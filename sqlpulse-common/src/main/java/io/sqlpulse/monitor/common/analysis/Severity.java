package io.sqlpulse.monitor.common.analysis;

import java.util.Locale;

/**
 * Severity of a finding, ordered from least to most severe
 */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public static Severity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        return Severity.valueOf(normalized);
    }
}
