package io.sqlpulse.monitor.common.analysis;

import java.util.Locale;

/**
 * Comparison applied between a measured value and a threshold limit
 */
public enum ThresholdOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    ThresholdOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return true when the value violates the limit
     */
    public boolean test(double value, double limit) {
        switch (this) {
            case GREATER_THAN:
                return value > limit;
            case LESS_THAN:
                return value < limit;
            case GREATER_OR_EQUAL:
                return value >= limit;
            case LESS_OR_EQUAL:
                return value <= limit;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    public static ThresholdOperator fromSymbol(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Operator must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case ">":
            case "gt":
                return GREATER_THAN;
            case "<":
            case "lt":
                return LESS_THAN;
            case ">=":
            case "ge":
            case "gte":
                return GREATER_OR_EQUAL;
            case "<=":
            case "le":
            case "lte":
                return LESS_OR_EQUAL;
            default:
                throw new IllegalArgumentException("Unknown threshold operator: " + value);
        }
    }
}
