package io.sqlpulse.monitor.common.check;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Inspection depth. Each level's default checks are a superset of the level below.
 */
public enum InspectionLevel {
    BASIC(1, "Basic health check and essential metrics",
            EnumSet.of(CheckType.SYSTEM_RESOURCES, CheckType.CONNECTIONS)),
    ADVANCED(2, "Advanced analysis with performance metrics",
            EnumSet.of(CheckType.SYSTEM_RESOURCES, CheckType.CONNECTIONS,
                    CheckType.INNODB, CheckType.QUERY_CACHE, CheckType.SLOW_QUERIES)),
    EXPERT(3, "Expert level deep inspection and detailed analytics",
            EnumSet.allOf(CheckType.class));

    private final int number;
    private final String description;
    private final Set<CheckType> defaultChecks;

    InspectionLevel(int number, String description, Set<CheckType> defaultChecks) {
        this.number = number;
        this.description = description;
        this.defaultChecks = Collections.unmodifiableSet(defaultChecks);
    }

    public int getNumber() { return number; }
    public String getDescription() { return description; }
    public Set<CheckType> getDefaultChecks() { return defaultChecks; }

    public boolean isAtLeast(InspectionLevel other) {
        return number >= other.number;
    }

    /**
     * Accepts "1".."3" or a level name, case-insensitive.
     */
    public static InspectionLevel parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Inspection level must not be empty");
        }
        String trimmed = value.trim();
        for (InspectionLevel level : values()) {
            if (level.name().equalsIgnoreCase(trimmed) || Integer.toString(level.number).equals(trimmed)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown inspection level: " + value
                + " (expected 1-3 or one of basic, advanced, expert)");
    }

    public String displayName() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }
}
