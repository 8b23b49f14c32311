package io.sqlpulse.monitor.engine.policy;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The checks a run will execute, plus the requested checks that were withheld and why.
 * Computed once per run.
 */
public final class ResolvedChecks {
    private final InspectionLevel level;
    private final Set<CheckType> checks;
    private final Map<CheckType, String> skipped;

    public ResolvedChecks(InspectionLevel level, Set<CheckType> checks, Map<CheckType, String> skipped) {
        this.level = level;
        this.checks = Collections.unmodifiableSet(checks.isEmpty() ? EnumSet.noneOf(CheckType.class) : EnumSet.copyOf(checks));
        Map<CheckType, String> copy = new EnumMap<>(CheckType.class);
        copy.putAll(skipped);
        this.skipped = Collections.unmodifiableMap(copy);
    }

    public InspectionLevel getLevel() { return level; }
    public Set<CheckType> getChecks() { return checks; }
    public Map<CheckType, String> getSkipped() { return skipped; }

    public boolean contains(CheckType type) {
        return checks.contains(type);
    }

    @Override
    public String toString() {
        return "ResolvedChecks{level=" + level + ", checks=" + checks + ", skipped=" + skipped.keySet() + '}';
    }
}
