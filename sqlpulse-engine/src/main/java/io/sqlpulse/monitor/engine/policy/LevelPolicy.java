package io.sqlpulse.monitor.engine.policy;

import io.sqlpulse.monitor.common.check.CheckType;
import io.sqlpulse.monitor.common.check.InspectionLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps an inspection level and an optional enabled-checks override to the checks to run.
 *
 * <p>The override, when present, replaces the level's default set. Table statistics additionally
 * need both the EXPERT level and the explicit table flag, whatever the override says.
 */
public class LevelPolicy {
    private static final Logger logger = LoggerFactory.getLogger(LevelPolicy.class);

    static final String REQUIRES_EXPERT = "requires EXPERT level";
    static final String REQUIRES_FLAG = "requires explicit enablement (enable-tables)";
    static final String NOT_IN_OVERRIDE = "not in enabled checks";

    public ResolvedChecks resolve(InspectionLevel level, Optional<Set<CheckType>> enabledChecks, boolean tablesEnabled) {
        Set<CheckType> requested = enabledChecks
                .map(checks -> checks.isEmpty() ? EnumSet.noneOf(CheckType.class) : EnumSet.copyOf(checks))
                .orElseGet(() -> EnumSet.copyOf(level.getDefaultChecks()));
        Map<CheckType, String> skipped = new EnumMap<>(CheckType.class);

        boolean tablesRequested = requested.remove(CheckType.TABLE_STATISTICS);
        if (tablesRequested || tablesEnabled) {
            if (level != InspectionLevel.EXPERT) {
                skipped.put(CheckType.TABLE_STATISTICS, REQUIRES_EXPERT);
            } else if (!tablesEnabled) {
                skipped.put(CheckType.TABLE_STATISTICS, REQUIRES_FLAG);
            } else if (!tablesRequested) {
                skipped.put(CheckType.TABLE_STATISTICS, NOT_IN_OVERRIDE);
            } else {
                requested.add(CheckType.TABLE_STATISTICS);
            }
        }

        ResolvedChecks resolved = new ResolvedChecks(level, requested, skipped);
        logger.info("Resolved checks for level {}: {}{}", level.displayName(), requested,
                skipped.isEmpty() ? "" : " (skipped: " + skipped + ")");
        return resolved;
    }
}
