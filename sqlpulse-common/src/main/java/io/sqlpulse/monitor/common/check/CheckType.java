package io.sqlpulse.monitor.common.check;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Metric families a run can collect. Declaration order is the order collectors run in
 * and the order their samples appear in a report.
 */
public enum CheckType {
    SYSTEM_RESOURCES("system_resources"),
    CONNECTIONS("connections"),
    INNODB("innodb"),
    QUERY_CACHE("query_cache"),
    SLOW_QUERIES("slow_queries"),
    PERFORMANCE_SCHEMA("performance_schema"),
    TABLE_STATISTICS("table_statistics");

    private static final Logger logger = LoggerFactory.getLogger(CheckType.class);

    private final String key;

    CheckType(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolve configured check names, including the short aliases used by settings files
     * ("resources", "queries", "performance", "tables"). Unknown names are logged and skipped.
     */
    public static Set<CheckType> fromNames(Collection<String> names) {
        Set<CheckType> result = EnumSet.noneOf(CheckType.class);
        for (String raw : names) {
            if (raw == null || raw.trim().isEmpty()) {
                continue;
            }
            String name = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            switch (name) {
                case "resources":
                case "system":
                    result.add(SYSTEM_RESOURCES);
                    break;
                case "queries":
                    result.add(QUERY_CACHE);
                    result.add(SLOW_QUERIES);
                    break;
                case "performance":
                    result.add(PERFORMANCE_SCHEMA);
                    break;
                case "tables":
                    result.add(TABLE_STATISTICS);
                    break;
                default:
                    CheckType type = byKey(name);
                    if (type != null) {
                        result.add(type);
                    } else {
                        logger.warn("Unknown check name: {}, ignoring", raw);
                    }
            }
        }
        return result;
    }

    private static CheckType byKey(String key) {
        for (CheckType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        return null;
    }
}
