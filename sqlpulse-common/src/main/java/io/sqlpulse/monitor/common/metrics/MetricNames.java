package io.sqlpulse.monitor.common.metrics;

/**
 * Dotted metric names shared by collectors, analysis and recommendation rules
 */
public final class MetricNames {

    // Host
    public static final String HOST_CPU_USAGE_PERCENT = "host.cpu.usage_percent";
    public static final String HOST_CPU_LOGICAL_COUNT = "host.cpu.logical_count";
    public static final String HOST_MEMORY_TOTAL_BYTES = "host.memory.total_bytes";
    public static final String HOST_MEMORY_USED_BYTES = "host.memory.used_bytes";
    public static final String HOST_MEMORY_USAGE_PERCENT = "host.memory.usage_percent";
    public static final String HOST_SWAP_TOTAL_BYTES = "host.swap.total_bytes";
    public static final String HOST_SWAP_USED_BYTES = "host.swap.used_bytes";
    public static final String HOST_SWAP_USAGE_PERCENT = "host.swap.usage_percent";
    public static final String HOST_DISK_TOTAL_BYTES = "host.disk.total_bytes";
    public static final String HOST_DISK_USED_BYTES = "host.disk.used_bytes";
    public static final String HOST_DISK_USAGE_PERCENT = "host.disk.usage_percent";

    // Server and connections
    public static final String SERVER_VERSION = "server.version";
    public static final String SERVER_UPTIME = "server.uptime";
    public static final String CONNECTIONS_CURRENT = "connections.current";
    public static final String CONNECTIONS_RUNNING = "connections.running";
    public static final String CONNECTIONS_MAX = "connections.max";
    public static final String CONNECTIONS_MAX_USED = "connections.max_used";
    public static final String CONNECTIONS_ABORTED_CONNECTS = "connections.aborted_connects";
    public static final String CONNECTIONS_ABORTED_CLIENTS = "connections.aborted_clients";
    public static final String CONNECTIONS_SLEEPING = "connections.sleeping";
    public static final String CONNECTIONS_USAGE_PERCENT = "connections.usage_percent";
    public static final String CONNECTIONS_MAX_USED_PERCENT = "connections.max_used_percent";

    // InnoDB
    public static final String INNODB_BUFFER_POOL_READ_REQUESTS = "innodb.buffer_pool.read_requests";
    public static final String INNODB_BUFFER_POOL_READS = "innodb.buffer_pool.reads";
    public static final String INNODB_BUFFER_POOL_PAGES_TOTAL = "innodb.buffer_pool.pages_total";
    public static final String INNODB_BUFFER_POOL_PAGES_FREE = "innodb.buffer_pool.pages_free";
    public static final String INNODB_BUFFER_POOL_PAGES_DIRTY = "innodb.buffer_pool.pages_dirty";
    public static final String INNODB_BUFFER_POOL_SIZE_BYTES = "innodb.buffer_pool.size_bytes";
    public static final String INNODB_BUFFER_POOL_HIT_RATIO = "innodb.buffer_pool.hit_ratio";
    public static final String INNODB_BUFFER_POOL_USAGE_PERCENT = "innodb.buffer_pool.usage_percent";
    public static final String INNODB_DATA_READS = "innodb.data.reads";
    public static final String INNODB_DATA_WRITES = "innodb.data.writes";
    public static final String INNODB_ROW_LOCK_WAITS = "innodb.row_lock.waits";
    public static final String INNODB_ROW_LOCK_TIME_AVG = "innodb.row_lock.time_avg";

    // Query cache
    public static final String QUERY_CACHE_TYPE = "query_cache.type";
    public static final String QUERY_CACHE_SIZE_BYTES = "query_cache.size_bytes";
    public static final String QUERY_CACHE_LIMIT_BYTES = "query_cache.limit_bytes";
    public static final String QUERY_CACHE_HITS = "query_cache.hits";
    public static final String QUERY_CACHE_INSERTS = "query_cache.inserts";
    public static final String QUERY_CACHE_NOT_CACHED = "query_cache.not_cached";
    public static final String QUERY_CACHE_LOWMEM_PRUNES = "query_cache.lowmem_prunes";
    public static final String QUERY_CACHE_FREE_MEMORY_BYTES = "query_cache.free_memory_bytes";
    public static final String QUERY_CACHE_TOTAL_BLOCKS = "query_cache.total_blocks";
    public static final String QUERY_CACHE_FREE_BLOCKS = "query_cache.free_blocks";
    public static final String QUERY_CACHE_QUERIES_IN_CACHE = "query_cache.queries_in_cache";
    public static final String QUERY_CACHE_HIT_RATIO = "query_cache.hit_ratio";
    public static final String QUERY_CACHE_FRAGMENTATION_PERCENT = "query_cache.fragmentation_percent";
    public static final String QUERY_CACHE_MEMORY_USAGE_PERCENT = "query_cache.memory_usage_percent";
    public static final String QUERY_CACHE_LOWMEM_PRUNE_RATIO = "query_cache.lowmem_prune_ratio";

    // Slow queries
    public static final String SLOW_QUERIES_LOG_ENABLED = "slow_queries.log_enabled";
    public static final String SLOW_QUERIES_LONG_QUERY_TIME = "slow_queries.long_query_time";
    public static final String SLOW_QUERIES_TOTAL = "slow_queries.total";
    public static final String SLOW_QUERIES_UPTIME = "slow_queries.uptime";
    public static final String SLOW_QUERIES_RECENT_COUNT = "slow_queries.recent_count";
    public static final String SLOW_QUERIES_RECENT_MAX_QUERY_TIME = "slow_queries.recent_max_query_time";
    public static final String SLOW_QUERIES_PER_MINUTE = "slow_queries.per_minute";

    // Performance schema
    public static final String PERFORMANCE_SCHEMA_ENABLED = "performance_schema.enabled";
    public static final String PERFORMANCE_SCHEMA_TOP_QUERY_PREFIX = "performance_schema.top_query.";
    public static final String PERFORMANCE_SCHEMA_HIGH_LATENCY_COUNT = "performance_schema.digests.high_latency_count";
    public static final String PERFORMANCE_SCHEMA_MAX_AVG_LATENCY = "performance_schema.digests.max_avg_latency";
    public static final String PERFORMANCE_SCHEMA_METADATA_LOCKS_HELD = "performance_schema.metadata_locks.held";

    // Tables and indexes
    public static final String TABLES_PREFIX = "tables.";
    public static final String TABLES_COUNT = "tables.count";
    public static final String TABLES_WITHOUT_INDEX_COUNT = "tables.without_index_count";
    public static final String TABLES_WITHOUT_INDEX_LIST = "tables.without_index_list";
    public static final String TABLES_LARGE_COUNT = "tables.large_count";
    public static final String TABLES_LARGE_LIST = "tables.large_list";
    public static final String TABLES_FRAGMENTED_COUNT = "tables.fragmented_count";
    public static final String TABLES_FRAGMENTED_LIST = "tables.fragmented_list";
    public static final String INDEXES_COUNT = "indexes.count";
    public static final String INDEXES_ZERO_CARDINALITY_COUNT = "indexes.zero_cardinality_count";
    public static final String INDEXES_REDUNDANT_COUNT = "indexes.redundant_count";
    public static final String INDEXES_REDUNDANT_LIST = "indexes.redundant_list";

    private MetricNames() {
    }
}
