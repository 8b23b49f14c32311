package io.sqlpulse.monitor.engine.connect;

import java.util.List;
import java.util.Map;

/**
 * One live, read-only database session. Used sequentially by the collectors of a run
 * and closed when the run ends.
 */
public interface Session extends AutoCloseable {

    /**
     * Execute a read-only statement.
     *
     * @return rows as column label to value maps; column lookup is case-insensitive
     * @throws QueryException if the statement fails or is not read-only
     */
    List<Map<String, Object>> execute(String statement) throws QueryException;

    @Override
    void close();
}
