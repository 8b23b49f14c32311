package io.sqlpulse.monitor.engine.connect;

/**
 * A single statement failed or was refused. Recoverable: it only affects the collector that issued it.
 */
public class QueryException extends Exception {
    private final String statement;

    public QueryException(String message, String statement) {
        super(message);
        this.statement = statement;
    }

    public QueryException(String message, String statement, Throwable cause) {
        super(message, cause);
        this.statement = statement;
    }

    public String getStatement() {
        return statement;
    }
}
