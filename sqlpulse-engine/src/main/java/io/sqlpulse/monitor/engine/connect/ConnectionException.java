package io.sqlpulse.monitor.engine.connect;

/**
 * No session could be opened after all configured attempts. Fatal for the run.
 */
public class ConnectionException extends Exception {
    private final int attempts;

    public ConnectionException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
