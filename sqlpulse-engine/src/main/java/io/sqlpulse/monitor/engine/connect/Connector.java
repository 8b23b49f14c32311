package io.sqlpulse.monitor.engine.connect;

/**
 * Opens a session to the monitored server
 */
public interface Connector {

    /**
     * @throws ConnectionException once every configured attempt has failed
     */
    Session connect() throws ConnectionException;
}
