package io.sqlpulse.monitor.engine.connect;

import io.sqlpulse.monitor.engine.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens a JDBC session, retrying with a fixed backoff. Each attempt is a fresh connection.
 */
public class JdbcConnector implements Connector {
    private static final Logger logger = LoggerFactory.getLogger(JdbcConnector.class);

    /**
     * Seam for opening raw JDBC connections
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection open(String url, Properties properties) throws SQLException;
    }

    private final MonitorConfig config;
    private final ConnectionFactory connectionFactory;

    public JdbcConnector(MonitorConfig config) {
        this(config, DriverManager::getConnection);
    }

    public JdbcConnector(MonitorConfig config, ConnectionFactory connectionFactory) {
        this.config = config;
        this.connectionFactory = connectionFactory;
    }

    @Override
    public Session connect() throws ConnectionException {
        String url = config.getJdbcUrl();
        int attempts = Math.max(1, config.getRetryAttempts());
        SQLException lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            Connection connection = null;
            try {
                connection = connectionFactory.open(url, connectionProperties(url));
                connection.setReadOnly(true);
                logger.info("Connected to {} as {} (attempt {}/{})",
                        config.getHost() + ":" + config.getPort(), config.getUser(), attempt, attempts);
                return new JdbcSession(connection, config.getQueryTimeoutSeconds());
            } catch (SQLException e) {
                closeAfterFailure(connection, e);
                lastError = e;
                logger.warn("Connection attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
                if (attempt < attempts && !backoff()) {
                    break;
                }
            }
        }

        throw new ConnectionException("Could not connect to " + config.getHost() + ":" + config.getPort()
                + " after " + attempts + " attempt(s): "
                + (lastError != null ? lastError.getMessage() : "interrupted"), attempts, lastError);
    }

    private static void closeAfterFailure(Connection connection, SQLException failure) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException closeError) {
            failure.addSuppressed(closeError);
        }
    }

    private boolean backoff() {
        long delay = config.getRetryBackoffMs();
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting to retry the connection");
            return false;
        }
    }

    private Properties connectionProperties(String url) {
        Properties properties = new Properties();
        properties.setProperty("user", config.getUser());
        properties.setProperty("password", config.getPassword());
        if (url.startsWith("jdbc:mysql:") || url.startsWith("jdbc:mariadb:")) {
            properties.setProperty("connectTimeout", Long.toString(config.getConnectionTimeoutSeconds() * 1000L));
            properties.setProperty("socketTimeout", Long.toString(config.getQueryTimeoutSeconds() * 1000L));
        }
        return properties;
    }
}
