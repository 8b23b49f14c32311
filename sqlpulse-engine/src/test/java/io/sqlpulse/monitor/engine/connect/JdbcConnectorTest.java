package io.sqlpulse.monitor.engine.connect;

import io.sqlpulse.monitor.engine.MonitorConfig;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcConnectorTest {

    @Test
    void shouldFailAfterConfiguredAttempts() throws SQLException {
        // Given
        MonitorConfig config = MonitorConfig.builder()
                .host("db.internal")
                .port(3307)
                .retryAttempts(3)
                .retryBackoffMs(0)
                .build();
        JdbcConnector.ConnectionFactory factory = mock(JdbcConnector.ConnectionFactory.class);
        when(factory.open(anyString(), any(Properties.class))).thenThrow(new SQLException("Connection refused"));

        // When & Then
        assertThatThrownBy(() -> new JdbcConnector(config, factory).connect())
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining("db.internal:3307")
                .hasMessageContaining("3 attempt(s)")
                .satisfies(e -> assertThat(((ConnectionException) e).getAttempts()).isEqualTo(3))
                .hasCauseInstanceOf(SQLException.class);
        verify(factory, times(3)).open(anyString(), any(Properties.class));
    }

    @Test
    void shouldSucceedOnRetryAndOpenReadOnly() throws Exception {
        // Given
        MonitorConfig config = MonitorConfig.builder().retryAttempts(3).retryBackoffMs(0).build();
        Connection connection = mock(Connection.class);
        JdbcConnector.ConnectionFactory factory = mock(JdbcConnector.ConnectionFactory.class);
        when(factory.open(anyString(), any(Properties.class)))
                .thenThrow(new SQLException("Too many connections"))
                .thenReturn(connection);

        // When
        Session session = new JdbcConnector(config, factory).connect();

        // Then
        assertThat(session).isInstanceOf(JdbcSession.class);
        verify(connection).setReadOnly(true);
        verify(factory, times(2)).open(anyString(), any(Properties.class));
    }

    @Test
    void shouldCloseConnectionWhenReadOnlyModeIsRefused() throws Exception {
        // Given
        MonitorConfig config = MonitorConfig.builder().retryAttempts(2).retryBackoffMs(0).build();
        Connection first = mock(Connection.class);
        Connection second = mock(Connection.class);
        SQLException refused = new SQLException("read-only not supported");
        doThrow(refused).when(first).setReadOnly(true);
        doThrow(new SQLException("read-only not supported")).when(second).setReadOnly(true);
        doThrow(new SQLException("socket closed")).when(second).close();
        JdbcConnector.ConnectionFactory factory = mock(JdbcConnector.ConnectionFactory.class);
        when(factory.open(anyString(), any(Properties.class))).thenReturn(first, second);

        // When & Then
        assertThatThrownBy(() -> new JdbcConnector(config, factory).connect())
                .isInstanceOf(ConnectionException.class)
                .satisfies(e -> assertThat(e.getCause().getSuppressed())
                        .singleElement()
                        .satisfies(s -> assertThat(s).hasMessage("socket closed")));
        verify(first).close();
        verify(second).close();
    }

    @Test
    void shouldConnectToH2ThroughJdbcUrl() throws Exception {
        // Given
        MonitorConfig config = MonitorConfig.builder()
                .jdbcUrl("jdbc:h2:mem:connector_test")
                .user("sa")
                .password("")
                .build();

        // When
        try (Session session = new JdbcConnector(config).connect()) {
            List<Map<String, Object>> rows = session.execute("SELECT 1 AS answer");

            // Then
            assertThat(rows).singleElement().satisfies(row -> assertThat(row.get("answer")).isEqualTo(1));
        }
    }
}
