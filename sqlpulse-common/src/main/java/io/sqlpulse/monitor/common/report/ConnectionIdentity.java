package io.sqlpulse.monitor.common.report;

import java.util.Objects;

/**
 * Who the report was captured as. Never carries the password.
 */
public final class ConnectionIdentity {
    private final String host;
    private final int port;
    private final String user;

    public ConnectionIdentity(String host, int port, String user) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.user = Objects.requireNonNull(user, "user");
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getUser() { return user; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectionIdentity)) return false;
        ConnectionIdentity that = (ConnectionIdentity) o;
        return port == that.port && host.equals(that.host) && user.equals(that.user);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, user);
    }

    @Override
    public String toString() {
        return user + "@" + host + ":" + port;
    }
}
