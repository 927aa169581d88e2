package de.t14d3.dbexecutor.connection;

import java.util.Properties;

/**
 * Connection settings read from a connection document.
 * <p>
 * When no password is given, integrated security is expected to be used.
 */
public final class ConnectionSettings {
    private final String server;
    private final String instance;
    private final Integer port;
    private final String database;
    private final String username;
    private final String password;
    private final boolean integratedSecurity;

    public ConnectionSettings(String server, String instance, Integer port, String database,
                              String username, String password, boolean integratedSecurity) {
        if (server == null || server.isBlank()) {
            throw new IllegalArgumentException("server must not be blank");
        }
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("database must not be blank");
        }
        this.server = server;
        this.instance = blankToNull(instance);
        this.port = port;
        this.database = database;
        this.username = blankToNull(username);
        this.password = blankToNull(password);
        this.integratedSecurity = integratedSecurity;
    }

    public String getServer() {
        return server;
    }

    public String getInstance() {
        return instance;
    }

    public Integer getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public boolean isIntegratedSecurity() {
        return integratedSecurity;
    }

    /**
     * The server name, with {@code \instance} appended when an instance is set.
     */
    public String getDataSource() {
        return instance == null ? server : server + "\\" + instance;
    }

    public String toJdbcUrl() {
        StringBuilder url = new StringBuilder("jdbc:sqlserver://").append(getDataSource());
        if (port != null) {
            url.append(':').append(port);
        }
        url.append(";databaseName=").append(database);
        url.append(";integratedSecurity=").append(integratedSecurity);
        return url.toString();
    }

    /**
     * Credentials as driver properties, so they never end up in the URL or in logs.
     */
    public Properties toProperties() {
        Properties properties = new Properties();
        if (username != null) {
            properties.setProperty("user", username);
        }
        if (password != null) {
            properties.setProperty("password", password);
        }
        return properties;
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    @Override
    public String toString() {
        return "ConnectionSettings{dataSource=" + getDataSource() + ", database=" + database
                + ", username=" + username + ", integratedSecurity=" + integratedSecurity + "}";
    }
}
