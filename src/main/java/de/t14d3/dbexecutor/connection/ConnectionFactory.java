package de.t14d3.dbexecutor.connection;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a new connection for each call.
 */
@FunctionalInterface
public interface ConnectionFactory {
    Connection open() throws SQLException;
}
