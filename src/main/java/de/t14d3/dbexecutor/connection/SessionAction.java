package de.t14d3.dbexecutor.connection;

import java.sql.SQLException;

/**
 * Work done with the connection of a {@link Session}.
 */
@FunctionalInterface
public interface SessionAction<T> {
    T apply(Session session) throws SQLException;
}
