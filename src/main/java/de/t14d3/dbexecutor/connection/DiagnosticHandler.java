package de.t14d3.dbexecutor.connection;

import java.sql.Connection;
import java.sql.SQLWarning;

/**
 * Receives the non-fatal messages (warnings, informational messages, print output)
 * the database reports while a statement runs.
 */
@FunctionalInterface
public interface DiagnosticHandler {
    void onDiagnostic(Connection connection, SQLWarning warning);
}
