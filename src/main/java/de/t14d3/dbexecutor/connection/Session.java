package de.t14d3.dbexecutor.connection;

import de.t14d3.dbexecutor.exceptions.OrmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;

/**
 * One connection, and at most one transaction, for the duration of a single call.
 * <p>
 * With transactions enabled, {@link #run(SessionAction)} commits when the action
 * completes and rolls back when it throws, reporting the error as a failed
 * {@link ExecutionResult}. Without transactions the action runs in auto-commit
 * mode and its exceptions propagate. The connection is closed by {@link #close()}.
 */
public class Session implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(Session.class);

    private final Connection connection;
    private final DiagnosticHandler diagnosticHandler;
    private final boolean transactional;

    private Session(Connection connection, DiagnosticHandler diagnosticHandler, boolean transactional) {
        this.connection = connection;
        this.diagnosticHandler = diagnosticHandler;
        this.transactional = transactional;
    }

    /**
     * Opens a new session.
     *
     * @param diagnosticHandler receives database warnings; may be null
     */
    public static Session open(ConnectionFactory connectionFactory, DiagnosticHandler diagnosticHandler,
                               boolean useTransactions) {
        Connection connection;
        try {
            connection = connectionFactory.open();
        } catch (SQLException e) {
            throw new OrmException("Failed to open connection using " + connectionFactory, e);
        }
        return new Session(connection, diagnosticHandler, useTransactions);
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isTransactional() {
        return transactional;
    }

    /**
     * Runs the action, inside a transaction if this session is transactional.
     *
     * @return the action's value, or for a transactional session the error that
     * caused the rollback
     * @throws OrmException if a non-transactional action fails with a {@link SQLException}
     */
    public <T> ExecutionResult<T> run(SessionAction<T> action) {
        if (!transactional) {
            try {
                return ExecutionResult.success(action.apply(this));
            } catch (SQLException e) {
                throw new OrmException(e.getMessage(), e);
            }
        }

        try {
            connection.setAutoCommit(false);
            T result = action.apply(this);
            connection.commit();
            return ExecutionResult.success(result);
        } catch (Exception e) {
            rollback(e);
            LOG.warn("Transaction rolled back: {}", e.getMessage());
            return ExecutionResult.failure(e);
        }
    }

    /**
     * Runs the action so that all of its statements take effect or none do. Inside a
     * transactional session this is the session's transaction; otherwise a local
     * transaction is opened around the action and exceptions propagate after rollback.
     */
    public <T> T atomically(SessionAction<T> action) throws SQLException {
        if (transactional || !connection.getAutoCommit()) {
            return action.apply(this);
        }

        connection.setAutoCommit(false);
        T result;
        try {
            result = action.apply(this);
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            rollback(e);
            restoreAutoCommit(e);
            throw e;
        }
        connection.setAutoCommit(true);
        return result;
    }

    /**
     * Forwards the warnings of the statement and the connection to the diagnostic
     * handler, then clears them.
     */
    public void reportWarnings(Statement statement) throws SQLException {
        if (diagnosticHandler == null) {
            return;
        }
        forward(statement.getWarnings());
        statement.clearWarnings();
        forward(connection.getWarnings());
        connection.clearWarnings();
    }

    private void forward(SQLWarning warning) {
        for (SQLWarning w = warning; w != null; w = w.getNextWarning()) {
            diagnosticHandler.onDiagnostic(connection, w);
        }
    }

    private void rollback(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            cause.addSuppressed(rollbackEx);
        }
    }

    private void restoreAutoCommit(Exception cause) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException restoreEx) {
            cause.addSuppressed(restoreEx);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new OrmException("Failed to close connection", e);
        }
    }
}
