package de.t14d3.dbexecutor.test;

import de.t14d3.dbexecutor.connection.ConnectionFactory;
import de.t14d3.dbexecutor.connection.ExecutionResult;
import de.t14d3.dbexecutor.connection.Session;
import de.t14d3.dbexecutor.core.DbExecutor;
import de.t14d3.dbexecutor.exceptions.OrmException;
import de.t14d3.dbexecutor.exceptions.TransactionRolledBackException;
import de.t14d3.dbexecutor.test.entities.Driver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Connection lifecycle and diagnostics, observed through proxied connections.
 */
public class SessionTest {

    private Connection connection;
    private String url;

    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private final AtomicReference<SQLWarning> pendingWarning = new AtomicReference<>();
    private final AtomicBoolean failAutoCommitRestore = new AtomicBoolean();

    @BeforeEach
    void setUp() throws SQLException {
        url = "jdbc:h2:mem:session" + System.nanoTime() + ";DB_CLOSE_DELAY=-1";
        connection = DriverManager.getConnection(url);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE Driver (id BIGINT AUTO_INCREMENT PRIMARY KEY, name VARCHAR(100) NOT NULL, "
                    + "licenseNumber VARCHAR(20), rating INT, registeredAt TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
        }
    }

    @AfterEach
    void tearDown() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("DROP ALL OBJECTS");
        }
        connection.close();
    }

    private ConnectionFactory trackingFactory() {
        return () -> {
            opened.incrementAndGet();
            return tracking(DriverManager.getConnection(url));
        };
    }

    /**
     * Counts closes, and lets statements report {@link #pendingWarning} once.
     */
    private Connection tracking(Connection delegate) {
        return (Connection) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{Connection.class},
                (proxy, method, args) -> {
                    switch (method.getName()) {
                        case "close":
                            closed.incrementAndGet();
                            break;
                        case "setAutoCommit":
                            if (failAutoCommitRestore.get() && Boolean.TRUE.equals(args[0])) {
                                throw new SQLException("Connection reset while restoring auto-commit");
                            }
                            break;
                        case "prepareStatement":
                        case "prepareCall":
                            return warningStatement(method.getReturnType(), forward(delegate, method, args));
                        default:
                            break;
                    }
                    return forward(delegate, method, args);
                });
    }

    private Object warningStatement(Class<?> statementType, Object delegate) {
        return Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{statementType},
                (proxy, method, args) -> {
                    if (method.getName().equals("getWarnings")) {
                        return pendingWarning.getAndSet(null);
                    }
                    return forward(delegate, method, args);
                });
    }

    private static Object forward(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    @Test
    void testWarningsReachDiagnosticHandler() {
        List<String> messages = new ArrayList<>();
        List<Connection> sources = new ArrayList<>();
        DbExecutor db = new DbExecutor(trackingFactory()).withDiagnosticHandler((conn, warning) -> {
            sources.add(conn);
            messages.add(warning.getMessage());
        });

        SQLWarning first = new SQLWarning("Changed database context to 'Fleet'.");
        first.setNextWarning(new SQLWarning("Changed language setting to us_english."));
        pendingWarning.set(first);

        db.execute("UPDATE Driver SET rating = 1");

        assertEquals(List.of("Changed database context to 'Fleet'.", "Changed language setting to us_english."), messages);
        assertEquals(2, sources.size());
        assertNotNull(sources.get(0));
    }

    @Test
    void testWarningsWithoutHandlerAreIgnored() {
        DbExecutor db = new DbExecutor(trackingFactory());
        pendingWarning.set(new SQLWarning("Nobody is listening"));

        assertEquals(0, db.execute("UPDATE Driver SET rating = 1"));
    }

    @Test
    void testConnectionClosedOnEveryPath() {
        DbExecutor db = new DbExecutor(trackingFactory());

        db.create(new Driver("Ada", "L-100", 5));
        assertThrows(OrmException.class, () -> db.execute("SELECT * FROM NoSuchTable"));
        assertThrows(IllegalArgumentException.class, () -> db.execute("DELETE FROM Driver WHERE id = :id"));

        db.setUseTransactions(true);
        db.retrieve(Driver.class);
        assertThrows(TransactionRolledBackException.class, () -> db.execute("SELECT * FROM NoSuchTable"));

        assertEquals(5, opened.get());
        assertEquals(5, closed.get());
    }

    @Test
    void testTransactionalRunReportsFailure() {
        ExecutionResult<Integer> result;
        try (Session session = Session.open(trackingFactory(), null, true)) {
            assertTrue(session.isTransactional());
            result = session.run(s -> {
                try (Statement stmt = s.getConnection().createStatement()) {
                    stmt.executeUpdate("INSERT INTO Driver(name) VALUES ('Ada')");
                }
                throw new SQLException("Deadlock victim");
            });
        }

        assertTrue(result.isFailure());
        assertFalse(result.isSuccess());
        assertEquals("Deadlock victim", result.getError().orElseThrow().getMessage());
        assertEquals(-1, result.orElse(-1));
        assertThrows(NoSuchElementException.class, result::getValue);
        assertTrue(new DbExecutor(trackingFactory()).retrieve(Driver.class).isEmpty());
    }

    @Test
    void testTransactionalRunCommits() {
        ExecutionResult<Integer> result;
        try (Session session = Session.open(trackingFactory(), null, true)) {
            result = session.run(s -> {
                try (Statement stmt = s.getConnection().createStatement()) {
                    return stmt.executeUpdate("INSERT INTO Driver(name) VALUES ('Ada')");
                }
            });
        }

        assertTrue(result.isSuccess());
        assertEquals(1, result.getValue());
        assertEquals(1, new DbExecutor(trackingFactory()).retrieve(Driver.class).size());
    }

    @Test
    void testNonTransactionalRunPropagates() {
        try (Session session = Session.open(trackingFactory(), null, false)) {
            OrmException e = assertThrows(OrmException.class, () -> session.run(s -> {
                throw new SQLException("Invalid object name 'Drivers'.");
            }));
            assertEquals("Invalid object name 'Drivers'.", e.getCause().getMessage());
        }
        assertEquals(1, closed.get());
    }

    @Test
    void testAtomicFailureSurvivesAutoCommitRestoreFailure() {
        failAutoCommitRestore.set(true);

        try (Session session = Session.open(trackingFactory(), null, false)) {
            SQLException e = assertThrows(SQLException.class, () -> session.atomically(s -> {
                try (Statement stmt = s.getConnection().createStatement()) {
                    stmt.executeUpdate("INSERT INTO Driver(name) VALUES ('Ada')");
                }
                throw new SQLException("Batch entry 2 was aborted");
            }));

            assertEquals("Batch entry 2 was aborted", e.getMessage());
            assertEquals(1, e.getSuppressed().length);
            assertEquals("Connection reset while restoring auto-commit", e.getSuppressed()[0].getMessage());
        }
        assertTrue(new DbExecutor(() -> DriverManager.getConnection(url)).retrieve(Driver.class).isEmpty());
    }

    @Test
    void testOpenFailureIsWrapped() {
        ConnectionFactory broken = () -> {
            throw new SQLException("Login failed for user 'app'.");
        };

        OrmException e = assertThrows(OrmException.class, () -> new DbExecutor(broken).retrieve(Driver.class));
        assertInstanceOf(SQLException.class, e.getCause());
    }
}
