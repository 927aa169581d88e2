package de.t14d3.dbexecutor.core;

import de.t14d3.dbexecutor.connection.ConnectionFactory;
import de.t14d3.dbexecutor.connection.ConnectionSettingsLoader;
import de.t14d3.dbexecutor.connection.DiagnosticHandler;
import de.t14d3.dbexecutor.connection.ExecutionResult;
import de.t14d3.dbexecutor.connection.Session;
import de.t14d3.dbexecutor.connection.SessionAction;
import de.t14d3.dbexecutor.exceptions.TransactionRolledBackException;
import de.t14d3.dbexecutor.mapping.EntityMetadata;
import de.t14d3.dbexecutor.mapping.MappingRegistry;
import de.t14d3.dbexecutor.mapping.MappingScanner;
import de.t14d3.dbexecutor.mapping.TypeMapper;
import de.t14d3.dbexecutor.model.EnumRow;
import de.t14d3.dbexecutor.query.Parameter;
import de.t14d3.dbexecutor.query.ProcedureRegistry;
import de.t14d3.dbexecutor.query.Query;
import de.t14d3.dbexecutor.query.QueryBatch;
import de.t14d3.dbexecutor.query.QueryGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Executes queries and stored procedures, and performs CRUD operations on mapped types.
 * <p>
 * Each call opens its own connection and closes it before returning. Types are
 * mapped by {@link EntityMetadata}: the table is named after the class, the columns
 * after its fields.
 * <p>
 * With {@linkplain #setUseTransactions(boolean) transactions} enabled every call
 * runs in its own transaction. If it fails, the transaction is rolled back and a
 * {@link TransactionRolledBackException} carrying the original error is thrown.
 * Without transactions, errors propagate as they occur.
 */
public class DbExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(DbExecutor.class);

    private final ConnectionFactory connectionFactory;
    private final MappingRegistry mappingRegistry;
    private final ProcedureRegistry procedureRegistry;
    private final SqlExecutor sqlExecutor;
    private DiagnosticHandler diagnosticHandler;
    private boolean useTransactions;

    public DbExecutor(ConnectionFactory connectionFactory) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory must not be null");
        }
        this.connectionFactory = connectionFactory;
        this.mappingRegistry = new MappingRegistry();
        this.procedureRegistry = new ProcedureRegistry();
        this.sqlExecutor = new SqlExecutor(procedureRegistry);
    }

    /**
     * Create a new DbExecutor from a JDBC URL, or from the path of an XML file that
     * holds the connection settings.
     *
     * @see ConnectionSettingsLoader
     */
    public static DbExecutor create(String connectionString) {
        return new DbExecutor(new ConnectionSettingsLoader().resolve(connectionString));
    }

    /**
     * Create a new DbExecutor whose diagnostic handler receives the warnings and
     * informational messages the database reports.
     */
    public static DbExecutor create(String connectionString, DiagnosticHandler diagnosticHandler) {
        return create(connectionString).withDiagnosticHandler(diagnosticHandler);
    }

    public DbExecutor withDiagnosticHandler(DiagnosticHandler diagnosticHandler) {
        this.diagnosticHandler = diagnosticHandler;
        return this;
    }

    public DbExecutor withTransactions(boolean useTransactions) {
        this.useTransactions = useTransactions;
        return this;
    }

    public boolean isUseTransactions() {
        return useTransactions;
    }

    /**
     * Defines if transactions should be used for queries and procedure calls.
     * Meant to be set once at start-up; changing it while calls are running on other
     * threads is not synchronized.
     */
    public void setUseTransactions(boolean useTransactions) {
        this.useTransactions = useTransactions;
    }

    public ConnectionFactory getConnectionFactory() {
        return connectionFactory;
    }

    public MappingRegistry getMappingRegistry() {
        return mappingRegistry;
    }

    public ProcedureRegistry getProcedureRegistry() {
        return procedureRegistry;
    }

    /**
     * Declare the parameters of a stored procedure, in call order. Procedures that are
     * not registered have their parameters looked up in the database metadata.
     */
    public DbExecutor registerProcedure(String procedureName, String... parameterNames) {
        procedureRegistry.register(procedureName, parameterNames);
        return this;
    }

    /**
     * Validate and register mappings so they are built once rather than on every call.
     */
    public DbExecutor registerEntities(Class<?>... entityClasses) {
        mappingRegistry.register(entityClasses);
        return this;
    }

    /**
     * Register every {@link de.t14d3.dbexecutor.annotations.Entity @Entity} type under a package.
     */
    public DbExecutor scanEntities(String basePackage) {
        MappingScanner.scan(basePackage, mappingRegistry);
        return this;
    }

    // ---------------------------------------------------------------------
    // CRUD
    // ---------------------------------------------------------------------

    /**
     * Inserts the instance.
     *
     * @return true if a row was inserted
     */
    public <T> boolean create(T instance) {
        if (instance == null) {
            throw new IllegalArgumentException("Nothing to insert");
        }
        @SuppressWarnings("unchecked")
        Class<T> type = (Class<T>) instance.getClass();
        return create(type, List.of(instance));
    }

    /**
     * Inserts all instances atomically in one batch.
     *
     * @return true if at least one row was inserted
     * @throws IllegalArgumentException if {@code instances} is null or empty
     */
    public <T> boolean create(Class<T> type, Collection<? extends T> instances) {
        if (instances == null || instances.isEmpty()) {
            throw new IllegalArgumentException("Nothing to insert into " + type.getSimpleName());
        }
        QueryBatch batch = QueryGenerator.insert(mappingRegistry.metadataFor(type), instances);
        int affected = run("Insert into " + type.getSimpleName(), session -> sqlExecutor.executeBatch(session, batch));
        return affected > 0;
    }

    /**
     * Retrieves every row of the type's table.
     */
    public <T> List<T> retrieve(Class<T> type) {
        EntityMetadata metadata = mappingRegistry.metadataFor(type);
        return retrieve(metadata, QueryGenerator.selectAll(metadata));
    }

    /**
     * Executes a query, or a stored procedure if the text is a single word, and maps
     * every result row onto a new instance of the type. Fields are set by column
     * name; columns without a field are ignored. Procedure arguments are bound by
     * parameter name.
     *
     * @throws de.t14d3.dbexecutor.exceptions.MappingException if a mapped field has no column in the result
     */
    public <T> List<T> retrieve(Class<T> type, String procedureNameOrQuery, Parameter... parameters) {
        return retrieve(mappingRegistry.metadataFor(type), Query.of(procedureNameOrQuery, parameters));
    }

    private <T> List<T> retrieve(EntityMetadata metadata, Query query) {
        return run("Retrieve " + metadata.getEntityClass().getSimpleName(),
                session -> sqlExecutor.query(session, query, metadata));
    }

    /**
     * Updates the row with the instance's key.
     *
     * @return the number of affected rows
     * @throws de.t14d3.dbexecutor.exceptions.MappingException if the type has no {@code @Id} field
     */
    public <T> int update(T instance) {
        EntityMetadata metadata = metadataOf(instance);
        Query query = QueryGenerator.update(metadata, instance);
        return run("Update " + metadata.getTableName(), session -> sqlExecutor.executeUpdate(session, query));
    }

    /**
     * Deletes the row with the instance's key.
     *
     * @return true if a row was deleted
     * @throws de.t14d3.dbexecutor.exceptions.MappingException if the type has no {@code @Id} field
     */
    public <T> boolean delete(T instance) {
        EntityMetadata metadata = metadataOf(instance);
        Query query = QueryGenerator.delete(metadata, instance);
        int affected = run("Delete from " + metadata.getTableName(), session -> sqlExecutor.executeUpdate(session, query));
        return affected > 0;
    }

    // ---------------------------------------------------------------------
    // Lookup tables
    // ---------------------------------------------------------------------

    /**
     * Reads a lookup table with the default {@code Name} and {@code Id} columns.
     */
    public <V> List<EnumRow<V>> getEnum(String table, Class<V> valueType) {
        return getEnum(table, valueType, "Name", "Id");
    }

    /**
     * Reads a lookup table as (name, value) rows, in the order the database returns them.
     */
    @SuppressWarnings("unchecked")
    public <V> List<EnumRow<V>> getEnum(String table, Class<V> valueType, String nameColumn, String valueColumn) {
        Query query = QueryGenerator.enumeration(table, nameColumn, valueColumn);
        List<EnumRow<Object>> rows = (List<EnumRow<Object>>) (List<?>) retrieve(mappingRegistry.metadataFor(EnumRow.class), query);

        for (EnumRow<Object> row : rows) {
            row.setValue(TypeMapper.convertToJavaType(row.getValue(), valueType));
        }
        return (List<EnumRow<V>>) (List<?>) rows;
    }

    // ---------------------------------------------------------------------
    // Raw statements and procedures
    // ---------------------------------------------------------------------

    /**
     * Executes a query, or a stored procedure if the text is a single word. Procedure
     * arguments are bound by parameter name.
     *
     * @return the number of affected rows
     */
    public int execute(String procedureNameOrQuery, Parameter... parameters) {
        Query query = Query.of(procedureNameOrQuery, parameters);
        return run("Execute " + query.getCommandType(), session -> sqlExecutor.executeUpdate(session, query));
    }

    /**
     * Executes a stored procedure without arguments.
     */
    public int executeProcedure(String procedureName) {
        return executeProcedure(procedureName, null);
    }

    /**
     * Executes a stored procedure, binding its arguments from a parameter bag: a
     * {@link java.util.Map} of parameter name to value, or an object (a record, say)
     * whose fields are named like the procedure's parameters.
     * <p>
     * Arguments are matched to the procedure's parameters by name, ignoring case and
     * a leading {@code @}; the order of the bag does not matter.
     * {@code executeProcedure("AssignDriver", Map.of("driverId", 7, "vehicleId", 3))}
     * calls {@code AssignDriver} with {@code @driverId = 7, @vehicleId = 3}.
     *
     * @return the number of affected rows
     * @throws IllegalArgumentException if the bag does not match the procedure's parameters,
     *                                  or they can be neither found in the registry nor in
     *                                  the database metadata
     */
    public int executeProcedure(String procedureName, Object parameters) {
        Query query = QueryGenerator.procedure(procedureName, parameters);
        return run("Procedure " + procedureName, session -> sqlExecutor.executeUpdate(session, query));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private EntityMetadata metadataOf(Object instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance must not be null");
        }
        return mappingRegistry.metadataFor(instance.getClass());
    }

    private <R> R run(String description, SessionAction<R> action) {
        boolean transactional = useTransactions;
        try (Session session = Session.open(connectionFactory, diagnosticHandler, transactional)) {
            LOG.debug("{} (transactional={})", description, transactional);
            ExecutionResult<R> result = session.run(action);
            return result.orElseThrow(error ->
                    new TransactionRolledBackException(description + " failed and was rolled back: " + error.getMessage(), error));
        }
    }
}
