package de.t14d3.dbexecutor.core;

import de.t14d3.dbexecutor.connection.Session;
import de.t14d3.dbexecutor.exceptions.MappingException;
import de.t14d3.dbexecutor.mapping.EntityMetadata;
import de.t14d3.dbexecutor.mapping.FieldMapping;
import de.t14d3.dbexecutor.mapping.Operation;
import de.t14d3.dbexecutor.mapping.TypeMapper;
import de.t14d3.dbexecutor.query.NamedParameters;
import de.t14d3.dbexecutor.query.ProcedureRegistry;
import de.t14d3.dbexecutor.query.Query;
import de.t14d3.dbexecutor.query.QueryBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Time;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Executes generated statements on a session and maps results to instances.
 *
 * Responsible for:
 *  - turning named parameters into positional JDBC bindings
 *  - ordering procedure arguments by the procedure's declared parameter names
 *  - choosing between plain and callable statements
 *  - running insert batches atomically
 *  - mapping result rows onto mapped types by column name
 */
public class SqlExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(SqlExecutor.class);

    private final ProcedureRegistry procedureRegistry;

    public SqlExecutor(ProcedureRegistry procedureRegistry) {
        this.procedureRegistry = procedureRegistry;
    }

    // ---------------------------------------------------------------------
    // Statement execution
    // ---------------------------------------------------------------------

    /**
     * Executes a statement and returns the number of affected rows, summed over
     * every update count the statement reports.
     */
    public int executeUpdate(Session session, Query query) throws SQLException {
        try (PreparedStatement stmt = prepare(session, query)) {
            boolean hasResultSet = stmt.execute();
            int affected = 0;
            int updateCount = 0;
            while (hasResultSet || (updateCount = stmt.getUpdateCount()) != -1) {
                if (!hasResultSet) {
                    affected += updateCount;
                }
                hasResultSet = stmt.getMoreResults();
            }
            session.reportWarnings(stmt);
            return affected;
        }
    }

    /**
     * Executes all statements of the batch atomically. Consecutive statements with
     * the same positional SQL share one JDBC batch.
     */
    public int executeBatch(Session session, QueryBatch batch) throws SQLException {
        LOG.debug("Executing batch of {} statement(s)", batch.size());
        return session.atomically(s -> {
            int affected = 0;
            PreparedStatement stmt = null;
            String currentSql = null;
            try {
                for (Query query : batch.getQueries()) {
                    NamedParameters parsed = NamedParameters.parse(query.getSql());
                    if (!parsed.getPositionalSql().equals(currentSql)) {
                        if (stmt != null) {
                            affected += flush(s, stmt);
                            stmt.close();
                        }
                        currentSql = parsed.getPositionalSql();
                        LOG.debug("Preparing batch statement: {}", currentSql);
                        stmt = s.getConnection().prepareStatement(currentSql);
                    }
                    setParameters(stmt, parsed.bind(query.getParameters()));
                    stmt.addBatch();
                }
                if (stmt != null) {
                    affected += flush(s, stmt);
                }
            } finally {
                if (stmt != null) {
                    stmt.close();
                }
            }
            return affected;
        });
    }

    private int flush(Session session, PreparedStatement stmt) throws SQLException {
        int affected = 0;
        for (int count : stmt.executeBatch()) {
            if (count == Statement.SUCCESS_NO_INFO) {
                affected += 1;
            } else if (count > 0) {
                affected += count;
            }
        }
        session.reportWarnings(stmt);
        return affected;
    }

    /**
     * Executes a query and maps every row onto a new instance of the mapped type.
     */
    public <T> List<T> query(Session session, Query query, EntityMetadata metadata) throws SQLException {
        List<FieldMapping> fields = metadata.fieldsFor(Operation.RETRIEVE, false).fields();
        List<T> results = new ArrayList<>();

        try (PreparedStatement stmt = prepare(session, query);
             ResultSet rs = stmt.executeQuery()) {
            Map<String, Integer> columns = columnIndex(rs.getMetaData());
            int[] indexes = resolveColumns(fields, columns, metadata);

            while (rs.next()) {
                results.add(mapRow(rs, metadata, fields, indexes));
            }
            session.reportWarnings(stmt);
        }
        return results;
    }

    private PreparedStatement prepare(Session session, Query query) throws SQLException {
        List<Object> values;
        PreparedStatement stmt;

        if (query.isProcedure()) {
            String callSql = query.getCallSql();
            LOG.debug("Calling procedure: {} {}", callSql, query.getParameterNames());
            values = query.getParameters().isEmpty()
                    ? List.of()
                    : procedureRegistry.signatureFor(session.getConnection(), query.getSql()).bind(query.getParameters());
            stmt = session.getConnection().prepareCall(callSql);
        } else {
            NamedParameters parsed = NamedParameters.parse(query.getSql());
            LOG.debug("Executing SQL: {} {}", parsed.getPositionalSql(), parsed.getParameterNames());
            values = parsed.bind(query.getParameters());
            stmt = session.getConnection().prepareStatement(parsed.getPositionalSql());
        }

        try {
            setParameters(stmt, values);
        } catch (SQLException | RuntimeException e) {
            stmt.close();
            throw e;
        }
        return stmt;
    }

    // ---------------------------------------------------------------------
    // Mapping helpers
    // ---------------------------------------------------------------------

    private static Map<String, Integer> columnIndex(ResultSetMetaData meta) throws SQLException {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            // first occurrence wins for duplicate labels
            columns.putIfAbsent(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private static int[] resolveColumns(List<FieldMapping> fields, Map<String, Integer> columns, EntityMetadata metadata) {
        int[] indexes = new int[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            FieldMapping field = fields.get(i);
            Integer index = columns.get(field.getColumnLabel().toLowerCase(Locale.ROOT));
            if (index == null) {
                throw new MappingException("Result has no column '" + field.getColumnName() + "' for field "
                        + metadata.getEntityClass().getSimpleName() + "." + field.getName()
                        + "; columns are " + columns.keySet());
            }
            indexes[i] = index;
        }
        return indexes;
    }

    @SuppressWarnings("unchecked")
    private static <T> T mapRow(ResultSet rs, EntityMetadata metadata, List<FieldMapping> fields, int[] indexes)
            throws SQLException {
        Object instance = metadata.newInstance();

        for (int i = 0; i < fields.size(); i++) {
            FieldMapping field = fields.get(i);
            Object value = TypeMapper.convertToJavaType(rs.getObject(indexes[i]), field.getType());

            // NULL into a primitive keeps the field's default
            if (value == null && field.getType().isPrimitive()) {
                continue;
            }
            field.setValue(instance, value);
        }

        return (T) instance;
    }

    // ---------------------------------------------------------------------
    // PreparedStatement parameter binding with simple type handling
    // ---------------------------------------------------------------------

    public static PreparedStatement setParameters(PreparedStatement stmt, List<Object> params) throws SQLException {
        if (params == null || params.isEmpty()) return stmt;

        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            int idx = i + 1;

            if (p == null) {
                stmt.setNull(idx, Types.NULL);
            } else if (p instanceof String s) {
                stmt.setString(idx, s);
            } else if (p instanceof Integer integer) {
                stmt.setInt(idx, integer);
            } else if (p instanceof Long l) {
                stmt.setLong(idx, l);
            } else if (p instanceof Boolean b) {
                stmt.setBoolean(idx, b);
            } else if (p instanceof Double d) {
                stmt.setDouble(idx, d);
            } else if (p instanceof Float f) {
                stmt.setFloat(idx, f);
            } else if (p instanceof Short aShort) {
                stmt.setShort(idx, aShort);
            } else if (p instanceof Byte aByte) {
                stmt.setByte(idx, aByte);
            } else if (p instanceof java.sql.Date sqlDate) {
                stmt.setDate(idx, sqlDate);
            } else if (p instanceof Time time) {
                stmt.setTime(idx, time);
            } else if (p instanceof Timestamp timestamp) {
                stmt.setTimestamp(idx, timestamp);
            } else if (p instanceof java.util.Date date) {
                stmt.setTimestamp(idx, new Timestamp(date.getTime()));
            } else if (p instanceof LocalDate localDate) {
                stmt.setDate(idx, java.sql.Date.valueOf(localDate));
            } else if (p instanceof LocalDateTime localDateTime) {
                stmt.setTimestamp(idx, Timestamp.valueOf(localDateTime));
            } else if (p instanceof LocalTime localTime) {
                stmt.setTime(idx, Time.valueOf(localTime));
            } else if (p instanceof UUID uuid) {
                stmt.setString(idx, uuid.toString());
            } else if (p instanceof Enum<?> anEnum) {
                stmt.setString(idx, anEnum.name());
            } else {
                // fallback - let JDBC try to handle it
                stmt.setObject(idx, p);
            }
        }
        return stmt;
    }
}
