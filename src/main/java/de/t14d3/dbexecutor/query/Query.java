package de.t14d3.dbexecutor.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A generated statement: SQL text (or a procedure name) and its named parameters.
 * <p>
 * For {@link CommandType#TEXT} every {@code :name} marker in the text has exactly
 * one parameter of that name. For {@link CommandType#STORED_PROCEDURE} the text is
 * the procedure name and the parameters are matched to the procedure's declared
 * parameters by name when the call is prepared.
 */
public final class Query {
    private final String sql;
    private final List<Parameter> parameters;
    private final CommandType commandType;

    public Query(String sql, List<Parameter> parameters, CommandType commandType) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("Statement text must not be blank");
        }
        this.sql = sql.trim();
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.commandType = commandType;
    }

    /**
     * Wraps caller-supplied text, detecting whether it names a procedure.
     */
    public static Query of(String procedureNameOrQuery, Parameter... parameters) {
        return new Query(procedureNameOrQuery, List.of(parameters), CommandType.detect(procedureNameOrQuery));
    }

    public static Query text(String sql, List<Parameter> parameters) {
        return new Query(sql, parameters, CommandType.TEXT);
    }

    public static Query procedure(String procedureName, List<Parameter> parameters) {
        if (CommandType.detect(procedureName) != CommandType.STORED_PROCEDURE) {
            throw new IllegalArgumentException("Procedure name must be a single word: " + procedureName);
        }
        return new Query(procedureName, parameters, CommandType.STORED_PROCEDURE);
    }

    /**
     * Get the SQL text, or the procedure name.
     */
    public String getSql() {
        return sql;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<String> getParameterNames() {
        return parameters.stream().map(Parameter::name).collect(Collectors.toList());
    }

    public CommandType getCommandType() {
        return commandType;
    }

    public boolean isProcedure() {
        return commandType == CommandType.STORED_PROCEDURE;
    }

    /**
     * The JDBC call escape for a procedure, one {@code ?} per parameter.
     */
    public String getCallSql() {
        if (!isProcedure()) {
            throw new IllegalStateException("Not a stored procedure call: " + sql);
        }
        String placeholders = parameters.stream().map(p -> "?").collect(Collectors.joining(", "));
        return "{call " + sql + "(" + placeholders + ")}";
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
