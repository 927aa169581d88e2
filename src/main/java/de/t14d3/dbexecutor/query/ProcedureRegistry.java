package de.t14d3.dbexecutor.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves the parameter names of stored procedures, so arguments can be bound by
 * name rather than by the order they happen to be supplied in.
 * <p>
 * Explicitly registered signatures win. Other procedures are looked up through
 * {@link DatabaseMetaData#getProcedureColumns} on every call.
 */
public class ProcedureRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ProcedureRegistry.class);

    private final Map<String, ProcedureSignature> registered = new ConcurrentHashMap<>();

    public ProcedureRegistry register(String procedureName, String... parameterNames) {
        ProcedureSignature signature = new ProcedureSignature(procedureName, Arrays.asList(parameterNames));
        registered.put(key(procedureName), signature);
        LOG.debug("Registered procedure {}", signature);
        return this;
    }

    public boolean isRegistered(String procedureName) {
        return registered.containsKey(key(procedureName));
    }

    /**
     * Returns the registered signature, or the one the database reports.
     *
     * @throws IllegalArgumentException if the database reports no parameters for the procedure
     */
    public ProcedureSignature signatureFor(Connection connection, String procedureName) throws SQLException {
        ProcedureSignature signature = registered.get(key(procedureName));
        if (signature != null) {
            return signature;
        }

        List<String> names = lookup(connection.getMetaData(), procedureName);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Cannot resolve the parameters of procedure " + procedureName
                    + " from database metadata; register its signature to bind arguments by name");
        }
        signature = new ProcedureSignature(procedureName, names);
        LOG.debug("Resolved procedure {} from database metadata", signature);
        return signature;
    }

    private static List<String> lookup(DatabaseMetaData meta, String procedureName) throws SQLException {
        String schema = null;
        String name = unquote(procedureName);
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            schema = unquote(name.substring(0, dot));
            name = unquote(name.substring(dot + 1));
        }

        List<String> names = readParameters(meta, schema, name);
        if (names.isEmpty() && meta.storesUpperCaseIdentifiers()) {
            names = readParameters(meta, upper(schema), upper(name));
        } else if (names.isEmpty() && meta.storesLowerCaseIdentifiers()) {
            names = readParameters(meta, lower(schema), lower(name));
        }
        return names;
    }

    private static List<String> readParameters(DatabaseMetaData meta, String schema, String name) throws SQLException {
        SortedMap<Integer, String> byPosition = new TreeMap<>();
        try (ResultSet rs = meta.getProcedureColumns(null, schema, name, "%")) {
            while (rs.next()) {
                int type = rs.getInt("COLUMN_TYPE");
                if (type == DatabaseMetaData.procedureColumnReturn || type == DatabaseMetaData.procedureColumnResult) {
                    continue;
                }
                byPosition.put(rs.getInt("ORDINAL_POSITION"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(byPosition.values());
    }

    private static String unquote(String identifier) {
        String trimmed = identifier.trim();
        int last = trimmed.length() - 1;
        if (last > 0 && ((trimmed.charAt(0) == '[' && trimmed.charAt(last) == ']')
                || (trimmed.charAt(0) == '"' && trimmed.charAt(last) == '"'))) {
            return trimmed.substring(1, last);
        }
        return trimmed;
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static String key(String procedureName) {
        return unquote(procedureName).toLowerCase(Locale.ROOT);
    }
}
