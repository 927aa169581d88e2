package de.t14d3.dbexecutor.query;

import de.t14d3.dbexecutor.exceptions.MappingException;
import de.t14d3.dbexecutor.mapping.EntityMetadata;
import de.t14d3.dbexecutor.mapping.FieldMapping;
import de.t14d3.dbexecutor.mapping.MappedFields;
import de.t14d3.dbexecutor.mapping.Operation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the CRUD statements for a mapped type.
 * <p>
 * Every value is passed as a named parameter named after its field, suffixed with
 * {@code _i} for the i-th row of a multi-row insert. Column names only appear in
 * column lists, so they may be quoted identifiers.
 */
public final class QueryGenerator {

    private QueryGenerator() {
    }

    /**
     * One INSERT per instance. The key column is left to the database.
     *
     * @throws IllegalArgumentException if {@code instances} is null or empty
     * @throws MappingException         if no field is mapped for {@link Operation#CREATE}
     */
    public static QueryBatch insert(EntityMetadata md, Collection<?> instances) {
        if (instances == null || instances.isEmpty()) {
            throw new IllegalArgumentException("Nothing to insert into " + md.getTableName());
        }

        List<FieldMapping> fields = md.fieldsFor(Operation.CREATE, true).fields();
        if (fields.isEmpty()) {
            throw new MappingException("No columns to insert for " + md.getEntityClass().getName());
        }

        String columnList = fields.stream().map(FieldMapping::getColumnName).collect(Collectors.joining(", "));

        List<Query> queries = new ArrayList<>(instances.size());
        int row = 1;
        for (Object instance : instances) {
            if (instance == null) {
                throw new IllegalArgumentException("Cannot insert a null instance (row " + row + ")");
            }

            List<Parameter> params = new ArrayList<>(fields.size());
            for (FieldMapping field : fields) {
                params.add(Parameter.of(field.getName() + "_" + row, field.getValue(instance)));
            }

            String paramList = params.stream().map(p -> ":" + p.name()).collect(Collectors.joining(", "));
            String sql = String.format("INSERT INTO %s(%s) VALUES (%s)", md.getTableName(), columnList, paramList);
            queries.add(Query.text(sql, params));
            row++;
        }
        return new QueryBatch(queries);
    }

    public static Query selectAll(EntityMetadata md) {
        return Query.text("SELECT * FROM " + md.getTableName(), List.of());
    }

    /**
     * {@code UPDATE T SET c = :c, ... WHERE key = :key}, covering every non-key
     * field that is not skipped for {@link Operation#UPDATE}.
     *
     * @throws MappingException if the type has no key, or nothing to set
     */
    public static Query update(EntityMetadata md, Object instance) {
        MappedFields mapped = md.fieldsFor(Operation.UPDATE, true);
        FieldMapping key = requireKey(md, mapped, Operation.UPDATE);

        if (mapped.isEmpty()) {
            throw new MappingException("No columns to update for " + md.getEntityClass().getName());
        }

        List<Parameter> params = new ArrayList<>();
        List<String> assignments = new ArrayList<>();
        for (FieldMapping field : mapped.fields()) {
            assignments.add(equate(field));
            params.add(Parameter.of(field.getName(), field.getValue(instance)));
        }
        params.add(Parameter.of(key.getName(), key.getValue(instance)));

        String sql = String.format("UPDATE %s SET %s WHERE %s",
                md.getTableName(), String.join(", ", assignments), equate(key));
        return Query.text(sql, params);
    }

    /**
     * {@code DELETE FROM T WHERE key = :key}.
     *
     * @throws MappingException if the type has no key
     */
    public static Query delete(EntityMetadata md, Object instance) {
        FieldMapping key = requireKey(md, md.fieldsFor(Operation.DELETE, false), Operation.DELETE);

        String sql = String.format("DELETE FROM %s WHERE %s", md.getTableName(), equate(key));
        return Query.text(sql, List.of(Parameter.of(key.getName(), key.getValue(instance))));
    }

    /**
     * Reads a lookup table as (Name, Value) rows.
     */
    public static Query enumeration(String table, String nameColumn, String valueColumn) {
        requireIdentifier(table, "table");
        requireIdentifier(nameColumn, "nameColumn");
        requireIdentifier(valueColumn, "valueColumn");

        String sql = String.format("SELECT %s AS \"Value\", %s AS \"Name\" FROM %s", valueColumn, nameColumn, table);
        return Query.text(sql, List.of());
    }

    /**
     * A stored procedure call whose arguments come from a parameter bag: {@code null}
     * for none, a {@link Map} of name to value, or any object whose fields are bound
     * by name.
     */
    public static Query procedure(String procedureName, Object parameterBag) {
        List<Parameter> params = new ArrayList<>();

        if (parameterBag instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                params.add(Parameter.of(String.valueOf(entry.getKey()), entry.getValue()));
            }
        } else if (parameterBag != null) {
            EntityMetadata md = EntityMetadata.describe(parameterBag.getClass());
            for (FieldMapping field : md.getFields()) {
                params.add(Parameter.of(field.getColumnName(), field.getValue(parameterBag)));
            }
        }

        return Query.procedure(procedureName, params);
    }

    private static FieldMapping requireKey(EntityMetadata md, MappedFields mapped, Operation operation) {
        return mapped.key().orElseThrow(() -> new MappingException(
                "Cannot " + operation.name().toLowerCase() + " " + md.getEntityClass().getName()
                        + ": no @Id field is mapped for " + operation));
    }

    private static String equate(FieldMapping field) {
        return field.getColumnName() + " = :" + field.getName();
    }

    private static void requireIdentifier(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
    }
}
