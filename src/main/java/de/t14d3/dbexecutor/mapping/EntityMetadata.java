package de.t14d3.dbexecutor.mapping;

import de.t14d3.dbexecutor.annotations.Column;
import de.t14d3.dbexecutor.annotations.Id;
import de.t14d3.dbexecutor.annotations.Skip;
import de.t14d3.dbexecutor.annotations.Table;
import de.t14d3.dbexecutor.exceptions.MappingException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Holds the mapping between a class and its table, read from the class using reflection.
 * <p>
 * Every non-static, non-transient field is mapped, in declaration order with
 * superclass fields first. The table name is the simple class name unless
 * {@link Table} says otherwise, and each column name is the field name unless
 * {@link Column} says otherwise.
 * <p>
 * Instances are immutable. {@link #describe(Class)} builds a new one on each call;
 * use a {@link MappingRegistry} to build them once.
 */
public class EntityMetadata {
    private final Class<?> entityClass;
    private final String tableName;
    private final List<FieldMapping> fields;
    private final FieldMapping idField;

    private EntityMetadata(Class<?> entityClass) {
        this.entityClass = entityClass;

        Table tableAnnotation = entityClass.getAnnotation(Table.class);
        this.tableName = (tableAnnotation != null) ? tableAnnotation.name() : entityClass.getSimpleName();

        List<FieldMapping> mapped = new ArrayList<>();
        FieldMapping foundIdField = null;

        for (Field field : instanceFields(entityClass)) {
            field.setAccessible(true);

            Column column = field.getAnnotation(Column.class);
            String columnName = (column != null) ? column.name() : field.getName();

            boolean isId = field.isAnnotationPresent(Id.class);
            FieldMapping mapping = new FieldMapping(field, columnName, isId, skipSet(field));

            if (isId) {
                if (foundIdField != null) {
                    throw new MappingException("Type " + entityClass.getName() + " declares more than one @Id field: "
                            + foundIdField.getName() + ", " + field.getName());
                }
                foundIdField = mapping;
            }
            mapped.add(mapping);
        }

        this.fields = Collections.unmodifiableList(mapped);
        this.idField = foundIdField;
    }

    /**
     * Reads the mapping of the given class.
     *
     * @throws MappingException if the class declares more than one {@link Id} field
     */
    public static EntityMetadata describe(Class<?> entityClass) {
        if (entityClass == null) {
            throw new IllegalArgumentException("entityClass must not be null");
        }
        return new EntityMetadata(entityClass);
    }

    public Class<?> getEntityClass() {
        return entityClass;
    }

    public String getTableName() {
        return tableName;
    }

    /**
     * All mapped fields, regardless of skip flags.
     */
    public List<FieldMapping> getFields() {
        return fields;
    }

    public Optional<FieldMapping> getIdField() {
        return Optional.ofNullable(idField);
    }

    /**
     * Selects the fields taking part in an operation.
     * <p>
     * Fields skipped for the operation are dropped first; the key is then looked up
     * among the remaining fields. When {@code excludePrimaryKey} is set the key is
     * removed from the field list but is still returned as {@link MappedFields#key()}.
     */
    public MappedFields fieldsFor(Operation operation, boolean excludePrimaryKey) {
        List<FieldMapping> selected = new ArrayList<>();
        FieldMapping key = null;

        for (FieldMapping field : fields) {
            if (field.isSkippedFor(operation)) continue;

            if (field.isId()) {
                key = field;
                if (excludePrimaryKey) continue;
            }
            selected.add(field);
        }

        return new MappedFields(selected, Optional.ofNullable(key));
    }

    /**
     * Creates a new instance using the parameterless constructor.
     */
    public Object newInstance() {
        Constructor<?> constructor;
        try {
            constructor = entityClass.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new MappingException("Cannot find parameterless constructor for " + entityClass.getName(), e);
        }

        try {
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (ReflectiveOperationException e) {
            throw new MappingException("Cannot instantiate " + entityClass.getName(), e);
        }
    }

    private static List<Field> instanceFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }

        List<Field> result = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                result.add(field);
            }
        }
        return result;
    }

    private static EnumSet<Operation> skipSet(Field field) {
        Skip skip = field.getAnnotation(Skip.class);
        if (skip == null) {
            return EnumSet.noneOf(Operation.class);
        }
        if (skip.value().length == 0) {
            return EnumSet.allOf(Operation.class);
        }
        return EnumSet.copyOf(Arrays.asList(skip.value()));
    }

    @Override
    public String toString() {
        return "EntityMetadata{" + entityClass.getSimpleName() + " -> " + tableName + ", fields=" + fields + "}";
    }
}
