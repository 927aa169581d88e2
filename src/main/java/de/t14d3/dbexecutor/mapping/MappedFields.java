package de.t14d3.dbexecutor.mapping;

import java.util.List;
import java.util.Optional;

/**
 * The fields taking part in one operation, plus the key field if one survived
 * the skip filter. The key is reported even when it was excluded from
 * {@link #fields()}.
 */
public record MappedFields(List<FieldMapping> fields, Optional<FieldMapping> key) {
    public MappedFields {
        fields = List.copyOf(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
