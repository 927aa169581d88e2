package de.t14d3.dbexecutor.test;

import de.t14d3.dbexecutor.annotations.Id;
import de.t14d3.dbexecutor.annotations.Skip;
import de.t14d3.dbexecutor.exceptions.MappingException;
import de.t14d3.dbexecutor.mapping.EntityMetadata;
import de.t14d3.dbexecutor.mapping.FieldMapping;
import de.t14d3.dbexecutor.mapping.MappedFields;
import de.t14d3.dbexecutor.mapping.Operation;
import de.t14d3.dbexecutor.test.entities.AuditEntry;
import de.t14d3.dbexecutor.test.entities.Driver;
import de.t14d3.dbexecutor.test.entities.Vehicle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EntityMetadataTest {

    static class TwoKeys {
        @Id
        Long first;
        @Id
        Long second;
    }

    static class BaseRecord {
        @Id
        Long id;
        @Skip(Operation.UPDATE)
        String createdBy;
    }

    static class Trip extends BaseRecord {
        static final String KIND = "trip";
        transient String cached;
        String origin;
    }

    static class NoDefaultConstructor {
        final String value;

        NoDefaultConstructor(String value) {
            this.value = value;
        }
    }

    private static List<String> columns(List<FieldMapping> fields) {
        return fields.stream().map(FieldMapping::getColumnName).collect(Collectors.toList());
    }

    @Test
    void testDefaultNames() {
        EntityMetadata md = EntityMetadata.describe(Driver.class);

        assertEquals("Driver", md.getTableName());
        assertEquals(List.of("id", "name", "licenseNumber", "rating", "registeredAt", "displayLabel"), columns(md.getFields()));
        assertEquals("id", md.getIdField().orElseThrow().getName());
    }

    @Test
    void testAnnotatedNames() {
        EntityMetadata md = EntityMetadata.describe(Vehicle.class);

        assertEquals("vehicles", md.getTableName());
        assertEquals(List.of("id", "plate_number", "mileage", "fuelType"), columns(md.getFields()));
    }

    @Test
    void testSkippedFieldsPerOperation() {
        EntityMetadata md = EntityMetadata.describe(Driver.class);

        assertEquals(List.of("name", "licenseNumber", "rating"), columns(md.fieldsFor(Operation.CREATE, true).fields()));
        assertEquals(List.of("id", "name", "licenseNumber", "rating", "registeredAt"),
                columns(md.fieldsFor(Operation.RETRIEVE, false).fields()));
        assertEquals(List.of("name", "licenseNumber", "rating"), columns(md.fieldsFor(Operation.UPDATE, true).fields()));
    }

    @Test
    void testKeyIsReportedWhenExcluded() {
        MappedFields mapped = EntityMetadata.describe(Driver.class).fieldsFor(Operation.UPDATE, true);

        assertTrue(mapped.key().isPresent());
        assertEquals("id", mapped.key().get().getColumnName());
        assertTrue(mapped.fields().stream().noneMatch(FieldMapping::isId));
    }

    @Test
    void testTypeWithoutKey() {
        EntityMetadata md = EntityMetadata.describe(AuditEntry.class);

        assertTrue(md.getIdField().isEmpty());
        assertTrue(md.fieldsFor(Operation.DELETE, false).key().isEmpty());
        assertEquals(2, md.fieldsFor(Operation.CREATE, true).fields().size());
    }

    @Test
    void testMoreThanOneKeyIsRejected() {
        MappingException e = assertThrows(MappingException.class, () -> EntityMetadata.describe(TwoKeys.class));
        assertTrue(e.getMessage().contains("first"), e.getMessage());
        assertTrue(e.getMessage().contains("second"), e.getMessage());
    }

    @Test
    void testInheritedFieldsComeFirst() {
        EntityMetadata md = EntityMetadata.describe(Trip.class);

        assertEquals("Trip", md.getTableName());
        assertEquals(List.of("id", "createdBy", "origin"), columns(md.getFields()));
        assertEquals(List.of("origin"), columns(md.fieldsFor(Operation.UPDATE, true).fields()));
    }

    @Test
    void testFieldAccess() {
        EntityMetadata md = EntityMetadata.describe(Driver.class);
        Driver driver = (Driver) md.newInstance();
        FieldMapping name = md.getFields().get(1);

        name.setValue(driver, "Ada");
        assertEquals("Ada", driver.getName());
        assertEquals("Ada", name.getValue(driver));

        assertThrows(MappingException.class, () -> name.setValue(driver, 42));
    }

    @Test
    void testNewInstanceRequiresParameterlessConstructor() {
        EntityMetadata md = EntityMetadata.describe(NoDefaultConstructor.class);
        assertThrows(MappingException.class, md::newInstance);
    }
}
