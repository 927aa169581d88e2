package de.t14d3.dbexecutor.test;

import de.t14d3.dbexecutor.exceptions.MappingException;
import de.t14d3.dbexecutor.mapping.TypeMapper;
import de.t14d3.dbexecutor.test.entities.Vehicle;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class TypeMapperTest {

    @Test
    void testNumbersAreNarrowedAndWidened() {
        assertEquals(42L, TypeMapper.convertToJavaType(42, Long.class));
        assertEquals(42, TypeMapper.convertToJavaType(42L, int.class));
        assertEquals(1.5, TypeMapper.convertToJavaType(new BigDecimal("1.5"), double.class));
        assertEquals(new BigDecimal("12345678901234567890"),
                TypeMapper.convertToJavaType(new BigInteger("12345678901234567890"), BigDecimal.class));
    }

    @Test
    void testTemporalValues() {
        LocalDateTime noon = LocalDateTime.of(2024, 3, 1, 12, 0);

        assertEquals(noon, TypeMapper.convertToJavaType(Timestamp.valueOf(noon), LocalDateTime.class));
        assertEquals(LocalDate.of(2024, 3, 1), TypeMapper.convertToJavaType(Timestamp.valueOf(noon), LocalDate.class));
    }

    @Test
    void testTextBackedValues() {
        UUID id = UUID.randomUUID();

        assertEquals(id, TypeMapper.convertToJavaType(id.toString(), UUID.class));
        assertEquals(Vehicle.FuelType.PETROL, TypeMapper.convertToJavaType("PETROL", Vehicle.FuelType.class));
        assertEquals(Boolean.TRUE, TypeMapper.convertToJavaType(1, boolean.class));
        assertEquals("7", TypeMapper.convertToJavaType(7, String.class));
        assertThrows(MappingException.class, () -> TypeMapper.convertToJavaType("HYDROGEN", Vehicle.FuelType.class));
    }

    @Test
    void testNullAndUnknownTypesPassThrough() {
        Object value = new Object();

        assertNull(TypeMapper.convertToJavaType(null, String.class));
        assertSame(value, TypeMapper.convertToJavaType(value, Object.class));
        assertSame(value, TypeMapper.convertToJavaType(value, Runnable.class));
    }
}
