package de.t14d3.dbexecutor.mapping;

import de.t14d3.dbexecutor.exceptions.MappingException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Converts values read from JDBC result sets to the Java type of the field they
 * are assigned to.
 */
public class TypeMapper {

    private TypeMapper() {
    }

    /**
     * Convert a database value to the target Java type.
     * Handles type coercion where appropriate (e.g., Number -> int, long, float, double).
     */
    public static Object convertToJavaType(Object value, Class<?> targetType) {
        if (value == null) return null;
        if (targetType == Object.class) return value;

        if (targetType == Long.class || targetType == long.class) {
            if (value instanceof Number) return ((Number) value).longValue();
        } else if (targetType == Integer.class || targetType == int.class) {
            if (value instanceof Number) return ((Number) value).intValue();
        } else if (targetType == Double.class || targetType == double.class) {
            if (value instanceof Number) return ((Number) value).doubleValue();
        } else if (targetType == Float.class || targetType == float.class) {
            if (value instanceof Number) return ((Number) value).floatValue();
        } else if (targetType == Short.class || targetType == short.class) {
            if (value instanceof Number) return ((Number) value).shortValue();
        } else if (targetType == Byte.class || targetType == byte.class) {
            if (value instanceof Number) return ((Number) value).byteValue();
        } else if (targetType == UUID.class) {
            if (value instanceof String) {
                return UUID.fromString((String) value);
            }
        } else if (targetType == String.class) {
            if (value instanceof Clob) {
                return readClob((Clob) value);
            }
            return value.toString();
        } else if (targetType == Boolean.class || targetType == boolean.class) {
            if (value instanceof Boolean) return value;
            if (value instanceof Number) return ((Number) value).intValue() != 0;
            return Boolean.parseBoolean(value.toString());
        } else if (targetType == java.util.Date.class) {
            if (value instanceof java.util.Date) {
                return new java.util.Date(((java.util.Date) value).getTime());
            } else if (value instanceof LocalDateTime) {
                return java.util.Date.from(((LocalDateTime) value).atZone(ZoneId.systemDefault()).toInstant());
            }
        } else if (targetType == LocalDate.class) {
            if (value instanceof java.sql.Date) {
                return ((java.sql.Date) value).toLocalDate();
            } else if (value instanceof Timestamp) {
                return ((Timestamp) value).toLocalDateTime().toLocalDate();
            } else if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).toLocalDate();
            }
        } else if (targetType == LocalDateTime.class) {
            if (value instanceof Timestamp) {
                return ((Timestamp) value).toLocalDateTime();
            } else if (value instanceof java.sql.Date) {
                return ((java.sql.Date) value).toLocalDate().atStartOfDay();
            } else if (value instanceof OffsetDateTime) {
                return ((OffsetDateTime) value).toLocalDateTime();
            }
        } else if (targetType == LocalTime.class) {
            if (value instanceof Time) {
                return ((Time) value).toLocalTime();
            }
        } else if (targetType == Instant.class) {
            if (value instanceof Timestamp) {
                return ((Timestamp) value).toInstant();
            } else if (value instanceof OffsetDateTime) {
                return ((OffsetDateTime) value).toInstant();
            }
        } else if (targetType == BigDecimal.class) {
            if (value instanceof BigInteger) {
                return new BigDecimal((BigInteger) value);
            } else if (value instanceof Number) {
                return new BigDecimal(value.toString());
            } else if (value instanceof String) {
                return new BigDecimal((String) value);
            }
        } else if (targetType == byte[].class) {
            if (value instanceof Blob) {
                Blob blob = (Blob) value;
                try {
                    return blob.getBytes(1, (int) blob.length());
                } catch (SQLException e) {
                    throw new MappingException("Failed to read blob", e);
                }
            }
        } else if (targetType.isEnum()) {
            if (value instanceof String) {
                return toEnum(targetType, (String) value);
            }
        }

        // For types we don't explicitly handle, return as-is and let the
        // field assignment succeed or fail.
        return value;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object toEnum(Class<?> enumType, String name) {
        try {
            return Enum.valueOf((Class<? extends Enum>) enumType, name);
        } catch (IllegalArgumentException e) {
            throw new MappingException("No constant " + name + " in enum " + enumType.getName(), e);
        }
    }

    private static String readClob(Clob clob) {
        try {
            return clob.getSubString(1, (int) clob.length());
        } catch (SQLException e) {
            throw new MappingException("Failed to read clob", e);
        }
    }
}
