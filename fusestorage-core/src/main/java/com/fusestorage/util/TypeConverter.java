package com.fusestorage.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fusestorage.exception.SchemaMismatchException;
import com.fusestorage.model.ColumnType;
import com.fusestorage.model.InferredType;
import com.fusestorage.value.BlobValue;
import com.fusestorage.value.BooleanValue;
import com.fusestorage.value.DateValue;
import com.fusestorage.value.IntegerValue;
import com.fusestorage.value.NullValue;
import com.fusestorage.value.RealValue;
import com.fusestorage.value.StorageValue;
import com.fusestorage.value.StructuredTextValue;
import com.fusestorage.value.TextValue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Base64;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Conversion between host values and {@link StorageValue}s.
 *
 * <p>Writes are strict: a present value that does not fit its declared column is a
 * {@link SchemaMismatchException}. Reads are lenient: a value that cannot be coerced into the target
 * type yields {@code null}, and callers decide whether that is an error.
 */
@Slf4j
public final class TypeConverter {

    private TypeConverter() {
    }

    /**
     * Infer the column type a host value would be stored as.
     *
     * @param value host value, may be {@code null} or an {@link Optional}
     * @return inferred type; absent values are {@code (TEXT, optional)}
     */
    public static InferredType inferType(Object value) {
        if (value instanceof Optional<?> opt) {
            if (opt.isEmpty()) {
                return new InferredType(ColumnType.TEXT, true);
            }
            return new InferredType(inferType(opt.get()).type(), true);
        }
        if (value == null || value instanceof NullValue) {
            return new InferredType(ColumnType.TEXT, true);
        }
        if (value instanceof StorageValue sv) {
            return new InferredType(sv.columnType(), false);
        }
        return new InferredType(inferPresent(value), false);
    }

    private static ColumnType inferPresent(Object value) {
        if (value instanceof CharSequence || value instanceof Character || value instanceof UUID
                || value instanceof Enum<?>) {
            return ColumnType.TEXT;
        }
        if (isIntegral(value) || value instanceof BigInteger) {
            return ColumnType.INTEGER;
        }
        if (value instanceof Double) {
            return ColumnType.DOUBLE;
        }
        if (value instanceof Float) {
            return ColumnType.REAL;
        }
        if (value instanceof BigDecimal) {
            return ColumnType.NUMERIC;
        }
        if (value instanceof Boolean) {
            return ColumnType.BOOLEAN;
        }
        if (isTemporal(value)) {
            return ColumnType.DATE;
        }
        if (value instanceof byte[] || value instanceof ByteBuffer) {
            return ColumnType.BLOB;
        }
        // Containers and any other object are stored as structured text.
        return ColumnType.TEXT;
    }

    /**
     * Convert a host value for a column of the given type.
     *
     * @param hostValue host value, may be {@code null} or an {@link Optional}
     * @param columnType declared or inferred column type
     * @param optional whether the column accepts {@code NULL}
     * @return storage value, {@link NullValue} for an absent optional value
     * @throws SchemaMismatchException when a required value is absent or a value does not fit the column
     */
    public static StorageValue toStorageValue(Object hostValue, ColumnType columnType, boolean optional) {
        Object value = hostValue;
        if (value instanceof Optional<?> opt) {
            value = opt.orElse(null);
        }
        if (value instanceof StorageValue sv) {
            if (columnType == ColumnType.ANY
                    || (sv instanceof StructuredTextValue && columnType == ColumnType.TEXT)) {
                return sv;
            }
            value = sv.asRawValue();
        }
        if (value == null) {
            if (optional) {
                return NullValue.INSTANCE;
            }
            throw SchemaMismatchException.missingValue(columnType);
        }

        StorageValue converted;
        switch (columnType) {
            case TEXT:
                converted = toText(value);
                break;
            case INTEGER:
                converted = toInteger(value);
                break;
            case REAL:
            case DOUBLE:
                converted = value instanceof Number n ? new RealValue(n.doubleValue()) : null;
                break;
            case NUMERIC:
                converted = toNumeric(value);
                break;
            case BOOLEAN:
                converted = value instanceof Boolean b ? new BooleanValue(b) : null;
                break;
            case DATE:
                Instant instant = toInstant(value);
                converted = instant != null ? new DateValue(instant) : null;
                break;
            case BLOB:
                byte[] bytes = toBytes(value);
                converted = bytes != null ? new BlobValue(bytes) : null;
                break;
            default:
                converted = toAny(value);
                break;
        }
        if (converted == null) {
            throw SchemaMismatchException.incompatible(columnType, value);
        }
        return converted;
    }

    private static StorageValue toText(Object value) {
        if (value instanceof CharSequence || value instanceof Character) {
            return new TextValue(value.toString());
        }
        if (value instanceof Enum<?> e) {
            return new TextValue(e.name());
        }
        if (StructuredText.isSequence(value)) {
            return new StructuredTextValue(StructuredText.writeArray(value));
        }
        if (value instanceof Map<?, ?> map) {
            return new StructuredTextValue(StructuredText.writeObject(map));
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof UUID) {
            return new TextValue(value.toString());
        }
        if (isTemporal(value)) {
            Instant instant = toInstant(value);
            return new TextValue(value instanceof LocalDate ? value.toString() : instant.toString());
        }
        if (value instanceof byte[] || value instanceof ByteBuffer) {
            return new TextValue(Base64.getEncoder().encodeToString(toBytes(value)));
        }
        return new StructuredTextValue(StructuredText.writeValue(value));
    }

    private static StorageValue toInteger(Object value) {
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? new IntegerValue(big.longValue()) : null;
        }
        if (isIntegral(value)) {
            return new IntegerValue(((Number) value).longValue());
        }
        return null;
    }

    private static StorageValue toNumeric(Object value) {
        if (isIntegral(value) || value instanceof BigInteger) {
            return toInteger(value);
        }
        if (value instanceof BigDecimal decimal) {
            // a double would drop digits and scale
            return new TextValue(decimal.toPlainString());
        }
        if (value instanceof Number n) {
            return new RealValue(n.doubleValue());
        }
        return null;
    }

    private static StorageValue toAny(Object value) {
        if (value instanceof String s) {
            return new TextValue(s);
        }
        if (isIntegral(value)) {
            StorageValue integer = toInteger(value);
            return integer != null ? integer : new TextValue(value.toString());
        }
        if (value instanceof Double || value instanceof Float) {
            return new RealValue(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return new BooleanValue(b);
        }
        if (isTemporal(value)) {
            return new DateValue(toInstant(value));
        }
        if (value instanceof byte[] || value instanceof ByteBuffer) {
            return new BlobValue(toBytes(value));
        }
        return new TextValue(String.valueOf(value));
    }

    /**
     * Convert a raw column value into the target type.
     *
     * @param raw raw value or {@link StorageValue}, may be {@code null}
     * @param targetType target type; primitives are treated as their wrappers
     * @param autoInfer also accept textual and lossy numeric forms
     * @param <T> target type
     * @return converted value, or {@code null} when absent or not convertible
     */
    public static <T> T fromStorageValue(Object raw, Class<T> targetType, boolean autoInfer) {
        return (T) fromStorageValue(raw, StructuredText.mapper().constructType(targetType), autoInfer);
    }

    /**
     * Convert a raw column value into a generic target type.
     *
     * @param raw raw value or {@link StorageValue}, may be {@code null}
     * @param targetType target type
     * @param autoInfer also accept textual and lossy numeric forms
     * @param <T> target type
     * @return converted value, or {@code null} when absent or not convertible
     */
    public static <T> T fromStorageValue(Object raw, TypeReference<T> targetType, boolean autoInfer) {
        return (T) fromStorageValue(raw, StructuredText.mapper().constructType(targetType), autoInfer);
    }

    /**
     * Convert a raw column value into a Jackson-described target type.
     *
     * @param raw raw value or {@link StorageValue}, may be {@code null}
     * @param targetType target type
     * @param autoInfer also accept textual and lossy numeric forms
     * @return converted value, or {@code null} when absent or not convertible
     */
    public static Object fromStorageValue(Object raw, JavaType targetType, boolean autoInfer) {
        Object value = raw instanceof StorageValue sv ? sv.asRawValue() : raw;
        if (value == null) {
            return null;
        }
        Class<?> target = box(targetType.getRawClass());
        if (target == Object.class) {
            return value;
        }

        Object converted;
        if (isScalarTarget(target)) {
            converted = convertScalar(value, target, autoInfer);
        } else {
            converted = convertStructured(value, targetType);
        }
        if (converted != null) {
            return converted;
        }
        if (target.isInstance(value)) {
            return value;
        }
        log.debug("Value of {} not convertible to {}", value.getClass().getName(), targetType);
        return null;
    }

    /**
     * Whether values of this class are converted directly rather than decoded from structured text.
     *
     * @param type target class
     * @return true for scalar targets
     */
    public static boolean isScalarTarget(Class<?> type) {
        Class<?> target = box(type);
        return target == Boolean.class || target == String.class || target == Character.class
                || target == Long.class || target == Integer.class || target == Short.class || target == Byte.class
                || target == Double.class || target == Float.class
                || target == BigDecimal.class || target == BigInteger.class
                || target == UUID.class || target.isEnum()
                || target == byte[].class || target == ByteBuffer.class
                || isTemporalTarget(target);
    }

    /**
     * Natural Java value for a column type: Long, Double, Boolean, Instant, byte[] or String.
     *
     * @param raw raw value
     * @param columnType column type
     * @return converted value, {@code null} when absent or not convertible
     */
    public static Object naturalValue(Object raw, ColumnType columnType) {
        Object value = raw instanceof StorageValue sv ? sv.asRawValue() : raw;
        if (value == null) {
            return null;
        }
        switch (columnType) {
            case INTEGER:
                return convertScalar(value, Long.class, true);
            case REAL:
            case DOUBLE:
                return convertScalar(value, Double.class, true);
            case NUMERIC:
                Long whole = toLong(value, false);
                return whole != null ? whole : convertScalar(value, Double.class, true);
            case BOOLEAN:
                return convertScalar(value, Boolean.class, true);
            case DATE:
                return convertScalar(value, Instant.class, true);
            case BLOB:
                return convertScalar(value, byte[].class, false);
            case TEXT:
                return value instanceof String ? value : convertScalar(value, String.class, true);
            default:
                return value;
        }
    }

    private static Object convertScalar(Object value, Class<?> target, boolean autoInfer) {
        if (target == Boolean.class) {
            return toBoolean(value);
        }
        if (target == String.class) {
            if (value instanceof String) {
                return value;
            }
            if (value instanceof byte[] bytes) {
                return autoInfer ? new String(bytes, StandardCharsets.UTF_8) : null;
            }
            return autoInfer ? String.valueOf(value) : null;
        }
        if (target == Character.class) {
            return value instanceof String s && s.length() == 1 ? s.charAt(0) : null;
        }
        if (target == Long.class || target == Integer.class || target == Short.class || target == Byte.class) {
            return narrow(toLong(value, autoInfer), target);
        }
        if (target == BigInteger.class) {
            Long l = toLong(value, true);
            if (l != null) {
                return BigInteger.valueOf(l);
            }
            return value instanceof BigInteger ? value : null;
        }
        if (target == Double.class || target == Float.class) {
            Double d = toDouble(value, autoInfer);
            if (d == null) {
                return null;
            }
            return target == Float.class ? (Object) d.floatValue() : d;
        }
        if (target == BigDecimal.class) {
            return toBigDecimal(value);
        }
        if (target == UUID.class) {
            return parseUuid(value);
        }
        if (target.isEnum()) {
            return toEnum(value, target);
        }
        if (target == byte[].class || target == ByteBuffer.class) {
            byte[] bytes = bytesFromRaw(value, autoInfer);
            if (bytes == null) {
                return null;
            }
            return target == ByteBuffer.class ? ByteBuffer.wrap(bytes) : bytes;
        }
        if (isTemporalTarget(target)) {
            Instant instant = toInstant(value);
            if (instant == null && value instanceof String s) {
                instant = StorageDates.parse(s);
            }
            if (instant == null && value instanceof Number n) {
                instant = StorageDates.fromEpochSeconds(n);
            }
            return instant != null ? fromInstant(instant, target) : null;
        }
        return null;
    }

    private static Object convertStructured(Object value, JavaType targetType) {
        String text = null;
        if (value instanceof String s) {
            text = s;
        } else if (value instanceof byte[] bytes) {
            text = new String(bytes, StandardCharsets.UTF_8);
        }
        if (text == null) {
            return null;
        }
        return StructuredText.read(text, targetType);
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (isIntegral(value)) {
            return ((Number) value).longValue() != 0L;
        }
        if (value instanceof BigInteger big) {
            return big.signum() != 0;
        }
        if (value instanceof String s) {
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "0":
                    return Boolean.FALSE;
                default:
                    return null;
            }
        }
        return null;
    }

    private static Long toLong(Object value, boolean autoInfer) {
        if (isIntegral(value)) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE ? big.longValue() : null;
        }
        if (!autoInfer) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? wholeLong(new BigDecimal(value.toString())) : null;
        }
        if (value instanceof BigDecimal decimal) {
            return wholeLong(decimal);
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                BigDecimal decimal = parseDecimal(s);
                return decimal != null ? wholeLong(decimal) : null;
            }
        }
        return null;
    }

    private static Object narrow(Long value, Class<?> target) {
        if (value == null) {
            return null;
        }
        long v = value;
        if (target == Integer.class) {
            return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE ? (Object) (int) v : null;
        }
        if (target == Short.class) {
            return v >= Short.MIN_VALUE && v <= Short.MAX_VALUE ? (Object) (short) v : null;
        }
        if (target == Byte.class) {
            return v >= Byte.MIN_VALUE && v <= Byte.MAX_VALUE ? (Object) (byte) v : null;
        }
        return value;
    }

    private static Double toDouble(Object value, boolean autoInfer) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (autoInfer && value instanceof String s) {
            BigDecimal decimal = parseDecimal(s);
            return decimal != null ? decimal.doubleValue() : null;
        }
        return null;
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal d) {
            return d;
        }
        if (value instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (isIntegral(value)) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? new BigDecimal(value.toString()) : null;
        }
        if (value instanceof String s) {
            return parseDecimal(s);
        }
        return null;
    }

    private static BigDecimal parseDecimal(String s) {
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long wholeLong(BigDecimal decimal) {
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static UUID parseUuid(Object value) {
        if (value instanceof UUID u) {
            return u;
        }
        if (!(value instanceof String s)) {
            return null;
        }
        try {
            return UUID.fromString(s.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Object toEnum(Object value, Class<?> target) {
        if (target.isInstance(value)) {
            return value;
        }
        if (!(value instanceof String s)) {
            return null;
        }
        for (Object constant : target.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(s)) {
                return constant;
            }
        }
        // Constants renamed through @JsonProperty / @JsonValue.
        return StructuredText.read(StructuredText.writeValue(s), StructuredText.mapper().constructType(target));
    }

    private static byte[] bytesFromRaw(Object value, boolean autoInfer) {
        byte[] bytes = toBytes(value);
        if (bytes != null) {
            return bytes;
        }
        if (value instanceof String s) {
            if (!autoInfer) {
                return s.getBytes(StandardCharsets.UTF_8);
            }
            try {
                return Base64.getDecoder().decode(s);
            } catch (IllegalArgumentException e) {
                return s.getBytes(StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static byte[] toBytes(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        if (value instanceof ByteBuffer buffer) {
            ByteBuffer view = buffer.duplicate();
            byte[] out = new byte[view.remaining()];
            view.get(out);
            return out;
        }
        return null;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant i) {
            return i;
        }
        if (value instanceof Date d) {
            // java.sql.Date does not support toInstant()
            return Instant.ofEpochMilli(d.getTime());
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate ld) {
            return ld.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return null;
    }

    private static Object fromInstant(Instant instant, Class<?> target) {
        if (target == Instant.class) {
            return instant;
        }
        try {
            return fromInstantChecked(instant, target);
        } catch (DateTimeException | ArithmeticException e) {
            // instant outside the target type's range
            return null;
        }
    }

    private static Object fromInstantChecked(Instant instant, Class<?> target) {
        if (target == Date.class) {
            return new Date(instant.toEpochMilli());
        }
        if (target == LocalDateTime.class) {
            return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (target == LocalDate.class) {
            return LocalDate.ofInstant(instant, ZoneOffset.UTC);
        }
        if (target == OffsetDateTime.class) {
            return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        if (target == ZonedDateTime.class) {
            return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC);
        }
        return null;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
                || value instanceof AtomicInteger || value instanceof AtomicLong;
    }

    private static boolean isTemporal(Object value) {
        return value instanceof Instant || value instanceof Date || value instanceof LocalDateTime
                || value instanceof LocalDate || value instanceof OffsetDateTime || value instanceof ZonedDateTime;
    }

    private static boolean isTemporalTarget(Class<?> target) {
        return target == Instant.class || target == Date.class || target == LocalDateTime.class
                || target == LocalDate.class || target == OffsetDateTime.class || target == ZonedDateTime.class;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == char.class) {
            return Character.class;
        }
        return type;
    }
}
