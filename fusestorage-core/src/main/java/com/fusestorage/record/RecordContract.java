package com.fusestorage.record;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fusestorage.decoder.DirectDecoder;
import com.fusestorage.engine.DatabaseRow;
import com.fusestorage.exception.ConversionFailedException;
import com.fusestorage.exception.FuseStorageException;
import com.fusestorage.model.ColumnDefinition;
import com.fusestorage.model.InferredType;
import com.fusestorage.model.TableDefinition;
import com.fusestorage.util.StructuredText;
import com.fusestorage.util.TypeConverter;
import com.fusestorage.value.StorageValue;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Describes how one entity type maps onto a table: table name, id field, optional schema and an explicit
 * field table.
 *
 * <p>Instances are immutable and safe to share; build one per entity type and keep it in a constant.
 *
 * @param <T> entity type
 */
@Getter
public final class RecordContract<T> {
    private final Class<T> recordType;
    private final String tableName;
    private final String idField;
    @Getter(lombok.AccessLevel.NONE)
    private final TableDefinition tableDefinition;
    private final List<FieldBinding<T>> fields;
    @Getter(lombok.AccessLevel.NONE)
    private final Supplier<T> factory;
    @Getter(lombok.AccessLevel.NONE)
    private final Function<DecodedFields, T> creator;

    private RecordContract(Builder<T> builder) {
        this.recordType = builder.recordType;
        this.tableName = builder.tableName != null
                ? builder.tableName
                : builder.recordType.getSimpleName().toLowerCase(Locale.ROOT);
        this.idField = builder.idField;
        this.tableDefinition = builder.tableDefinition;
        this.fields = Collections.unmodifiableList(new ArrayList<>(builder.fields.values()));
        this.factory = builder.factory;
        this.creator = builder.creator;
    }

    public static <T> Builder<T> builder(Class<T> recordType) {
        return new Builder<>(recordType);
    }

    public Optional<TableDefinition> tableDefinition() {
        return Optional.ofNullable(tableDefinition);
    }

    public FieldBinding<T> field(String name) {
        for (FieldBinding<T> binding : fields) {
            if (binding.getName().equals(name)) {
                return binding;
            }
        }
        throw new IllegalArgumentException("Unknown field '" + name + "' on " + recordType.getName());
    }

    /**
     * Convert a record into column values, in field-table order.
     *
     * <p>Declared columns use their declared type and nullability; fields without a declaration are
     * converted through their inferred type.
     *
     * @param record record
     * @return column name to storage value
     * @throws com.fusestorage.exception.SchemaMismatchException when a value does not fit its column
     */
    public Map<String, StorageValue> toStorageValues(T record) {
        Map<String, StorageValue> out = new LinkedHashMap<>();
        for (FieldBinding<T> binding : fields) {
            out.put(binding.getName(), toStorageValue(binding, binding.read(record)));
        }
        return out;
    }

    /**
     * Storage value of the id field.
     *
     * @param record record
     * @return id value
     */
    public StorageValue idValue(T record) {
        FieldBinding<T> binding = field(idField);
        return toStorageValue(binding, binding.read(record));
    }

    private StorageValue toStorageValue(FieldBinding<T> binding, Object value) {
        Optional<ColumnDefinition> declared = tableDefinition != null
                ? tableDefinition.column(binding.getName())
                : Optional.empty();
        if (declared.isPresent()) {
            ColumnDefinition column = declared.get();
            return TypeConverter.toStorageValue(value, column.getType(), !column.isNotNull());
        }
        InferredType inferred = TypeConverter.inferType(value);
        return TypeConverter.toStorageValue(value, inferred.type(), inferred.optional());
    }

    /**
     * Rebuild a record from a result row.
     *
     * @param row result row
     * @return record
     * @throws ConversionFailedException when any field fails to decode
     */
    public T fromStorage(DatabaseRow row) {
        return build(DirectDecoder.fromRow(row, tableDefinition, true));
    }

    /**
     * Rebuild a record from a flat field map.
     *
     * @param values field values
     * @return record
     * @throws ConversionFailedException when any field fails to decode
     */
    public T fromValues(Map<String, ?> values) {
        return build(DirectDecoder.fromValues(values, tableDefinition, true));
    }

    private T build(DirectDecoder decoder) {
        try {
            return creator != null ? create(decoder) : populate(decoder);
        } catch (ConversionFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConversionFailedException(recordType.getName(), decoder.allKeys(), e);
        }
    }

    private T create(DirectDecoder decoder) {
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (FieldBinding<T> binding : fields) {
            decoded.put(binding.getName(), decodeField(decoder, binding));
        }
        return creator.apply(new DecodedFields(decoded));
    }

    private T populate(DirectDecoder decoder) {
        T instance = factory.get();
        for (FieldBinding<T> binding : fields) {
            if (!binding.isWritable() || (binding.isNullable() && !decoder.contains(binding.getName()))) {
                continue;
            }
            binding.write(instance, decodeField(decoder, binding));
        }
        return instance;
    }

    private Object decodeField(DirectDecoder decoder, FieldBinding<T> binding) {
        if (binding.isNullable()) {
            return decoder.decodeNullable(binding.getName(), binding.getType());
        }
        return decoder.decode(binding.getName(), binding.getType());
    }

    @Override
    public String toString() {
        return "RecordContract(" + recordType.getSimpleName() + " -> " + tableName + ", id=" + idField + ")";
    }

    /**
     * Builder for {@link RecordContract}.
     *
     * @param <T> entity type
     */
    public static final class Builder<T> {
        private final Class<T> recordType;
        private final Map<String, FieldBinding<T>> fields = new LinkedHashMap<>();
        private String tableName;
        private String idField = "id";
        private TableDefinition tableDefinition;
        private Supplier<T> factory;
        private Function<DecodedFields, T> creator;

        private Builder(Class<T> recordType) {
            if (recordType == null) {
                throw new IllegalArgumentException("recordType is required");
            }
            this.recordType = recordType;
        }

        public Builder<T> tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder<T> idField(String idField) {
            this.idField = idField;
            return this;
        }

        public Builder<T> tableDefinition(TableDefinition tableDefinition) {
            this.tableDefinition = tableDefinition;
            return this;
        }

        /**
         * No-arg factory; decoded values are applied through the field setters. Nullable fields whose column
         * is absent from the row keep the value the factory gave them.
         *
         * @param factory instance factory
         * @return this builder
         */
        public Builder<T> factory(Supplier<T> factory) {
            this.factory = factory;
            return this;
        }

        /**
         * Creator for immutable types; receives every field's decoded value.
         *
         * @param creator creator
         * @return this builder
         */
        public Builder<T> creator(Function<DecodedFields, T> creator) {
            this.creator = creator;
            return this;
        }

        public <V> Builder<T> field(String name, Class<V> type, Function<T, V> getter, BiConsumer<T, V> setter) {
            return bind(name, StructuredText.mapper().constructType(type), !type.isPrimitive(), getter, setter);
        }

        public <V> Builder<T> field(String name, TypeReference<V> type, Function<T, V> getter,
                                    BiConsumer<T, V> setter) {
            return bind(name, StructuredText.mapper().constructType(type), true, getter, setter);
        }

        /**
         * Read-only field, for records built with a {@link #creator(Function)}.
         *
         * @param name field name
         * @param type field type
         * @param getter accessor
         * @param <V> field type
         * @return this builder
         */
        public <V> Builder<T> field(String name, Class<V> type, Function<T, V> getter) {
            return field(name, type, getter, null);
        }

        public <V> Builder<T> field(String name, TypeReference<V> type, Function<T, V> getter) {
            return field(name, type, getter, null);
        }

        /**
         * Field that must always have a value; a missing or {@code NULL} column fails the decode.
         *
         * @param name field name
         * @param type field type
         * @param getter accessor
         * @param setter mutator, {@code null} for creator-built records
         * @param <V> field type
         * @return this builder
         */
        public <V> Builder<T> requiredField(String name, Class<V> type, Function<T, V> getter,
                                            BiConsumer<T, V> setter) {
            return bind(name, StructuredText.mapper().constructType(type), false, getter, setter);
        }

        private <V> Builder<T> bind(String name, JavaType type, boolean nullable, Function<T, V> getter,
                                    BiConsumer<T, V> setter) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name is required");
            }
            if (getter == null) {
                throw new IllegalArgumentException("Field '" + name + "' needs a getter");
            }
            if (fields.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate field '" + name + "' on " + recordType.getName());
            }
            fields.put(name, new FieldBinding<>(name, type, nullable, getter, (BiConsumer<T, Object>) setter));
            return this;
        }

        public RecordContract<T> build() {
            if (idField == null || !fields.containsKey(idField)) {
                throw new FuseStorageException(
                        "Id field '" + idField + "' is not in the field table of " + recordType.getName());
            }
            if (factory == null && creator == null) {
                throw new FuseStorageException(
                        "Record contract for " + recordType.getName() + " needs a factory or a creator");
            }
            if (creator == null) {
                for (FieldBinding<T> binding : fields.values()) {
                    if (!binding.isWritable()) {
                        throw new FuseStorageException("Field '" + binding.getName() + "' of "
                                + recordType.getName() + " has no setter and no creator is configured");
                    }
                }
            }
            if (tableName != null && tableName.isBlank()) {
                throw new IllegalArgumentException("Table name must not be blank");
            }
            return new RecordContract<>(this);
        }
    }
}
