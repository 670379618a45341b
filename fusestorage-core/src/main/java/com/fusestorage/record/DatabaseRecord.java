package com.fusestorage.record;

/**
 * Implemented by entities stored through a {@link RecordContract}.
 *
 * @param <T> the entity type itself
 */
public interface DatabaseRecord<T extends DatabaseRecord<T>> {
    RecordContract<T> contract();
}
