package dev.kappalib.entity;

/**
 * Marker interface for entities that track their persistence state
 * via a {@code newRecord} flag. Entities with application-assigned ids
 * implement this together with {@link org.springframework.data.domain.Persistable}
 * so {@link dev.kappalib.config.PersistableEntityCallback} can flip the flag
 * after a row is loaded.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
