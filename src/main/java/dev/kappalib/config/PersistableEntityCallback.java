package dev.kappalib.config;

import dev.kappalib.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Marks entities loaded from the database as existing, so that a later
 * {@code save()} of a profile or comment with its pre-assigned id issues
 * an UPDATE instead of an INSERT.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<Object> {

    @Override
    public Publisher<Object> onAfterConvert(Object entity, SqlIdentifier table) {
        if (entity instanceof NewRecordAware) {
            ((NewRecordAware) entity).setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
