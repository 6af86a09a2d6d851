package dev.kappalib.repository;

import dev.kappalib.dto.SitemapItem;
import dev.kappalib.entity.Novel;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface NovelRepository extends ReactiveCrudRepository<Novel, String> {

    @Query("SELECT id, created_at FROM novels ORDER BY created_at DESC")
    Flux<SitemapItem> findSitemapItems();
}
