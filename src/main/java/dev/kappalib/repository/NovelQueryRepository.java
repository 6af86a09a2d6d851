package dev.kappalib.repository;

import dev.kappalib.entity.Novel;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Catalog listing and trigram search. Sort keys map onto a fixed set of ORDER BY
 * clauses; request input never reaches the SQL text.
 */
@Repository
@RequiredArgsConstructor
public class NovelQueryRepository {

    public static final String DEFAULT_SORT = "oldest";

    private static final Map<String, String> ORDER_BY = Map.of(
            "newest", "ORDER BY year_start DESC, title ASC",
            "oldest", "ORDER BY year_start ASC, title ASC",
            "large", "ORDER BY chapters_count DESC, title ASC",
            "small", "ORDER BY chapters_count ASC, title ASC",
            "alphabet", "ORDER BY regexp_replace(lower(title), '[^а-яё]', '', 'g') ASC",
            "created", "ORDER BY created_at DESC"
    );

    private static final String NOVEL_COLUMNS =
            "id, title, title_en, author, year_start, year_end, status, description, " +
            "age_rating, cover_url, chapters_count, created_at";

    private static final String SEARCH =
            "WITH norm_query AS (" +
            "  SELECT lower(regexp_replace(:query, '[^[:alnum:]]', '', 'g')) AS q" +
            ") " +
            "SELECT n.id, n.title, n.title_en, n.author, n.year_start, n.year_end, n.status, " +
            "n.description, n.age_rating, n.cover_url, n.chapters_count, n.created_at, " +
            "((word_similarity(nq.q, n.title_norm) * 2.5) + " +
            " (word_similarity(nq.q, n.title_en_norm) * 2.0) + " +
            " (similarity(n.author_norm, nq.q) * 1.0)) AS relevance " +
            "FROM novels n, norm_query nq " +
            "WHERE (nq.q <% n.title_norm) OR (nq.q <% n.title_en_norm) OR (n.author_norm % nq.q) " +
            "ORDER BY relevance DESC, n.created_at DESC " +
            "LIMIT :limit";

    private final R2dbcEntityTemplate r2dbcTemplate;

    /**
     * @return the sort key itself when it is known, otherwise {@link #DEFAULT_SORT}
     */
    public static String normalizeSort(String sort) {
        return sort != null && ORDER_BY.containsKey(sort) ? sort : DEFAULT_SORT;
    }

    public Flux<Novel> findPage(String sort, int limit, int offset) {
        String sql = "SELECT " + NOVEL_COLUMNS + " FROM novels " + ORDER_BY.get(normalizeSort(sort))
                + " LIMIT :limit OFFSET :offset";
        return r2dbcTemplate.getDatabaseClient()
                .sql(sql)
                .bind("limit", limit)
                .bind("offset", offset)
                .map((row, meta) -> r2dbcTemplate.getConverter().read(Novel.class, row, meta))
                .all();
    }

    public Flux<Novel> search(String query, int limit) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(SEARCH)
                .bind("query", query)
                .bind("limit", limit)
                .map((row, meta) -> r2dbcTemplate.getConverter().read(Novel.class, row, meta))
                .all();
    }
}
