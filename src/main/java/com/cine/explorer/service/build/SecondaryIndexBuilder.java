package com.cine.explorer.service.build;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Ensures the read-side indexes on the destination collection. Creation is
 * idempotent; a failure is logged and reported but never aborts the build,
 * since the committed documents stay valid without it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecondaryIndexBuilder {

    /**
     * genres is an array, so its index is multikey
     */
    public static final List<String> INDEXED_FIELDS = List.of("title", "year", "genres", "rating.average");

    private final MongoTemplate mongoTemplate;

    public IndexReport ensureIndexes(String collection) {
        IndexOperations ops = mongoTemplate.indexOps(collection);
        List<String> created = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String field : INDEXED_FIELDS) {
            try {
                String name = ops.ensureIndex(new Index().on(field, Sort.Direction.ASC));
                created.add(name);
                log.info("Index ensured on '{}': {} ({})", collection, field, name);
            } catch (RuntimeException e) {
                failed.add(field);
                log.warn("Failed to ensure index on '{}.{}': {}", collection, field, e.getMessage());
            }
        }
        return new IndexReport(List.copyOf(created), List.copyOf(failed));
    }

    public record IndexReport(List<String> created, List<String> failed) {
    }
}
