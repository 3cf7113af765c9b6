package com.cine.explorer.service.build;

import com.cine.explorer.common.constants.MoviesCompleteProperties;
import com.cine.explorer.common.exception.WriteFailureException;
import com.cine.explorer.enums.PublishMode;
import com.cine.explorer.model.documents.MovieComplete;
import com.mongodb.MongoException;
import com.mongodb.MongoNamespace;
import com.mongodb.client.model.RenameCollectionOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Replaces the contents of the destination collection with freshly assembled documents.
 * <p>
 * {@link PublishMode#DROP_AND_REPLACE}: the target is dropped and refilled in place, so a
 * crash mid-load leaves it empty or partial. {@link PublishMode#STAGED_SWAP}: batches go to
 * {@code <target>_staging}, which {@link #publish(LoadTarget)} renames over the target.
 * <p>
 * Batches are written in input order. A failed batch aborts the load; earlier batches
 * stay committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BulkLoader {

    public static final String STAGING_SUFFIX = "_staging";

    private final MongoTemplate mongoTemplate;
    private final MoviesCompleteProperties props;

    /**
     * Drops (and recreates empty) the collection the batches will go to.
     */
    public LoadTarget prepare(String target, PublishMode mode) {
        String collection = mode == PublishMode.STAGED_SWAP ? target + STAGING_SUFFIX : target;
        try {
            mongoTemplate.dropCollection(collection);
            mongoTemplate.createCollection(collection);
        } catch (DataAccessException | MongoException e) {
            throw new WriteFailureException("Could not reset collection '" + collection + "': " + e.getMessage(), e);
        }
        log.info("Collection '{}' dropped and recreated ({})", collection, mode);
        return new LoadTarget(target, collection, mode);
    }

    public LoadResult write(LoadTarget target, List<MovieComplete> documents) {
        int batchSize = props.getBatchSize();
        int progressEvery = props.getProgressEveryBatches();
        int total = documents.size();
        int batches = 0;
        long written = 0;

        for (int from = 0; from < total; from += batchSize) {
            List<MovieComplete> batch = documents.subList(from, Math.min(from + batchSize, total));
            batches++;
            try {
                mongoTemplate.insert(batch, target.collection());
            } catch (DataAccessException | MongoException e) {
                log.error("Batch {} into '{}' failed after {} documents were committed",
                        batches, target.collection(), written);
                throw new WriteFailureException(target.collection(), batches, e);
            }
            written += batch.size();
            if (batches % progressEvery == 0) {
                log.info("Inserted {}/{} documents ({} batches)", written, total, batches);
            }
        }
        log.info("Inserted {} documents into '{}' in {} batches", written, target.collection(), batches);
        return new LoadResult(written, batches);
    }

    /**
     * Makes the loaded collection visible under the target name. No-op for in-place loads.
     */
    public void publish(LoadTarget target) {
        if (target.mode() != PublishMode.STAGED_SWAP) {
            return;
        }
        try {
            MongoNamespace into = new MongoNamespace(mongoTemplate.getDb().getName(), target.target());
            mongoTemplate.getCollection(target.collection())
                    .renameCollection(into, new RenameCollectionOptions().dropTarget(true));
        } catch (DataAccessException | MongoException e) {
            throw new WriteFailureException("Could not swap '" + target.collection() + "' into '"
                    + target.target() + "': " + e.getMessage(), e);
        }
        log.info("Swapped '{}' into '{}'", target.collection(), target.target());
    }

    public record LoadResult(long written, int batches) {
    }
}
