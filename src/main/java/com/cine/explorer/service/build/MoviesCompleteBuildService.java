package com.cine.explorer.service.build;

import com.cine.explorer.common.constants.MoviesCompleteProperties;
import com.cine.explorer.common.exception.BuildCancelledException;
import com.cine.explorer.common.exception.BuildFailedException;
import com.cine.explorer.common.exception.BuildInProgressException;
import com.cine.explorer.enums.BuildPhase;
import com.cine.explorer.model.documents.MovieComplete;
import com.cine.explorer.model.dto.BuildReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rebuilds the movies_complete collection from the relational catalog.
 * <p>
 * Phases run strictly one after another: read and index every source relation,
 * assemble one document per movie, bulk load, ensure secondary indexes, publish,
 * verify. One build at a time per process; the destination is assumed to have no
 * other writer while a build runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MoviesCompleteBuildService {

    private final CatalogSnapshotLoader snapshotLoader;
    private final BulkLoader bulkLoader;
    private final SecondaryIndexBuilder indexBuilder;
    private final MongoTemplate mongoTemplate;
    private final MoviesCompleteProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile BuildControl current;
    private volatile BuildReport lastReport;

    /**
     * Runs a full rebuild and returns its summary.
     *
     * @throws BuildInProgressException when another build is running
     * @throws BuildCancelledException  when {@link #cancel()} was called
     * @throws BuildFailedException     on any fatal failure, naming the phase
     */
    public BuildReport build() {
        if (!running.compareAndSet(false, true)) {
            throw new BuildInProgressException("A movies_complete build is already running");
        }
        BuildControl control = new BuildControl();
        current = control;
        long t0 = System.currentTimeMillis();
        try {
            BuildReport report = run(control, t0);
            lastReport = report;
            logSummary(report);
            return report;
        } catch (BuildCancelledException e) {
            log.warn("movies_complete build cancelled: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            BuildPhase phase = control.phase();
            log.error("movies_complete build failed in phase {}: {}", phase, e.getMessage(), e);
            throw new BuildFailedException(phase, e);
        } finally {
            current = null;
            running.set(false);
        }
    }

    /**
     * Requests cancellation of the running build; it stops before its next phase.
     *
     * @return false when no build is running
     */
    public boolean cancel() {
        BuildControl control = current;
        if (control == null) {
            return false;
        }
        control.cancel();
        log.info("Cancellation requested during {}", control.phase());
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<BuildReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    private BuildReport run(BuildControl control, long t0) {
        CatalogSnapshot snapshot = snapshotLoader.load(control);
        SourceIndices indices = snapshot.indices();

        control.enter(BuildPhase.ASSEMBLE_DOCUMENTS);
        List<MovieComplete> documents = new DocumentAssembler(indices).assembleAll(snapshot.movies());
        log.info("Documents assembled: {}", documents.size());

        control.enter(BuildPhase.BULK_LOAD);
        LoadTarget target = bulkLoader.prepare(MovieComplete.COLLECTION, props.getPublishMode());
        BulkLoader.LoadResult load = bulkLoader.write(target, documents);

        control.enter(BuildPhase.SECONDARY_INDEXES);
        SecondaryIndexBuilder.IndexReport indexes = indexBuilder.ensureIndexes(target.collection());

        control.enter(BuildPhase.PUBLISH);
        bulkLoader.publish(target);

        control.enter(BuildPhase.VERIFY);
        long stored = mongoTemplate.count(new Query(), MovieComplete.COLLECTION);
        boolean verified = stored == documents.size();
        if (!verified) {
            log.warn("Verification mismatch on '{}': {} movies read, {} documents stored",
                    MovieComplete.COLLECTION, documents.size(), stored);
        }

        return BuildReport.builder()
                .collection(MovieComplete.COLLECTION)
                .publishMode(target.mode())
                .movies(snapshot.movies().size())
                .documentsWritten(load.written())
                .batches(load.batches())
                .persons(indices.persons().size())
                .moviesWithRating(indices.ratings().keyCount())
                .moviesWithGenres(indices.genres().keyCount())
                .moviesWithDirectors(indices.directors().keyCount())
                .moviesWithCast(indices.cast().movieCount())
                .moviesWithWriters(indices.writers().keyCount())
                .orphanedCharacterRows(indices.cast().orphanedCharacterRows())
                .unresolvedPersonRefs(indices.persons().unresolvedCount())
                .indexesCreated(indexes.created())
                .failedIndexes(indexes.failed())
                .verified(verified)
                .elapsedMs(System.currentTimeMillis() - t0)
                .example(stored == 0 ? null : findExample())
                .build();
    }

    private MovieComplete findExample() {
        Query popular = Query.query(Criteria.where("rating.votes").gt(props.getExampleMinVotes()));
        MovieComplete example = mongoTemplate.findOne(popular, MovieComplete.class, MovieComplete.COLLECTION);
        return example != null ? example : mongoTemplate.findOne(new Query(), MovieComplete.class, MovieComplete.COLLECTION);
    }

    private void logSummary(BuildReport r) {
        log.info("movies_complete build done in {} ms ({} s)", r.elapsedMs(), String.format("%.1f", r.elapsedMs() / 1000.0));
        log.info("  movies={} written={} batches={} verified={}", r.movies(), r.documentsWritten(), r.batches(), r.verified());
        log.info("  persons={} rated={} genres={} directors={} cast={} writers={}",
                r.persons(), r.moviesWithRating(), r.moviesWithGenres(), r.moviesWithDirectors(),
                r.moviesWithCast(), r.moviesWithWriters());
        log.info("  orphanedCharacterRows={} unresolvedPersonRefs={}", r.orphanedCharacterRows(), r.unresolvedPersonRefs());
        if (!r.failedIndexes().isEmpty()) {
            log.warn("  indexes not created: {}", r.failedIndexes());
        }
        if (r.example() != null) {
            MovieComplete ex = r.example();
            log.info("  example: {} '{}' ({}) rating={} genres={} directors={} cast={} writers={}",
                    ex.getId(), ex.getTitle(), ex.getYear(), ex.getRating(), ex.getGenres(),
                    ex.getDirectors().size(), ex.getCast().size(), ex.getWriters().size());
        }
    }
}
