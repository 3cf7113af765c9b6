package com.cine.explorer.test.service;

import com.cine.explorer.common.constants.MoviesCompleteProperties;
import com.cine.explorer.common.exception.*;
import com.cine.explorer.enums.BuildPhase;
import com.cine.explorer.enums.PublishMode;
import com.cine.explorer.enums.Relation;
import com.cine.explorer.model.documents.MovieComplete;
import com.cine.explorer.model.dto.BuildReport;
import com.cine.explorer.service.build.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.cine.explorer.test.Catalog.alphaIndices;
import static com.cine.explorer.test.Catalog.movie;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MoviesCompleteBuildServiceTest {

    static final String TARGET = MovieComplete.COLLECTION;
    static final LoadTarget IN_PLACE = new LoadTarget(TARGET, TARGET, PublishMode.DROP_AND_REPLACE);

    @Mock
    CatalogSnapshotLoader snapshotLoader;
    @Mock
    BulkLoader bulkLoader;
    @Mock
    SecondaryIndexBuilder indexBuilder;
    @Mock
    MongoTemplate mongoTemplate;

    MoviesCompleteProperties props;
    MoviesCompleteBuildService service;
    CatalogSnapshot snapshot;

    @BeforeEach
    void setUp() {
        props = new MoviesCompleteProperties();
        service = new MoviesCompleteBuildService(snapshotLoader, bulkLoader, indexBuilder, mongoTemplate, props);
        snapshot = new CatalogSnapshot(alphaIndices(), List.of(
                movie("m1", "Alpha", 2000, 100),
                movie("m2", "Beta", 2001, null)));
    }

    @Test
    void buildRunsPhasesInOrderAndReportsCounts() {
        MovieComplete example = MovieComplete.builder().id("m1").title("Alpha").build();
        when(snapshotLoader.load(any(BuildControl.class))).thenReturn(snapshot);
        when(bulkLoader.prepare(TARGET, PublishMode.DROP_AND_REPLACE)).thenReturn(IN_PLACE);
        when(bulkLoader.write(eq(IN_PLACE), anyList())).thenReturn(new BulkLoader.LoadResult(2, 1));
        when(indexBuilder.ensureIndexes(TARGET)).thenReturn(new SecondaryIndexBuilder.IndexReport(
                List.of("title_1", "year_1", "genres_1", "rating.average_1"), List.of()));
        when(mongoTemplate.count(any(Query.class), eq(TARGET))).thenReturn(2L);
        when(mongoTemplate.findOne(any(Query.class), eq(MovieComplete.class), eq(TARGET))).thenReturn(example);

        BuildReport report = service.build();

        InOrder inOrder = inOrder(snapshotLoader, bulkLoader, indexBuilder, mongoTemplate);
        inOrder.verify(snapshotLoader).load(any(BuildControl.class));
        inOrder.verify(bulkLoader).prepare(TARGET, PublishMode.DROP_AND_REPLACE);
        inOrder.verify(bulkLoader).write(eq(IN_PLACE), anyList());
        inOrder.verify(indexBuilder).ensureIndexes(TARGET);
        inOrder.verify(bulkLoader).publish(IN_PLACE);
        inOrder.verify(mongoTemplate).count(any(Query.class), eq(TARGET));

        assertThat(report.movies()).isEqualTo(2);
        assertThat(report.documentsWritten()).isEqualTo(2);
        assertThat(report.verified()).isTrue();
        assertThat(report.persons()).isEqualTo(2);
        assertThat(report.moviesWithRating()).isEqualTo(1);
        assertThat(report.moviesWithGenres()).isEqualTo(1);
        assertThat(report.moviesWithDirectors()).isEqualTo(1);
        assertThat(report.moviesWithCast()).isEqualTo(1);
        assertThat(report.moviesWithWriters()).isZero();
        assertThat(report.failedIndexes()).isEmpty();
        assertThat(report.example()).isSameAs(example);
        assertThat(service.lastReport()).contains(report);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void everyMovieBecomesOneDocumentWithDefaults() {
        when(snapshotLoader.load(any(BuildControl.class))).thenReturn(snapshot);
        when(bulkLoader.prepare(TARGET, PublishMode.DROP_AND_REPLACE)).thenReturn(IN_PLACE);
        when(bulkLoader.write(eq(IN_PLACE), anyList())).thenReturn(new BulkLoader.LoadResult(2, 1));
        when(indexBuilder.ensureIndexes(TARGET)).thenReturn(new SecondaryIndexBuilder.IndexReport(List.of(), List.of()));
        when(mongoTemplate.count(any(Query.class), eq(TARGET))).thenReturn(2L);

        service.build();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<MovieComplete>> docs = ArgumentCaptor.forClass(List.class);
        verify(bulkLoader).write(eq(IN_PLACE), docs.capture());
        assertThat(docs.getValue()).extracting(MovieComplete::getId).containsExactly("m1", "m2");
        MovieComplete beta = docs.getValue().get(1);
        assertThat(beta.getRating().getAverage()).isNull();
        assertThat(beta.getRating().getVotes()).isZero();
        assertThat(beta.getCast()).isEmpty();
    }

    @Test
    void countMismatchIsReportedButNotFatal() {
        when(snapshotLoader.load(any(BuildControl.class))).thenReturn(snapshot);
        when(bulkLoader.prepare(TARGET, PublishMode.DROP_AND_REPLACE)).thenReturn(IN_PLACE);
        when(bulkLoader.write(eq(IN_PLACE), anyList())).thenReturn(new BulkLoader.LoadResult(2, 1));
        when(indexBuilder.ensureIndexes(TARGET)).thenReturn(new SecondaryIndexBuilder.IndexReport(
                List.of("title_1"), List.of("year", "genres", "rating.average")));
        when(mongoTemplate.count(any(Query.class), eq(TARGET))).thenReturn(0L);

        BuildReport report = service.build();

        assertThat(report.verified()).isFalse();
        assertThat(report.failedIndexes()).containsExactly("year", "genres", "rating.average");
        assertThat(report.example()).isNull();
    }

    @Test
    void stagedModeIndexesStagingBeforeTheSwap() {
        props.setPublishMode(PublishMode.STAGED_SWAP);
        LoadTarget staged = new LoadTarget(TARGET, "movies_complete_staging", PublishMode.STAGED_SWAP);
        when(snapshotLoader.load(any(BuildControl.class))).thenReturn(snapshot);
        when(bulkLoader.prepare(TARGET, PublishMode.STAGED_SWAP)).thenReturn(staged);
        when(bulkLoader.write(eq(staged), anyList())).thenReturn(new BulkLoader.LoadResult(2, 1));
        when(indexBuilder.ensureIndexes("movies_complete_staging"))
                .thenReturn(new SecondaryIndexBuilder.IndexReport(List.of(), List.of()));
        when(mongoTemplate.count(any(Query.class), eq(TARGET))).thenReturn(2L);
        when(mongoTemplate.findOne(any(Query.class), eq(MovieComplete.class), eq(TARGET))).thenReturn(null);

        BuildReport report = service.build();

        InOrder inOrder = inOrder(indexBuilder, bulkLoader);
        inOrder.verify(indexBuilder).ensureIndexes("movies_complete_staging");
        inOrder.verify(bulkLoader).publish(staged);
        assertThat(report.publishMode()).isEqualTo(PublishMode.STAGED_SWAP);
        verify(mongoTemplate, times(2)).findOne(any(Query.class), eq(MovieComplete.class), eq(TARGET));
    }

    @Test
    void unreadableSourceFailsBeforeAnyWrite() {
        when(snapshotLoader.load(any(BuildControl.class))).thenAnswer(inv -> {
            BuildControl control = inv.getArgument(0);
            control.enter(BuildPhase.INDEX_GENRES);
            throw new SourceUnavailableException(Relation.GENRES, new DataAccessResourceFailureException("gone"));
        });

        assertThatThrownBy(() -> service.build())
                .isInstanceOf(BuildFailedException.class)
                .hasCauseInstanceOf(SourceUnavailableException.class)
                .satisfies(e -> {
                    BuildFailedException bfe = (BuildFailedException) e;
                    assertThat(bfe.getPhase()).isEqualTo(BuildPhase.INDEX_GENRES);
                    assertThat(bfe.getErrorCode()).isEqualTo("ERR-SRC-001");
                });
        verifyNoInteractions(bulkLoader, indexBuilder);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void failedBatchStopsTheBuildAndNamesBulkLoad() {
        when(snapshotLoader.load(any(BuildControl.class))).thenReturn(snapshot);
        when(bulkLoader.prepare(TARGET, PublishMode.DROP_AND_REPLACE)).thenReturn(IN_PLACE);
        when(bulkLoader.write(eq(IN_PLACE), anyList()))
                .thenThrow(new WriteFailureException(TARGET, 3, new DataAccessResourceFailureException("boom")));

        assertThatThrownBy(() -> service.build())
                .isInstanceOf(BuildFailedException.class)
                .satisfies(e -> assertThat(((BuildFailedException) e).getPhase()).isEqualTo(BuildPhase.BULK_LOAD));
        verifyNoInteractions(indexBuilder);
        verify(bulkLoader, never()).publish(any());
        assertThat(service.lastReport()).isEmpty();
    }

    @Test
    void secondBuildWhileRunningIsRejected() {
        AtomicReference<Throwable> nested = new AtomicReference<>();
        when(snapshotLoader.load(any(BuildControl.class))).thenAnswer(inv -> {
            try {
                service.build();
            } catch (Throwable t) {
                nested.set(t);
            }
            throw new IllegalStateException("stop here");
        });

        assertThatThrownBy(() -> service.build()).isInstanceOf(BuildFailedException.class);
        assertThat(nested.get()).isInstanceOf(BuildInProgressException.class);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void cancellationStopsBeforeTheNextPhase() {
        when(snapshotLoader.load(any(BuildControl.class))).thenAnswer(inv -> {
            assertThat(service.cancel()).isTrue();
            return snapshot;
        });

        assertThatThrownBy(() -> service.build())
                .isInstanceOf(BuildCancelledException.class)
                .satisfies(e -> assertThat(((BuildCancelledException) e).getPhase()).isEqualTo(BuildPhase.ASSEMBLE_DOCUMENTS));
        verifyNoInteractions(bulkLoader, indexBuilder, mongoTemplate);
    }

    @Test
    void cancelWithoutRunningBuildReturnsFalse() {
        assertThat(service.cancel()).isFalse();
    }
}
