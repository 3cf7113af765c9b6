package com.cine.explorer.service.build;

import com.cine.explorer.enums.BuildPhase;
import com.cine.explorer.model.documents.PersonRef;
import com.cine.explorer.model.documents.Rating;
import com.cine.explorer.model.dto.CreditRow;
import com.cine.explorer.model.dto.GenreRow;
import com.cine.explorer.model.dto.MovieRow;
import com.cine.explorer.model.dto.RatingRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads every source relation once and builds the in-memory indices.
 * Runs in one read-only transaction so the streaming cursors stay open;
 * nothing is written until this returns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogSnapshotLoader {

    private final CatalogRelations relations;

    @Transactional(readOnly = true)
    public CatalogSnapshot load(BuildControl control) {
        control.enter(BuildPhase.LOAD_PERSONS);
        PersonResolver persons = PersonResolver.build(relations.persons());
        log.info("Persons loaded: {}", persons.size());

        control.enter(BuildPhase.INDEX_RATINGS);
        LookupIndex<Rating> ratings = LookupIndex.buildUnique(relations.ratings(), RatingRow::movieId,
                CatalogSnapshotLoader::toRating);
        log.info("Ratings indexed: {} movies", ratings.keyCount());

        control.enter(BuildPhase.INDEX_GENRES);
        LookupIndex<String> genres = LookupIndex.build(relations.genres(), GenreRow::movieId, GenreRow::genre);
        log.info("Genres indexed: {} movies, {} rows", genres.keyCount(), genres.valueCount());

        control.enter(BuildPhase.INDEX_DIRECTORS);
        LookupIndex<PersonRef> directors = LookupIndex.build(relations.directors(), CreditRow::movieId,
                r -> persons.toRef(r.personId()));
        log.info("Directors indexed: {} movies, {} rows", directors.keyCount(), directors.valueCount());

        control.enter(BuildPhase.INDEX_WRITERS);
        LookupIndex<PersonRef> writers = LookupIndex.build(relations.writers(), CreditRow::movieId,
                r -> persons.toRef(r.personId()));
        log.info("Writers indexed: {} movies, {} rows", writers.keyCount(), writers.valueCount());

        control.enter(BuildPhase.ASSEMBLE_CAST);
        CastIndex cast = CastAssembler.assemble(relations.principals(), relations.characters(), persons);
        log.info("Cast assembled: {} movies, {} orphaned character rows dropped",
                cast.movieCount(), cast.orphanedCharacterRows());

        control.enter(BuildPhase.READ_MOVIES);
        List<MovieRow> movies = new ArrayList<>();
        relations.movies().drain(movies::add);
        log.info("Movies read: {}", movies.size());

        return new CatalogSnapshot(new SourceIndices(persons, ratings, genres, directors, writers, cast), movies);
    }

    static Rating toRating(RatingRow row) {
        return new Rating(row.average(), row.votes() == null ? 0 : row.votes());
    }
}
