package com.cine.explorer.test.service;

import com.cine.explorer.common.exception.BuildCancelledException;
import com.cine.explorer.common.exception.SourceUnavailableException;
import com.cine.explorer.enums.BuildPhase;
import com.cine.explorer.enums.Relation;
import com.cine.explorer.model.documents.Rating;
import com.cine.explorer.model.dto.CharacterRow;
import com.cine.explorer.model.dto.CreditRow;
import com.cine.explorer.model.dto.GenreRow;
import com.cine.explorer.model.dto.MovieRow;
import com.cine.explorer.model.dto.PersonRow;
import com.cine.explorer.model.dto.RatingRow;
import com.cine.explorer.service.build.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.stream.Stream;

import static com.cine.explorer.test.Catalog.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogSnapshotLoaderTest {

    @Mock
    CatalogRelations relations;

    @InjectMocks
    CatalogSnapshotLoader loader;

    @Test
    void readsEveryRelationAndIndexesIt() {
        when(relations.persons()).thenReturn(reader(Relation.PERSONS, person("p1", "A. Actor"), person("p2", "B. Director")));
        when(relations.ratings()).thenReturn(reader(Relation.RATINGS, new RatingRow("m1", 8.5, 1000), new RatingRow("m2", null, null)));
        when(relations.genres()).thenReturn(reader(Relation.GENRES, new GenreRow("m1", "Drama")));
        when(relations.directors()).thenReturn(reader(Relation.DIRECTORS, credit("m1", "p2")));
        when(relations.writers()).thenReturn(reader(Relation.WRITERS, credit("m1", "p9")));
        when(relations.principals()).thenReturn(reader(Relation.PRINCIPALS, credit("m1", "p1")));
        when(relations.characters()).thenReturn(reader(Relation.CHARACTERS, character("m1", "p1", "Hero")));
        when(relations.movies()).thenReturn(reader(Relation.MOVIES, movie("m1", "Alpha", 2000, 100), movie("m2", "Beta", 2001, null)));
        BuildControl control = new BuildControl();

        CatalogSnapshot snapshot = loader.load(control);

        SourceIndices idx = snapshot.indices();
        assertThat(snapshot.movies()).hasSize(2);
        assertThat(idx.persons().size()).isEqualTo(2);
        assertThat(idx.ratings().first("m1")).contains(new Rating(8.5, 1000));
        assertThat(idx.ratings().first("m2")).contains(new Rating(null, 0));
        assertThat(idx.genres().get("m1")).containsExactly("Drama");
        assertThat(idx.directors().get("m1").get(0).getName()).isEqualTo("B. Director");
        assertThat(idx.writers().get("m1").get(0).getName()).isEqualTo("Unknown");
        assertThat(idx.cast().get("m1").get(0).getCharacters()).containsExactly("Hero");
        assertThat(idx.persons().unresolvedCount()).isEqualTo(1);
        assertThat(control.phase()).isEqualTo(BuildPhase.READ_MOVIES);
    }

    @Test
    void unreadableRelationAbortsTheLoad() {
        when(relations.persons()).thenReturn(reader(Relation.PERSONS, person("p1", "A. Actor")));
        when(relations.ratings()).thenReturn(new RelationReader<RatingRow>(Relation.RATINGS, () -> {
            throw new DataAccessResourceFailureException("no such table: RATINGS");
        }));
        BuildControl control = new BuildControl();

        assertThatThrownBy(() -> loader.load(control))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("RATINGS");
        assertThat(control.phase()).isEqualTo(BuildPhase.INDEX_RATINGS);
        verify(relations, never()).movies();
    }

    @Test
    void cancelledBuildReadsNothing() {
        BuildControl control = new BuildControl();
        control.cancel();

        assertThatThrownBy(() -> loader.load(control))
                .isInstanceOf(BuildCancelledException.class);
        verifyNoInteractions(relations);
    }

    @Test
    void emptySourceYieldsEmptySnapshot() {
        when(relations.persons()).thenReturn(reader(Relation.PERSONS, new PersonRow[0]));
        when(relations.ratings()).thenReturn(new RelationReader<RatingRow>(Relation.RATINGS, Stream::empty));
        when(relations.genres()).thenReturn(new RelationReader<GenreRow>(Relation.GENRES, Stream::empty));
        when(relations.directors()).thenReturn(new RelationReader<CreditRow>(Relation.DIRECTORS, Stream::empty));
        when(relations.writers()).thenReturn(new RelationReader<CreditRow>(Relation.WRITERS, Stream::empty));
        when(relations.principals()).thenReturn(new RelationReader<CreditRow>(Relation.PRINCIPALS, Stream::empty));
        when(relations.characters()).thenReturn(new RelationReader<CharacterRow>(Relation.CHARACTERS, Stream::empty));
        when(relations.movies()).thenReturn(new RelationReader<MovieRow>(Relation.MOVIES, Stream::empty));

        CatalogSnapshot snapshot = loader.load(new BuildControl());

        assertThat(snapshot.movies()).isEmpty();
        assertThat(snapshot.indices().cast().movieCount()).isZero();
    }
}
