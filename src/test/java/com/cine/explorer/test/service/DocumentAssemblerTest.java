package com.cine.explorer.test.service;

import com.cine.explorer.model.documents.CastMember;
import com.cine.explorer.model.documents.MovieComplete;
import com.cine.explorer.model.documents.PersonRef;
import com.cine.explorer.model.documents.Rating;
import com.cine.explorer.service.build.DocumentAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cine.explorer.test.Catalog.alphaIndices;
import static com.cine.explorer.test.Catalog.movie;
import static org.assertj.core.api.Assertions.assertThat;

class DocumentAssemblerTest {

    DocumentAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new DocumentAssembler(alphaIndices());
    }

    @Test
    void inlinesEveryAssociationOfTheMovie() {
        MovieComplete doc = assembler.assemble(movie("m1", "Alpha", 2000, 100));

        assertThat(doc.getId()).isEqualTo("m1");
        assertThat(doc.getTitle()).isEqualTo("Alpha");
        assertThat(doc.getYear()).isEqualTo(2000);
        assertThat(doc.getRuntime()).isEqualTo(100);
        assertThat(doc.getRating()).isEqualTo(new Rating(8.5, 1000));
        assertThat(doc.getGenres()).containsExactly("Drama");
        assertThat(doc.getDirectors()).containsExactly(new PersonRef("p2", "B. Director"));
        assertThat(doc.getCast()).containsExactly(new CastMember("p1", "A. Actor", List.of("Hero", "Narrator")));
        assertThat(doc.getWriters()).isEmpty();
    }

    @Test
    void movieWithNoAssociationsGetsDefaultsNotNulls() {
        MovieComplete doc = assembler.assemble(movie("m2", "Beta", 1999, null));

        assertThat(doc.getRuntime()).isNull();
        assertThat(doc.getRating()).isEqualTo(Rating.unrated());
        assertThat(doc.getRating().getAverage()).isNull();
        assertThat(doc.getRating().getVotes()).isZero();
        assertThat(doc.getGenres()).isNotNull().isEmpty();
        assertThat(doc.getDirectors()).isNotNull().isEmpty();
        assertThat(doc.getCast()).isNotNull().isEmpty();
        assertThat(doc.getWriters()).isNotNull().isEmpty();
    }

    @Test
    void assembleAllProducesOneDocumentPerMovieInInputOrder() {
        List<MovieComplete> docs = assembler.assembleAll(List.of(
                movie("m3", "Gamma", 2010, 90),
                movie("m1", "Alpha", 2000, 100),
                movie("m2", "Beta", 1999, null)));

        assertThat(docs).extracting(MovieComplete::getId).containsExactly("m3", "m1", "m2");
    }
}
