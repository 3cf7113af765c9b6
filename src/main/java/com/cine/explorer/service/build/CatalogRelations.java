package com.cine.explorer.service.build;

import com.cine.explorer.enums.Relation;
import com.cine.explorer.model.dto.*;
import com.cine.explorer.repo.catalog.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Relation readers over the JPA catalog repositories.
 * Draining any of them requires an open transaction.
 */
@Component
@RequiredArgsConstructor
public class CatalogRelations {

    private final MovieRepository movies;
    private final RatingRepository ratings;
    private final GenreRepository genres;
    private final PersonRepository persons;
    private final DirectorRepository directors;
    private final WriterRepository writers;
    private final PrincipalRepository principals;
    private final CharacterRepository characters;

    public RelationReader<MovieRow> movies() {
        return new RelationReader<>(Relation.MOVIES, movies::streamRows);
    }

    public RelationReader<RatingRow> ratings() {
        return new RelationReader<>(Relation.RATINGS, ratings::streamRows);
    }

    public RelationReader<GenreRow> genres() {
        return new RelationReader<>(Relation.GENRES, genres::streamRows);
    }

    public RelationReader<PersonRow> persons() {
        return new RelationReader<>(Relation.PERSONS, persons::streamRows);
    }

    public RelationReader<CreditRow> directors() {
        return new RelationReader<>(Relation.DIRECTORS, directors::streamRows);
    }

    public RelationReader<CreditRow> writers() {
        return new RelationReader<>(Relation.WRITERS, writers::streamRows);
    }

    public RelationReader<CreditRow> principals() {
        return new RelationReader<>(Relation.PRINCIPALS, principals::streamRows);
    }

    public RelationReader<CharacterRow> characters() {
        return new RelationReader<>(Relation.CHARACTERS, characters::streamRows);
    }
}
