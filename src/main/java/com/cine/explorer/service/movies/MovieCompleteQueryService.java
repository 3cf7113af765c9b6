package com.cine.explorer.service.movies;

import com.cine.explorer.common.Result;
import com.cine.explorer.common.exception.EntityNotFoundException;
import com.cine.explorer.common.exception.ValidationException;
import com.cine.explorer.model.documents.MovieComplete;
import com.cine.explorer.model.dto.*;
import com.cine.explorer.repo.documents.MovieCompleteRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Single-collection lookups over movies_complete. None of them joins:
 * everything a screen needs is inside the document.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MovieCompleteQueryService {

    static final int FILMOGRAPHY_LIMIT = 100;
    static final int MAX_TOP_N = 100;
    static final int MULTI_ROLE_LIMIT = 100;
    static final int COLLABORATION_LIMIT = 50;
    static final int GENRE_GROUP_LIMIT = 50;
    static final int BREAKTHROUGH_LIMIT = 50;
    static final int PROLIFIC_LIMIT = 30;

    private final MovieCompleteRepo repo;

    public Result<MovieComplete> getById(String movieId) {
        if (movieId == null || movieId.isBlank()) {
            throw new ValidationException("movieId is required");
        }
        return repo.findById(movieId)
                .map(Result::ok)
                .orElseThrow(() -> new EntityNotFoundException("Movie", movieId));
    }

    /**
     * Newest first. The name is matched literally as a substring.
     */
    public Result<List<MovieComplete>> filmography(String actorName) {
        PageRequest page = PageRequest.of(0, FILMOGRAPHY_LIMIT, Sort.by(Sort.Direction.DESC, "year"));
        List<MovieComplete> movies = repo.findByCastNameMatching(namePattern(actorName), page);
        log.debug("Filmography for '{}': {} movies", actorName, movies.size());
        return Result.ok(movies);
    }

    /**
     * Best rated first, only movies with at least one vote.
     */
    public Result<List<MovieComplete>> topRated(String genre, int fromYear, int toYear, int limit) {
        if (genre == null || genre.isBlank()) {
            throw new ValidationException("genre is required");
        }
        if (fromYear > toYear) {
            throw new ValidationException("from (" + fromYear + ") must not be after to (" + toYear + ")");
        }
        if (limit < 1 || limit > MAX_TOP_N) {
            throw new ValidationException("limit must be between 1 and " + MAX_TOP_N);
        }
        PageRequest page = PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "rating.average"));
        return Result.ok(repo.findRatedByGenreAndYearBetween(genre, fromYear, toYear, page));
    }

    /**
     * Actor and movie pairs where the actor plays more than one character, most roles first.
     */
    public Result<List<ActorRoles>> multiRoleActors() {
        return Result.ok(repo.findMultiRoleActors(MULTI_ROLE_LIMIT));
    }

    /**
     * Directors of the movies an actor appears in, by number of shared movies.
     */
    public Result<List<DirectorCollaboration>> directorsOfActor(String actorName) {
        return Result.ok(repo.findDirectorsOfActor(namePattern(actorName), COLLABORATION_LIMIT));
    }

    /**
     * Genres with more than {@code minMovies} movies rated above {@code minRating}, best average first.
     */
    public Result<List<GenreStats>> popularGenres(double minRating, int minMovies) {
        if (minRating < 0 || minRating > 10) {
            throw new ValidationException("minRating must be between 0 and 10");
        }
        if (minMovies < 0) {
            throw new ValidationException("minMovies must not be negative");
        }
        return Result.ok(repo.findPopularGenres(minRating, minMovies));
    }

    /**
     * Movie count and average rating per decade for one actor, oldest decade first.
     * Movies without a year are left out.
     */
    public Result<List<DecadeStats>> careerByDecade(String actorName) {
        return Result.ok(repo.findCareerByDecade(namePattern(actorName)));
    }

    public Result<List<GenreTopMovies>> topMoviesPerGenre(int perGenre) {
        if (perGenre < 1 || perGenre > MAX_TOP_N) {
            throw new ValidationException("perGenre must be between 1 and " + MAX_TOP_N);
        }
        return Result.ok(repo.findTopMoviesPerGenre(perGenre, GENRE_GROUP_LIMIT));
    }

    /**
     * Actors with more than {@code minMovies} movies, at least one of them above {@code minVotes}.
     */
    public Result<List<BreakthroughCareer>> breakthroughCareers(long minVotes, int minMovies) {
        if (minVotes < 0 || minMovies < 0) {
            throw new ValidationException("minVotes and minMovies must not be negative");
        }
        return Result.ok(repo.findBreakthroughCareers(minVotes, minMovies, BREAKTHROUGH_LIMIT));
    }

    public Result<List<DirectorStats>> prolificDirectors(int minMovies) {
        if (minMovies < 1) {
            throw new ValidationException("minMovies must be at least 1");
        }
        return Result.ok(repo.findProlificDirectors(minMovies, PROLIFIC_LIMIT));
    }

    private static String namePattern(String actorName) {
        if (actorName == null || actorName.isBlank()) {
            throw new ValidationException("actor name is required");
        }
        return Pattern.quote(actorName.trim());
    }
}
