package com.cine.explorer.repo.documents;

import com.cine.explorer.model.documents.MovieComplete;
import com.cine.explorer.model.dto.*;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MovieCompleteRepo extends MongoRepository<MovieComplete, String> {

    /**
     * Movies with a cast member whose name matches {@code namePattern} (case-insensitive).
     */
    @Query(value = "{ 'cast.name': { $regex: ?0, $options: 'i' } }",
            fields = "{ 'title': 1, 'year': 1, 'genres': 1, 'rating': 1 }")
    List<MovieComplete> findByCastNameMatching(String namePattern, Pageable page);

    /**
     * Rated movies of one genre released within [from, to].
     */
    @Query("{ 'genres': ?0, 'year': { $gte: ?1, $lte: ?2 }, 'rating.votes': { $gt: 0 } }")
    List<MovieComplete> findRatedByGenreAndYearBetween(String genre, int from, int to, Pageable page);

    // Analytics over the nested fields. Names are grouped as written in the documents.

    @Aggregation(pipeline = {
            "{'$match': {'cast': {'$exists': true, '$ne': []}}}",
            "{'$unwind': '$cast'}",
            "{'$group': {" +
                    "'_id': {'name': '$cast.name', 'title': '$title'}," +
                    "'roles': {'$sum': {'$size': '$cast.characters'}}" +
                    "}}",
            "{'$match': {'roles': {'$gt': 1}}}",
            "{'$sort': {'roles': -1, '_id.name': 1, '_id.title': 1}}",
            "{'$limit': ?0}",
            "{'$project': {'_id': 0, 'actor': '$_id.name', 'title': '$_id.title', 'roles': 1}}"
    })
    List<ActorRoles> findMultiRoleActors(int limit);

    @Aggregation(pipeline = {
            "{'$match': {'cast.name': {'$regex': ?0, '$options': 'i'}}}",
            "{'$unwind': '$directors'}",
            "{'$group': {'_id': '$directors.name', 'movies': {'$sum': 1}}}",
            "{'$sort': {'movies': -1, '_id': 1}}",
            "{'$limit': ?1}",
            "{'$project': {'_id': 0, 'director': '$_id', 'movies': 1}}"
    })
    List<DirectorCollaboration> findDirectorsOfActor(String namePattern, int limit);

    @Aggregation(pipeline = {
            "{'$unwind': '$genres'}",
            "{'$match': {'rating.average': {'$gt': ?0}}}",
            "{'$group': {" +
                    "'_id': '$genres'," +
                    "'movies': {'$sum': 1}," +
                    "'averageRating': {'$avg': '$rating.average'}" +
                    "}}",
            "{'$match': {'movies': {'$gt': ?1}}}",
            "{'$sort': {'averageRating': -1, '_id': 1}}",
            "{'$project': {'_id': 0, 'genre': '$_id', 'averageRating': 1, 'movies': 1}}"
    })
    List<GenreStats> findPopularGenres(double minRating, int minMovies);

    @Aggregation(pipeline = {
            "{'$match': {'cast.name': {'$regex': ?0, '$options': 'i'}}}",
            "{'$addFields': {'decade': {'$multiply': [{'$floor': {'$divide': ['$year', 10]}}, 10]}}}",
            "{'$match': {'decade': {'$gt': 0}}}",
            "{'$group': {" +
                    "'_id': '$decade'," +
                    "'movies': {'$sum': 1}," +
                    "'averageRating': {'$avg': '$rating.average'}" +
                    "}}",
            "{'$sort': {'_id': 1}}",
            "{'$project': {'_id': 0, 'decade': {'$toInt': '$_id'}, 'movies': 1, 'averageRating': 1}}"
    })
    List<DecadeStats> findCareerByDecade(String namePattern);

    @Aggregation(pipeline = {
            "{'$unwind': '$genres'}",
            "{'$sort': {'rating.average': -1, '_id': 1}}",
            "{'$group': {" +
                    "'_id': '$genres'," +
                    "'movies': {'$push': {'title': '$title', 'year': '$year', 'rating': '$rating.average'}}" +
                    "}}",
            "{'$sort': {'_id': 1}}",
            "{'$limit': ?1}",
            "{'$project': {'_id': 0, 'genre': '$_id', 'movies': {'$slice': ['$movies', ?0]}}}"
    })
    List<GenreTopMovies> findTopMoviesPerGenre(int perGenre, int maxGenres);

    @Aggregation(pipeline = {
            "{'$match': {'cast': {'$exists': true, '$ne': []}}}",
            "{'$unwind': '$cast'}",
            "{'$group': {" +
                    "'_id': '$cast.name'," +
                    "'totalMovies': {'$sum': 1}," +
                    "'blockbusters': {'$sum': {'$cond': [{'$gt': ['$rating.votes', ?0]}, 1, 0]}}," +
                    "'maxVotes': {'$max': '$rating.votes'}" +
                    "}}",
            "{'$match': {'totalMovies': {'$gt': ?1}, 'blockbusters': {'$gt': 0}, 'maxVotes': {'$gt': ?0}}}",
            "{'$sort': {'maxVotes': -1, '_id': 1}}",
            "{'$limit': ?2}",
            "{'$project': {'_id': 0, 'actor': '$_id', 'totalMovies': 1, 'blockbusters': 1, 'maxVotes': 1}}"
    })
    List<BreakthroughCareer> findBreakthroughCareers(long minVotes, int minMovies, int limit);

    @Aggregation(pipeline = {
            "{'$unwind': '$directors'}",
            "{'$group': {" +
                    "'_id': '$directors.name'," +
                    "'movies': {'$sum': 1}," +
                    "'averageRating': {'$avg': '$rating.average'}," +
                    "'minRating': {'$min': '$rating.average'}," +
                    "'maxRating': {'$max': '$rating.average'}" +
                    "}}",
            "{'$match': {'movies': {'$gte': ?0}}}",
            "{'$sort': {'movies': -1, '_id': 1}}",
            "{'$limit': ?1}",
            "{'$project': {'_id': 0, 'director': '$_id', 'movies': 1, 'averageRating': 1, 'minRating': 1, 'maxRating': 1}}"
    })
    List<DirectorStats> findProlificDirectors(int minMovies, int limit);
}
