package com.cine.explorer.web;

import com.cine.explorer.common.Result;
import com.cine.explorer.model.documents.MovieComplete;
import com.cine.explorer.model.dto.*;
import com.cine.explorer.service.movies.MovieCompleteQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/movies")
@RequiredArgsConstructor
public class MovieCompleteController {

    private final MovieCompleteQueryService queries;

    @GetMapping("/{id}")
    public ResponseEntity<Result<MovieComplete>> byId(@PathVariable("id") String id) {
        return ResponseEntity.ok(queries.getById(id));
    }

    @GetMapping("/by-actor")
    public ResponseEntity<Result<List<MovieComplete>>> byActor(@RequestParam("name") String name) {
        return ResponseEntity.ok(queries.filmography(name));
    }

    @GetMapping("/top")
    public ResponseEntity<Result<List<MovieComplete>>> top(@RequestParam("genre") String genre,
                                                           @RequestParam("from") int from,
                                                           @RequestParam("to") int to,
                                                           @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return ResponseEntity.ok(queries.topRated(genre, from, to, limit));
    }

    @GetMapping("/by-actor/directors")
    public ResponseEntity<Result<List<DirectorCollaboration>>> directorsOfActor(@RequestParam("name") String name) {
        return ResponseEntity.ok(queries.directorsOfActor(name));
    }

    @GetMapping("/by-actor/career")
    public ResponseEntity<Result<List<DecadeStats>>> careerByDecade(@RequestParam("name") String name) {
        return ResponseEntity.ok(queries.careerByDecade(name));
    }

    @GetMapping("/actors/multi-role")
    public ResponseEntity<Result<List<ActorRoles>>> multiRoleActors() {
        return ResponseEntity.ok(queries.multiRoleActors());
    }

    @GetMapping("/actors/breakthrough")
    public ResponseEntity<Result<List<BreakthroughCareer>>> breakthrough(
            @RequestParam(value = "minVotes", defaultValue = "200000") long minVotes,
            @RequestParam(value = "minMovies", defaultValue = "5") int minMovies) {
        return ResponseEntity.ok(queries.breakthroughCareers(minVotes, minMovies));
    }

    @GetMapping("/genres/popular")
    public ResponseEntity<Result<List<GenreStats>>> popularGenres(
            @RequestParam(value = "minRating", defaultValue = "7.0") double minRating,
            @RequestParam(value = "minMovies", defaultValue = "50") int minMovies) {
        return ResponseEntity.ok(queries.popularGenres(minRating, minMovies));
    }

    @GetMapping("/genres/top")
    public ResponseEntity<Result<List<GenreTopMovies>>> topPerGenre(
            @RequestParam(value = "perGenre", defaultValue = "3") int perGenre) {
        return ResponseEntity.ok(queries.topMoviesPerGenre(perGenre));
    }

    @GetMapping("/directors/prolific")
    public ResponseEntity<Result<List<DirectorStats>>> prolificDirectors(
            @RequestParam(value = "minMovies", defaultValue = "10") int minMovies) {
        return ResponseEntity.ok(queries.prolificDirectors(minMovies));
    }
}
