package com.cine.explorer.model.dto;

import java.util.List;

/**
 * Best rated movies of one genre, best first.
 */
public record GenreTopMovies(String genre, List<RankedMovie> movies) {

    public record RankedMovie(String title, Integer year, Double rating) {
    }
}
