package com.cine.explorer.model.dto;

public record GenreStats(String genre, Double averageRating, long movies) {
}
