package com.cine.explorer.model.dto;

public record DirectorStats(String director, long movies, Double averageRating, Double minRating, Double maxRating) {
}
