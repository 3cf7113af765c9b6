package com.cine.explorer.model.dto;

public record RatingRow(String movieId, Double average, Integer votes) {
}
