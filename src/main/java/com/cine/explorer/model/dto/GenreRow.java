package com.cine.explorer.model.dto;

public record GenreRow(String movieId, String genre) {
}
