package com.cine.explorer.model.dto;

public record CharacterRow(String movieId, String personId, String name) {
}
