package com.cine.explorer.model.dto;

/**
 * Flat projection of one MOVIES row.
 */
public record MovieRow(String movieId, String title, Integer year, Integer runtime) {
}
