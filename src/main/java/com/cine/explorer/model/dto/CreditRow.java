package com.cine.explorer.model.dto;

/**
 * A movie-person link: one row of DIRECTORS, WRITERS or PRINCIPALS.
 */
public record CreditRow(String movieId, String personId) {
}
