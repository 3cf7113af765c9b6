package com.cine.explorer.model.dto;

/**
 * @param decade        first year of the decade, e.g. 1990
 * @param averageRating null when no movie of the decade is rated
 */
public record DecadeStats(int decade, long movies, Double averageRating) {
}
