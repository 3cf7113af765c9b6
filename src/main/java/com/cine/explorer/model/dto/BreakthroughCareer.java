package com.cine.explorer.model.dto;

/**
 * @param blockbusters movies of the actor above the vote threshold
 * @param maxVotes     votes of the actor's most voted movie
 */
public record BreakthroughCareer(String actor, long totalMovies, long blockbusters, long maxVotes) {
}
