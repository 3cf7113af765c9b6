package com.cine.explorer.model.dto;

/**
 * An actor credited with more than one character in a single movie.
 */
public record ActorRoles(String actor, String title, long roles) {
}
