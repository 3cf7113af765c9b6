package com.cine.explorer.model.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of the plain movie-person link tables (directors, writers).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MoviePersonKey implements Serializable {
    private String movieId;
    private String personId;
}
