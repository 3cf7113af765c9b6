package com.cine.explorer.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "MOVIES")
public class MovieEntity {

    @Id
    @Column(name = "movie_id", length = 16)
    private String movieId;

    /**
     * movie, tvSeries, short...
     */
    @Column(name = "title_type", nullable = false)
    private String titleType;

    @Column(name = "primary_title", nullable = false)
    private String primaryTitle;

    @Column(name = "original_title")
    private String originalTitle;

    @Column(name = "is_adult")
    private Integer isAdult;

    @Column(name = "start_year", nullable = false)
    private Integer startYear;

    @Column(name = "end_year")
    private Integer endYear;

    @Column(name = "runtime_minutes")
    private Integer runtimeMinutes;
}
