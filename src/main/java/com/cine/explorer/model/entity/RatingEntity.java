package com.cine.explorer.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "RATINGS")
public class RatingEntity {

    @Id
    @Column(name = "movie_id", length = 16)
    private String movieId;

    /**
     * 1.0 - 10.0
     */
    @Column(name = "average_rating", nullable = false)
    private Double averageRating;

    @Column(name = "num_votes", nullable = false)
    private Integer numVotes;
}
