package com.cine.explorer.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;

/**
 * Principal crew/cast membership of a movie. The same person may be listed
 * more than once for a movie under different orderings.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@IdClass(PrincipalEntity.Key.class)
@Table(name = "PRINCIPALS")
public class PrincipalEntity {

    @Id
    @Column(name = "movie_id", length = 16)
    private String movieId;

    @Id
    @Column(nullable = false)
    private Integer ordering;

    @Id
    @Column(name = "person_id", length = 16)
    private String personId;

    /**
     * actor, actress, self, producer...
     */
    @Column(nullable = false)
    private String category;

    @Column
    private String job;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String movieId;
        private Integer ordering;
        private String personId;
    }
}
