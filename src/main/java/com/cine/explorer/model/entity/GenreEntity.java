package com.cine.explorer.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@IdClass(GenreEntity.Key.class)
@Table(name = "GENRES")
public class GenreEntity {

    @Id
    @Column(name = "movie_id", length = 16)
    private String movieId;

    @Id
    @Column(nullable = false)
    private String genre;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String movieId;
        private String genre;
    }
}
