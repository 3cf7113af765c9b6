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
@IdClass(CharacterEntity.Key.class)
@Table(name = "CHARACTERS")
public class CharacterEntity {

    @Id
    @Column(name = "movie_id", length = 16)
    private String movieId;

    @Id
    @Column(name = "person_id", length = 16)
    private String personId;

    /**
     * Character name as credited
     */
    @Id
    @Column(nullable = false)
    private String name;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String movieId;
        private String personId;
        private String name;
    }
}
