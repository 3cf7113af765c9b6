package com.cine.explorer.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@IdClass(MoviePersonKey.class)
@Table(name = "DIRECTORS")
public class DirectorEntity {

    @Id
    @Column(name = "movie_id", length = 16)
    private String movieId;

    @Id
    @Column(name = "person_id", length = 16)
    private String personId;
}
