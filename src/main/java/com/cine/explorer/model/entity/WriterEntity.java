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
@Table(name = "WRITERS")
public class WriterEntity {

    @Id
    @Column(name = "movie_id", length = 16)
    private String movieId;

    @Id
    @Column(name = "person_id", length = 16)
    private String personId;
}
