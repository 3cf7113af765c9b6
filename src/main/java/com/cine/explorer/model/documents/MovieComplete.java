package com.cine.explorer.model.documents;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.ArrayList;
import java.util.List;

/**
 * One self-contained movie: rating, genres and resolved people inlined so that
 * reads never join. Keyed by the source movie_id.
 */
@Document(MovieComplete.COLLECTION)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovieComplete {

    public static final String COLLECTION = "movies_complete";

    @Id
    private String id;

    private String title;

    private Integer year;

    @Field(write = Field.Write.ALWAYS)
    private Integer runtime;

    private Rating rating;

    @Builder.Default
    private List<String> genres = new ArrayList<>();

    @Builder.Default
    private List<PersonRef> directors = new ArrayList<>();

    @Builder.Default
    private List<CastMember> cast = new ArrayList<>();

    @Builder.Default
    private List<PersonRef> writers = new ArrayList<>();
}
