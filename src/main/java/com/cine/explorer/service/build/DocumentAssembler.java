package com.cine.explorer.service.build;

import com.cine.explorer.model.documents.MovieComplete;
import com.cine.explorer.model.documents.Rating;
import com.cine.explorer.model.dto.MovieRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges one movie row with everything the indices hold for it.
 * Missing associations become defaults: an unrated {@link Rating} and empty lists.
 */
public final class DocumentAssembler {

    private final SourceIndices indices;

    public DocumentAssembler(SourceIndices indices) {
        this.indices = indices;
    }

    public MovieComplete assemble(MovieRow movie) {
        String id = movie.movieId();
        return MovieComplete.builder()
                .id(id)
                .title(movie.title())
                .year(movie.year())
                .runtime(movie.runtime())
                .rating(indices.ratings().first(id).orElseGet(Rating::unrated))
                .genres(indices.genres().get(id))
                .directors(indices.directors().get(id))
                .cast(indices.cast().get(id))
                .writers(indices.writers().get(id))
                .build();
    }

    /**
     * One document per movie, in input order.
     */
    public List<MovieComplete> assembleAll(List<MovieRow> movies) {
        List<MovieComplete> docs = new ArrayList<>(movies.size());
        for (MovieRow movie : movies) {
            docs.add(assemble(movie));
        }
        return docs;
    }
}
