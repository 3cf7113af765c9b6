package com.cine.explorer.service.build;

import com.cine.explorer.model.documents.CastMember;

import java.util.List;
import java.util.Map;

/**
 * Per-movie cast lists produced by {@link CastAssembler}.
 * <p>
 * Lists and character lists are unmodifiable. Members are handed to the assembled
 * documents by reference.
 */
public final class CastIndex {

    private final Map<String, List<CastMember>> byMovie;
    private final long orphanedCharacterRows;

    CastIndex(Map<String, List<CastMember>> byMovie, long orphanedCharacterRows) {
        this.byMovie = byMovie;
        this.orphanedCharacterRows = orphanedCharacterRows;
    }

    public List<CastMember> get(String movieId) {
        return byMovie.getOrDefault(movieId, List.of());
    }

    public int movieCount() {
        return byMovie.size();
    }

    /**
     * Character rows dropped because no principal row exists for their movie and person.
     */
    public long orphanedCharacterRows() {
        return orphanedCharacterRows;
    }
}
