package com.cine.explorer.model.dto;

import com.cine.explorer.enums.PublishMode;
import com.cine.explorer.model.documents.MovieComplete;
import lombok.Builder;

import java.util.List;

/**
 * Summary of one movies_complete build.
 *
 * @param verified whether the destination count matched the number of movies read
 * @param example  one written document, preferably a heavily voted one; null when nothing was written
 */
@Builder
public record BuildReport(String collection,
                          PublishMode publishMode,
                          int movies,
                          long documentsWritten,
                          int batches,
                          int persons,
                          int moviesWithRating,
                          int moviesWithGenres,
                          int moviesWithDirectors,
                          int moviesWithCast,
                          int moviesWithWriters,
                          long orphanedCharacterRows,
                          long unresolvedPersonRefs,
                          List<String> indexesCreated,
                          List<String> failedIndexes,
                          boolean verified,
                          long elapsedMs,
                          MovieComplete example) {
}
