package com.cine.explorer.service.build;

import com.cine.explorer.model.dto.MovieRow;

import java.util.List;

/**
 * Everything read from the relational source for one build.
 */
public record CatalogSnapshot(SourceIndices indices, List<MovieRow> movies) {
}
