package com.cine.explorer.service.build;

import com.cine.explorer.model.documents.PersonRef;
import com.cine.explorer.model.documents.Rating;

/**
 * Every build-scoped index the document assembler reads from. Built once per
 * run and never mutated afterwards.
 */
public record SourceIndices(PersonResolver persons,
                            LookupIndex<Rating> ratings,
                            LookupIndex<String> genres,
                            LookupIndex<PersonRef> directors,
                            LookupIndex<PersonRef> writers,
                            CastIndex cast) {
}
