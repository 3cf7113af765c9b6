package com.cine.explorer.service.build;

import com.cine.explorer.model.documents.CastMember;
import com.cine.explorer.model.dto.CharacterRow;
import com.cine.explorer.model.dto.CreditRow;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Two-pass join of PRINCIPALS and CHARACTERS into per-movie cast lists.
 * <p>
 * Pass 1 registers one entry per distinct (movie, person) in order of first
 * appearance. Pass 2 appends each character name to the entry of its exact
 * (movie, person) pair; rows with no such entry are dropped and counted.
 * The resulting lists and each member's character list are unmodifiable.
 */
@Slf4j
public final class CastAssembler {

    private CastAssembler() {
    }

    public static CastIndex assemble(RelationReader<CreditRow> principals,
                                     RelationReader<CharacterRow> characters,
                                     PersonResolver persons) {
        Map<String, LinkedHashMap<String, CastMember>> byMovie = new HashMap<>();

        long principalRows = principals.drain(row ->
                byMovie.computeIfAbsent(row.movieId(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(row.personId(), id -> new CastMember(id, persons.resolve(id))));

        long[] orphaned = {0};
        long characterRows = characters.drain(row -> {
            Map<String, CastMember> cast = byMovie.get(row.movieId());
            CastMember member = cast == null ? null : cast.get(row.personId());
            if (member == null) {
                orphaned[0]++;
                return;
            }
            member.getCharacters().add(row.name());
        });

        Map<String, List<CastMember>> frozen = new HashMap<>(byMovie.size() * 4 / 3 + 1);
        byMovie.forEach((movieId, cast) -> frozen.put(movieId, freeze(cast.values())));

        log.debug("Cast joined: {} principal rows, {} character rows, {} orphaned",
                principalRows, characterRows, orphaned[0]);
        return new CastIndex(frozen, orphaned[0]);
    }

    private static List<CastMember> freeze(Collection<CastMember> cast) {
        List<CastMember> out = new ArrayList<>(cast.size());
        for (CastMember m : cast) {
            out.add(new CastMember(m.getPersonId(), m.getName(), List.copyOf(m.getCharacters())));
        }
        return Collections.unmodifiableList(out);
    }
}
