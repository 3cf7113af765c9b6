package com.cine.explorer.service.build;

import com.cine.explorer.model.documents.PersonRef;
import com.cine.explorer.model.dto.PersonRow;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Person id to display name, loaded once from PERSONS and read-only afterwards.
 * <p>
 * Foreign keys in the link tables are not guaranteed to resolve. {@link #resolve(String)}
 * substitutes {@link #UNKNOWN} for those and counts the miss; it never throws.
 */
public final class PersonResolver {

    public static final String UNKNOWN = "Unknown";

    private final Map<String, String> names;
    private final AtomicLong unresolved = new AtomicLong();

    private PersonResolver(Map<String, String> names) {
        this.names = names;
    }

    public static PersonResolver build(RelationReader<PersonRow> persons) {
        Map<String, String> names = new HashMap<>();
        persons.drain(p -> names.put(p.personId(), p.name()));
        return new PersonResolver(names);
    }

    public Optional<String> find(String personId) {
        return Optional.ofNullable(names.get(personId));
    }

    public String resolve(String personId) {
        String name = names.get(personId);
        if (name == null) {
            unresolved.incrementAndGet();
            return UNKNOWN;
        }
        return name;
    }

    public PersonRef toRef(String personId) {
        return new PersonRef(personId, resolve(personId));
    }

    public int size() {
        return names.size();
    }

    /**
     * Number of {@link #resolve(String)} calls that fell back to {@link #UNKNOWN}.
     */
    public long unresolvedCount() {
        return unresolved.get();
    }
}
