package com.cine.explorer.service.build;

import com.cine.explorer.common.exception.SourceUnavailableException;
import com.cine.explorer.enums.Relation;
import jakarta.persistence.PersistenceException;
import org.springframework.dao.DataAccessException;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Single-pass reader over the full contents of one source relation.
 * <p>
 * Each {@link #drain(Consumer)} opens a fresh stream, pushes every row into the
 * sink and closes the stream. Read failures surface as
 * {@link SourceUnavailableException} naming the relation; there is no partial mode.
 *
 * @param <T> flat row type
 */
public final class RelationReader<T> {

    private final Relation relation;
    private final Supplier<Stream<T>> rows;

    public RelationReader(Relation relation, Supplier<Stream<T>> rows) {
        this.relation = Objects.requireNonNull(relation, "relation");
        this.rows = Objects.requireNonNull(rows, "rows");
    }

    public Relation relation() {
        return relation;
    }

    /**
     * @return number of rows pushed into {@code sink}
     */
    public long drain(Consumer<? super T> sink) {
        long count = 0;
        try (Stream<T> stream = rows.get()) {
            if (stream == null) {
                throw new SourceUnavailableException(relation, new IllegalStateException("no stream returned"));
            }
            Iterator<T> it = stream.iterator();
            while (it.hasNext()) {
                sink.accept(it.next());
                count++;
            }
        } catch (DataAccessException | PersistenceException e) {
            throw new SourceUnavailableException(relation, e);
        }
        return count;
    }
}
