package com.cine.explorer.repo.catalog;

import com.cine.explorer.model.dto.MovieRow;
import com.cine.explorer.model.entity.MovieEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface MovieRepository extends JpaRepository<MovieEntity, String> {

    /**
     * Full scan in primary key order. Must be consumed inside a transaction and closed.
     */
    @Query("select new com.cine.explorer.model.dto.MovieRow(m.movieId, m.primaryTitle, m.startYear, m.runtimeMinutes) "
            + "from MovieEntity m order by m.movieId")
    Stream<MovieRow> streamRows();
}
