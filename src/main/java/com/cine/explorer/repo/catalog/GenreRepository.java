package com.cine.explorer.repo.catalog;

import com.cine.explorer.model.dto.GenreRow;
import com.cine.explorer.model.entity.GenreEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface GenreRepository extends JpaRepository<GenreEntity, GenreEntity.Key> {

    @Query("select new com.cine.explorer.model.dto.GenreRow(g.movieId, g.genre) from GenreEntity g")
    Stream<GenreRow> streamRows();
}
