package com.cine.explorer.repo.catalog;

import com.cine.explorer.model.dto.CharacterRow;
import com.cine.explorer.model.entity.CharacterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface CharacterRepository extends JpaRepository<CharacterEntity, CharacterEntity.Key> {

    @Query("select new com.cine.explorer.model.dto.CharacterRow(c.movieId, c.personId, c.name) from CharacterEntity c")
    Stream<CharacterRow> streamRows();
}
