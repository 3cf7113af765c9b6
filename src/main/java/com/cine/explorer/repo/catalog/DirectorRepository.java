package com.cine.explorer.repo.catalog;

import com.cine.explorer.model.dto.CreditRow;
import com.cine.explorer.model.entity.MoviePersonKey;
import com.cine.explorer.model.entity.DirectorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface DirectorRepository extends JpaRepository<DirectorEntity, MoviePersonKey> {

    @Query("select new com.cine.explorer.model.dto.CreditRow(x.movieId, x.personId) from DirectorEntity x")
    Stream<CreditRow> streamRows();
}
