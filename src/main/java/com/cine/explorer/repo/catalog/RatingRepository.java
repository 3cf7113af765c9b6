package com.cine.explorer.repo.catalog;

import com.cine.explorer.model.dto.RatingRow;
import com.cine.explorer.model.entity.RatingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface RatingRepository extends JpaRepository<RatingEntity, String> {

    @Query("select new com.cine.explorer.model.dto.RatingRow(r.movieId, r.averageRating, r.numVotes) from RatingEntity r")
    Stream<RatingRow> streamRows();
}
