package com.cine.explorer.repo.catalog;

import com.cine.explorer.model.dto.CreditRow;
import com.cine.explorer.model.entity.PrincipalEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface PrincipalRepository extends JpaRepository<PrincipalEntity, PrincipalEntity.Key> {

    /**
     * Billing order within each movie; the first appearance of a person fixes
     * their position in the cast list.
     */
    @Query("select new com.cine.explorer.model.dto.CreditRow(p.movieId, p.personId) from PrincipalEntity p "
            + "order by p.movieId, p.ordering")
    Stream<CreditRow> streamRows();
}
