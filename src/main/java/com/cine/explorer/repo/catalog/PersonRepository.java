package com.cine.explorer.repo.catalog;

import com.cine.explorer.model.dto.PersonRow;
import com.cine.explorer.model.entity.PersonEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface PersonRepository extends JpaRepository<PersonEntity, String> {

    @Query("select new com.cine.explorer.model.dto.PersonRow(p.personId, p.name) from PersonEntity p")
    Stream<PersonRow> streamRows();
}
