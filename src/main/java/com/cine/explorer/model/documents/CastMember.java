package com.cine.explorer.model.documents;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CastMember {

    @Field("person_id")
    private String personId;

    private String name;

    /**
     * Every character credited to this person in this movie, in source order
     */
    private List<String> characters = new ArrayList<>();

    public CastMember(String personId, String name) {
        this.personId = personId;
        this.name = name;
    }
}
