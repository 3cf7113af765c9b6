package com.cine.explorer.model.documents;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * A person credited on a movie (director or writer), name already resolved.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersonRef {

    @Field("person_id")
    private String personId;

    private String name;
}
