package com.cine.explorer.model.documents;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Field;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Rating {

    /**
     * Null when the movie has no rating row
     */
    @Field(write = Field.Write.ALWAYS)
    private Double average;

    private int votes;

    public static Rating unrated() {
        return new Rating(null, 0);
    }
}
