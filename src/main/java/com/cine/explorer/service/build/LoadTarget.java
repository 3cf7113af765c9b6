package com.cine.explorer.service.build;

import com.cine.explorer.enums.PublishMode;

/**
 * @param target     collection readers query
 * @param collection collection the batches go to (the target itself, or its staging twin)
 */
public record LoadTarget(String target, String collection, PublishMode mode) {
}
