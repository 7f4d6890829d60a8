package com.raredisease.prioritization.run;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.RunState;

/**
 * A key that ended a collection pass without evidence.
 *
 * @param entityId  the disease id
 * @param criterion the criterion
 * @param state     state of the key after the pass
 * @param reason    last error, or a description of why nothing was collected
 */
public record CollectionFailure(String entityId, Criterion criterion, RunState state, String reason) {
}
