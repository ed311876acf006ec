package org.ogear.solver.core;

import lombok.Builder;
import lombok.Value;
import org.ogear.solver.model.GearState;

/**
 * Origin/target pair handed to the solver.
 */
@Value
@Builder
public class SolveRequest {
    /** Configuration the gear starts from. */
    GearState origin;
    /** Configuration the gear must end in. */
    GearState target;
}
