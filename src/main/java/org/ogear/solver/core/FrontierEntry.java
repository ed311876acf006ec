package org.ogear.solver.core;

import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Transition;

import java.util.Arrays;
import java.util.List;

/**
 * Breadth-first frontier entry with a parent link for path reconstruction.
 * The root entry has no transition and no parent.
 */
record FrontierEntry(
        GearState state,
        Transition via,
        FrontierEntry parent,
        int depth
) {
    static FrontierEntry root(GearState origin) {
        return new FrontierEntry(origin, null, null, 0);
    }

    FrontierEntry extend(Transition transition, GearState next) {
        return new FrontierEntry(next, transition, this, depth + 1);
    }

    /**
     * Rebuilds the transitions from the root to this entry, in application order.
     */
    List<Transition> path() {
        Transition[] steps = new Transition[depth];
        FrontierEntry cursor = this;
        for (int i = depth - 1; i >= 0; i--) {
            steps[i] = cursor.via;
            cursor = cursor.parent;
        }
        return Arrays.asList(steps);
    }
}
