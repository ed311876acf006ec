package org.ogear.solver.core;

import lombok.experimental.UtilityClass;
import org.ogear.solver.graph.TransitionTable;
import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Transition;

import java.util.List;
import java.util.Objects;

/**
 * Re-applies a move sequence to check where it leads.
 */
@UtilityClass
public class PathReplayer {

    /**
     * Applies transitions in order starting at {@code origin}.
     *
     * @return final state after the last transition, or {@code origin} for an empty list.
     * @throws IllegalArgumentException when a transition does not start where the gear is.
     */
    public static GearState replay(GearState origin, List<Transition> transitions) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(transitions, "transitions");
        GearState current = origin;
        for (Transition transition : transitions) {
            current = current.apply(transition);
        }
        return current;
    }

    /**
     * Same as {@link #replay(GearState, List)} but also requires every transition to be a
     * member of {@code table}.
     *
     * @throws IllegalArgumentException when a transition is not part of the table.
     * @throws InvalidPositionException when the gear stands on a position the table lacks.
     */
    public static GearState replay(TransitionTable table, GearState origin, List<Transition> transitions) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(transitions, "transitions");
        GearState current = origin;
        for (int step = 0; step < transitions.size(); step++) {
            Transition transition = transitions.get(step);
            if (!table.transitionsFrom(current.position()).contains(transition)) {
                throw new IllegalArgumentException(
                        "step " + (step + 1) + " is not a legal move: " + transition
                );
            }
            current = current.apply(transition);
        }
        return current;
    }
}
