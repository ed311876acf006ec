package org.ogear.solver.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Move;
import org.ogear.solver.model.Transition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shortest move sequence found for a {@link SolveRequest}.
 *
 * <p>{@code transitions} is in application order; replaying it from {@code origin}
 * yields {@code target}. It is empty when origin and target coincide.</p>
 */
@Value
@Builder
public class SolveResponse {
    /** Configuration the search started from. */
    GearState origin;
    /** Configuration the path ends in. */
    GearState target;
    /** Number of states taken off the frontier and expanded. */
    int expandedStates;
    /** Legal moves from origin to target, in order. */
    @Singular
    List<Transition> transitions;

    /**
     * Returns the number of moves in the path.
     */
    public int length() {
        return transitions.size();
    }

    public boolean isEmpty() {
        return transitions.isEmpty();
    }

    /**
     * Projects the path onto caller-facing moves (destination and rotation flag).
     */
    public List<Move> moves() {
        List<Move> moves = new ArrayList<>(transitions.size());
        for (Transition transition : transitions) {
            moves.add(Move.of(transition));
        }
        return Collections.unmodifiableList(moves);
    }
}
