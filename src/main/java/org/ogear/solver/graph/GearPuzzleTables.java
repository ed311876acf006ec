package org.ogear.solver.graph;

import lombok.experimental.UtilityClass;
import org.ogear.solver.model.Axis;
import org.ogear.solver.model.Position;

import static org.ogear.solver.model.Axis.X;
import static org.ogear.solver.model.Axis.Y;
import static org.ogear.solver.model.Axis.Z;

/**
 * Transition tables of concrete puzzle products.
 * <p>
 * Cube sides are numbered with the two-notch side on top (1), the side carrying the
 * arrow mark on the right (5), the front as 2, the left as 3, the back as 4 and the
 * bottom as 6. Each move lists (target, tooth delta, polarity multiplier).
 */
@UtilityClass
public final class GearPuzzleTables {

    private static final TransitionTable CAST_O_GEAR = TransitionTable.builder()
            .transition(p(1, X), p(2, X), -1, 1)
            .transition(p(1, X), p(4, X), 1, 1)
            .transition(p(1, X), p(1, Y), 0, -1)

            .transition(p(1, Y), p(3, Y), 1, 1)
            .transition(p(1, Y), p(1, X), 0, -1)

            .transition(p(2, X), p(1, X), 1, 1)
            .transition(p(2, X), p(2, Z), 0, -1)

            .transition(p(2, Z), p(5, Z), -1, 1)
            .transition(p(2, Z), p(2, X), 0, -1)

            .transition(p(3, Y), p(1, Y), -1, 1)
            .transition(p(3, Y), p(6, Y), 1, 1)
            .transition(p(3, Y), p(3, Z), 0, 1)

            .transition(p(3, Z), p(4, Z), 1, 1)
            .transition(p(3, Z), p(3, Y), 0, 1)

            .transition(p(4, Z), p(3, Z), -1, 1)
            .transition(p(4, Z), p(5, Z), 1, 1)
            .transition(p(4, Z), p(4, X), 0, 1)

            .transition(p(4, X), p(1, X), -1, 1)
            .transition(p(4, X), p(4, Z), 0, 1)

            .transition(p(5, Z), p(4, Z), -1, 1)
            .transition(p(5, Z), p(2, Z), 1, 1)
            .transition(p(5, Z), p(5, Y), 0, -1)

            .transition(p(5, Y), p(6, Y), -1, 1)
            .transition(p(5, Y), p(5, Z), 0, -1)

            .transition(p(6, Y), p(5, Y), 1, 1)
            .transition(p(6, Y), p(3, Y), -1, 1)
            .transition(p(6, Y), p(6, X), 0, 1)

            // goal side: only a rotation back onto the Y track leaves it
            .transition(p(6, X), p(6, Y), 0, 1)
            .build();

    /**
     * Returns the shared table of the Cast O'Gear puzzle.
     */
    public static TransitionTable castOGear() {
        return CAST_O_GEAR;
    }

    private static Position p(int side, Axis axis) {
        return Position.of(side, axis);
    }
}
