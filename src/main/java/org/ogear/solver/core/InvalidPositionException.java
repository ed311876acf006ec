package org.ogear.solver.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.ogear.solver.model.Position;

import java.util.Objects;

/**
 * Raised when a position has no entry in the transition table.
 *
 * <p>At the origin this is bad input. Reached while expanding the search it means the
 * table itself is malformed, reported through {@link #duringExpansion()}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class InvalidPositionException extends GearSolverException {
    private final Position position;
    private final boolean duringExpansion;

    public InvalidPositionException(Position position) {
        this(position, false);
    }

    public InvalidPositionException(Position position, boolean duringExpansion) {
        super(REASON_INVALID_POSITION, describe(position, duringExpansion));
        this.position = position;
        this.duringExpansion = duringExpansion;
    }

    private static String describe(Position position, boolean duringExpansion) {
        String label = Objects.requireNonNull(position, "position").toString();
        if (duringExpansion) {
            return label + " was reached during search but has no table entry (malformed transition table)";
        }
        return label + " is an invalid position";
    }
}
