package org.ogear.solver.model;

import java.util.Objects;

/**
 * Directed move of the gear from one position to another.
 *
 * <p>{@code toothDelta} is the raw change of the engaged tooth before the current
 * polarity is applied: 0 for an in-place rotation, +1/-1 when the gear slides to an
 * adjacent side. {@code polarityMult} is -1 when the move flips the gear over.</p>
 */
public record Transition(Position source, Position target, int toothDelta, int polarityMult) {

    public Transition {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (toothDelta < -1 || toothDelta > 1) {
            throw new IllegalArgumentException("toothDelta must be in [-1, 1], got " + toothDelta);
        }
        if (polarityMult != 1 && polarityMult != -1) {
            throw new IllegalArgumentException("polarityMult must be +1 or -1, got " + polarityMult);
        }
    }

    /**
     * Returns true when the gear turns in place instead of changing side.
     */
    public boolean isRotation() {
        return toothDelta == 0;
    }

    @Override
    public String toString() {
        return source + " -> " + target + " [tooth " + (toothDelta >= 0 ? "+" : "") + toothDelta
                + ", polarity x" + polarityMult + "]";
    }
}
