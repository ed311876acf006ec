package org.ogear.solver.model;

import java.util.Locale;

/**
 * Spatial axis the gear is aligned with on its current cube side.
 */
public enum Axis {
    X,
    Y,
    Z;

    /**
     * Parses an axis from its single-letter name, ignoring case and surrounding whitespace.
     *
     * @param raw axis label such as {@code "x"} or {@code "Z"}.
     * @return parsed axis.
     * @throws IllegalArgumentException when the label is null or not one of X, Y, Z.
     */
    public static Axis parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("axis must not be null");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Axis axis : values()) {
            if (axis.name().equals(normalized)) {
                return axis;
            }
        }
        throw new IllegalArgumentException("unknown axis '" + raw + "', expected one of X, Y, Z");
    }
}
