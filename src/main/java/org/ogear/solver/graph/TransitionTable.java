package org.ogear.solver.graph;

import org.ogear.solver.core.InvalidPositionException;
import org.ogear.solver.model.Position;
import org.ogear.solver.model.Transition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only mapping from a gear position to the legal moves out of it.
 * <p>
 * The table is total only over its own keys: looking up any other position fails with
 * {@link InvalidPositionException} rather than returning an empty set, so "no such
 * position" never reads as "no outgoing moves". Edge sets carry no meaningful order;
 * enumeration follows insertion order only so repeated runs print the same solution.
 * <p>
 * Thread Safety: immutable after {@link Builder#build()}, safe for concurrent reads.
 */
public final class TransitionTable {

    private final Map<Position, Set<Transition>> transitionsBySource;
    private final Set<Position> referencedPositions;
    private final int edgeCount;

    private TransitionTable(Map<Position, Set<Transition>> transitionsBySource) {
        LinkedHashMap<Position, Set<Transition>> frozen = new LinkedHashMap<>();
        LinkedHashSet<Position> referenced = new LinkedHashSet<>(transitionsBySource.keySet());
        int edges = 0;
        for (Map.Entry<Position, Set<Transition>> entry : transitionsBySource.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
            for (Transition transition : entry.getValue()) {
                referenced.add(transition.target());
            }
            edges += entry.getValue().size();
        }
        this.transitionsBySource = Collections.unmodifiableMap(frozen);
        this.referencedPositions = Collections.unmodifiableSet(referenced);
        this.edgeCount = edges;
    }

    /**
     * Returns the moves leaving a position.
     *
     * @param position source position.
     * @return unmodifiable, non-empty set of transitions.
     * @throws InvalidPositionException when the position is not a key of this table.
     */
    public Set<Transition> transitionsFrom(Position position) {
        Set<Transition> transitions = transitionsBySource.get(Objects.requireNonNull(position, "position"));
        if (transitions == null) {
            throw new InvalidPositionException(position);
        }
        return transitions;
    }

    public boolean contains(Position position) {
        return position != null && transitionsBySource.containsKey(position);
    }

    /**
     * Returns the positions that have outgoing moves.
     */
    public Set<Position> positions() {
        return transitionsBySource.keySet();
    }

    /**
     * Returns every position the table mentions, as a source or as a move target.
     */
    public Set<Position> referencedPositions() {
        return referencedPositions;
    }

    public int size() {
        return transitionsBySource.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects moves position by position and freezes them into a table.
     */
    public static final class Builder {
        private final LinkedHashMap<Position, LinkedHashSet<Transition>> pending = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds one move.
         *
         * @param source      position the move starts from.
         * @param target      position the move ends at.
         * @param toothDelta  raw tooth change before polarity is applied.
         * @param polarityMult -1 when the move flips the gear, +1 otherwise.
         * @return this builder.
         * @throws IllegalArgumentException when the same move is added twice.
         */
        public Builder transition(Position source, Position target, int toothDelta, int polarityMult) {
            return transition(new Transition(source, target, toothDelta, polarityMult));
        }

        public Builder transition(Transition transition) {
            Objects.requireNonNull(transition, "transition");
            LinkedHashSet<Transition> edges = pending.computeIfAbsent(transition.source(), key -> new LinkedHashSet<>());
            if (!edges.add(transition)) {
                throw new IllegalArgumentException("duplicate transition " + transition);
            }
            return this;
        }

        /**
         * Freezes the collected moves.
         *
         * @throws IllegalStateException when no move was added.
         */
        public TransitionTable build() {
            if (pending.isEmpty()) {
                throw new IllegalStateException("transition table must define at least one position");
            }
            return new TransitionTable(new LinkedHashMap<>(pending));
        }
    }
}
