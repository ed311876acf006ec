package org.ogear.solver.search;

import org.ogear.solver.model.GearState;

import java.util.BitSet;
import java.util.Objects;

/**
 * Tracks which gear states a single search has already enqueued.
 * <p>
 * Backed by a {@link BitSet} over the dense ids of a {@link StateIndex}, so membership is
 * keyed on the whole (position, tooth, polarity) triple.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe. Each search owns its own instance.
 * </p>
 */
public class VisitedSet {

    private final StateIndex index;
    private final BitSet visited;
    private int size;

    public VisitedSet(StateIndex index) {
        this.index = Objects.requireNonNull(index, "index");
        this.visited = new BitSet(index.capacity());
    }

    /**
     * Marks a state as visited if it hasn't been visited already.
     *
     * @param state state to mark.
     * @return {@code true} if the state was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(GearState state) {
        int id = index.stateId(state);
        if (visited.get(id)) {
            return false;
        }
        visited.set(id);
        size++;
        return true;
    }

    public boolean isVisited(GearState state) {
        return index.contains(state.position()) && visited.get(index.stateId(state));
    }

    /**
     * Returns how many distinct states have been marked.
     */
    public int size() {
        return size;
    }

    /**
     * Forgets every mark so the set can serve another search over the same index.
     */
    public void clear() {
        visited.clear();
        size = 0;
    }
}
