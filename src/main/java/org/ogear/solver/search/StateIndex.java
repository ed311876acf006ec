package org.ogear.solver.search;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.ogear.solver.graph.TransitionTable;
import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Position;

import java.util.Objects;

/**
 * Dense numbering of gear states for one transition table.
 * <p>
 * Every position the table mentions gets a slot of {@code TOOTH_COUNT * 2} ids, one per
 * (tooth, polarity) pair, so a state id identifies the full triple and not just its
 * position. The id space is small enough to back a bitset.
 * <p>
 * Immutable and safe for concurrent reads.
 */
public final class StateIndex {
    private static final int POLARITY_COUNT = 2;
    private static final int SLOT_WIDTH = GearState.TOOTH_COUNT * POLARITY_COUNT;
    private static final int UNKNOWN = -1;

    // Position -> dense position index, without boxing on lookup
    private final Object2IntOpenHashMap<Position> positionIndex;
    private final Position[] positions;

    /**
     * Indexes every position referenced by the table, as a source or as a move target.
     */
    public StateIndex(TransitionTable table) {
        Objects.requireNonNull(table, "table");
        int size = table.referencedPositions().size();
        this.positionIndex = new Object2IntOpenHashMap<>(size);
        this.positionIndex.defaultReturnValue(UNKNOWN);
        this.positions = new Position[size];

        int next = 0;
        for (Position position : table.referencedPositions()) {
            positionIndex.put(position, next);
            positions[next] = position;
            next++;
        }
        this.positionIndex.trim();
    }

    /**
     * Returns the dense id of a state.
     *
     * @throws IllegalArgumentException when the state's position is not indexed.
     */
    public int stateId(GearState state) {
        int slot = positionIndex.getInt(state.position());
        if (slot == UNKNOWN) {
            throw new IllegalArgumentException("position not indexed: " + state.position());
        }
        int polaritySlot = state.polarity() > 0 ? 0 : 1;
        return slot * SLOT_WIDTH + state.tooth() * POLARITY_COUNT + polaritySlot;
    }

    /**
     * Rebuilds the state behind a dense id.
     *
     * @throws IndexOutOfBoundsException when the id is outside {@code [0, capacity())}.
     */
    public GearState stateOf(int stateId) {
        if (stateId < 0 || stateId >= capacity()) {
            throw new IndexOutOfBoundsException("state id " + stateId + " out of bounds (capacity: " + capacity() + ")");
        }
        int slot = stateId / SLOT_WIDTH;
        int rest = stateId % SLOT_WIDTH;
        int polarity = rest % POLARITY_COUNT == 0 ? 1 : -1;
        return new GearState(positions[slot], rest / POLARITY_COUNT, polarity);
    }

    public boolean contains(Position position) {
        return position != null && positionIndex.containsKey(position);
    }

    /**
     * Returns the number of distinct state ids, i.e. the size of the state space.
     */
    public int capacity() {
        return positions.length * SLOT_WIDTH;
    }
}
