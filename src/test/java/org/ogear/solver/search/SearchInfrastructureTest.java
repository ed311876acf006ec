package org.ogear.solver.search;

import org.ogear.solver.graph.GearPuzzleTables;
import org.ogear.solver.graph.TransitionTable;
import org.ogear.solver.model.Axis;
import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search Infrastructure Tests")
class SearchInfrastructureTest {

    private final TransitionTable table = GearPuzzleTables.castOGear();

    @Nested
    @DisplayName("1. StateIndex")
    class StateIndexTests {

        @Test
        @DisplayName("Reference table spans 120 states")
        void testCapacity() {
            assertEquals(120, new StateIndex(table).capacity());
        }

        @Test
        @DisplayName("Every triple gets its own id and maps back to itself")
        void testIdsAreDenseAndDistinct() {
            StateIndex index = new StateIndex(table);
            Set<Integer> ids = new HashSet<>();
            for (Position position : table.positions()) {
                for (int tooth = 0; tooth < GearState.TOOTH_COUNT; tooth++) {
                    for (int polarity : new int[]{1, -1}) {
                        GearState state = new GearState(position, tooth, polarity);
                        int id = index.stateId(state);
                        assertTrue(id >= 0 && id < index.capacity(), "id out of range: " + id);
                        assertTrue(ids.add(id), "duplicate id for " + state);
                        assertEquals(state, index.stateOf(id));
                    }
                }
            }
            assertEquals(index.capacity(), ids.size());
        }

        @Test
        @DisplayName("Unknown positions are rejected")
        void testUnknownPosition() {
            StateIndex index = new StateIndex(table);
            assertFalse(index.contains(Position.of(6, Axis.Z)));
            assertThrows(IllegalArgumentException.class, () -> index.stateId(GearState.of(6, Axis.Z, 0, 1)));
            assertThrows(IndexOutOfBoundsException.class, () -> index.stateOf(index.capacity()));
            assertThrows(IndexOutOfBoundsException.class, () -> index.stateOf(-1));
        }
    }

    @Nested
    @DisplayName("2. VisitedSet")
    class VisitedSetTests {

        private VisitedSet visitedSet;

        @BeforeEach
        void setUp() {
            visitedSet = new VisitedSet(new StateIndex(table));
        }

        @Test
        @DisplayName("Marking and checking visits")
        void testMarkAndCheck() {
            GearState state = GearState.of(3, Axis.Z, 2, -1);
            assertFalse(visitedSet.isVisited(state), "Should be unvisited initially");

            assertTrue(visitedSet.markVisited(state), "First markVisited should return true");
            assertTrue(visitedSet.isVisited(state), "Should report true after marking");
            assertFalse(visitedSet.markVisited(state), "Second markVisited should return false");
            assertEquals(1, visitedSet.size());
        }

        @Test
        @DisplayName("Keyed on the full triple, not just the position")
        void testFullTripleKey() {
            visitedSet.markVisited(GearState.of(1, Axis.X, 0, 1));
            assertFalse(visitedSet.isVisited(GearState.of(1, Axis.X, 0, -1)));
            assertFalse(visitedSet.isVisited(GearState.of(1, Axis.X, 1, 1)));
            assertFalse(visitedSet.isVisited(GearState.of(6, Axis.Z, 0, 1)), "unindexed positions are never visited");
        }

        @Test
        @DisplayName("Clear resets state")
        void testClear() {
            GearState state = GearState.of(5, Axis.Y, 4, 1);
            visitedSet.markVisited(state);
            visitedSet.clear();
            assertFalse(visitedSet.isVisited(state), "Should be unvisited after clear");
            assertEquals(0, visitedSet.size());
        }
    }
}
