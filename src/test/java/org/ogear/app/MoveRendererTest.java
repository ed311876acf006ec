package org.ogear.app;

import org.ogear.solver.core.SolveResponse;
import org.ogear.solver.model.Axis;
import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Move;
import org.ogear.solver.model.Position;
import org.ogear.solver.model.Transition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoveRendererTest {

    private final MoveRenderer renderer = new MoveRenderer();

    @Test
    @DisplayName("Rotations and side changes render differently")
    void testRenderStep() {
        assertEquals("Step 1: Rotate", renderer.renderStep(1, new Move(Position.of(1, Axis.Y), true)));
        assertEquals("Step 7: Move to side 4", renderer.renderStep(7, new Move(Position.of(4, Axis.Z), false)));
    }

    @Test
    @DisplayName("States render with T/F polarity")
    void testDescribe() {
        assertEquals(
                "Origin : side 1 axis X tooth 0 polarity T",
                renderer.describe("Origin", GearState.of(1, Axis.X, 0, 1))
        );
        assertEquals(
                "Target : side 6 axis X tooth 4 polarity F",
                renderer.describe("Target", GearState.of(6, Axis.X, 4, -1))
        );
    }

    @Test
    @DisplayName("Full rendering numbers steps from 1 after the banner")
    void testRender() {
        Position oneX = Position.of(1, Axis.X);
        Position twoX = Position.of(2, Axis.X);
        Position twoZ = Position.of(2, Axis.Z);
        SolveResponse response = SolveResponse.builder()
                .origin(new GearState(oneX, 0, 1))
                .target(new GearState(twoZ, 4, -1))
                .transition(new Transition(oneX, twoX, -1, 1))
                .transition(new Transition(twoX, twoZ, 0, -1))
                .build();

        List<String> lines = renderer.render(response);
        assertEquals(List.of(
                "Origin : side 1 axis X tooth 0 polarity T",
                "Target : side 2 axis Z tooth 4 polarity F",
                "Step 1: Move to side 2",
                "Step 2: Rotate"
        ), lines);
    }

    @Test
    @DisplayName("Empty path renders no steps")
    void testRenderEmpty() {
        GearState state = GearState.of(6, Axis.X, 4, -1);
        SolveResponse response = SolveResponse.builder().origin(state).target(state).build();
        assertTrue(renderer.renderSteps(response).isEmpty());
        assertEquals(List.of(
                "Origin : side 6 axis X tooth 4 polarity F",
                "Target : side 6 axis X tooth 4 polarity F"
        ), renderer.render(response));
    }
}
