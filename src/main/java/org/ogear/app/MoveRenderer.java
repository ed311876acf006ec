package org.ogear.app;

import org.ogear.solver.core.SolveResponse;
import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Move;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a solution as the numbered instructions a person follows on the puzzle.
 */
public final class MoveRenderer {

    /**
     * Describes a state as entered on the command line.
     */
    public String describe(String label, GearState state) {
        return label + " : side " + state.position().side()
                + " axis " + state.position().axis()
                + " tooth " + state.tooth()
                + " polarity " + SolverCommandLine.polarityFlag(state.polarity());
    }

    /**
     * Renders one instruction; steps are numbered from 1.
     */
    public String renderStep(int stepNumber, Move move) {
        if (move.rotation()) {
            return "Step " + stepNumber + ": Rotate";
        }
        return "Step " + stepNumber + ": Move to side " + move.destination().side();
    }

    /**
     * Renders the numbered steps of a solution; an empty path renders no lines.
     */
    public List<String> renderSteps(SolveResponse response) {
        List<Move> moves = response.moves();
        List<String> lines = new ArrayList<>(moves.size());
        for (int i = 0; i < moves.size(); i++) {
            lines.add(renderStep(i + 1, moves.get(i)));
        }
        return lines;
    }

    /**
     * Renders the origin/target banner followed by every step.
     */
    public List<String> render(SolveResponse response) {
        List<String> lines = new ArrayList<>();
        lines.add(describe("Origin", response.getOrigin()));
        lines.add(describe("Target", response.getTarget()));
        lines.addAll(renderSteps(response));
        return lines;
    }
}
