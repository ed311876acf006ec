package org.ogear.solver.core;

import org.ogear.solver.graph.TransitionTable;
import org.ogear.solver.model.GearState;
import org.ogear.solver.model.Transition;
import org.ogear.solver.search.StateIndex;
import org.ogear.solver.search.VisitedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;

/**
 * Finds a shortest move sequence between two gear states.
 * <p>
 * Breadth-first over (position, tooth, polarity). States are marked visited when they are
 * enqueued, so each state enters the frontier at most once and the first time the target
 * is generated it is at minimal depth. Among equally short paths the one generated first
 * under the table's enumeration order wins.
 * <p>
 * The table and state index are shared read-only; every call owns its own frontier and
 * visited set, so one solver may serve concurrent callers.
 */
public final class BreadthFirstSolver {
    private static final Logger log = LoggerFactory.getLogger(BreadthFirstSolver.class);

    private final TransitionTable table;
    private final StateIndex stateIndex;
    private final SearchBudget budget;

    /**
     * Creates a solver whose budget comes from system properties.
     */
    public BreadthFirstSolver(TransitionTable table) {
        this(table, SearchBudget.defaults());
    }

    public BreadthFirstSolver(TransitionTable table, SearchBudget budget) {
        this.table = Objects.requireNonNull(table, "table");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.stateIndex = new StateIndex(table);
    }

    /**
     * Solves a request.
     *
     * @see #solve(GearState, GearState)
     */
    public SolveResponse solve(SolveRequest request) {
        Objects.requireNonNull(request, "request");
        return solve(request.getOrigin(), request.getTarget());
    }

    /**
     * Computes a minimal-length sequence of legal moves from {@code origin} to {@code target}.
     *
     * @param origin starting state; its position must be a key of the table.
     * @param target state to reach; any value is accepted.
     * @return path in application order, empty when {@code origin.equals(target)}.
     * @throws InvalidPositionException       when the origin position is not in the table, or
     *                                        a position without entry is expanded.
     * @throws NoSolutionFoundException       when the target is not reachable.
     * @throws SearchBudgetExceededException  when the expansion cap is hit.
     */
    public SolveResponse solve(GearState origin, GearState target) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(target, "target");
        if (!table.contains(origin.position())) {
            throw new InvalidPositionException(origin.position());
        }
        log.debug("Solving {} -> {} ({})", origin, target, budget);

        if (origin.equals(target)) {
            return SolveResponse.builder()
                    .origin(origin)
                    .target(target)
                    .expandedStates(0)
                    .build();
        }

        ArrayDeque<FrontierEntry> frontier = new ArrayDeque<>();
        VisitedSet visited = new VisitedSet(stateIndex);
        visited.markVisited(origin);
        frontier.add(FrontierEntry.root(origin));

        int expandedStates = 0;
        while (!frontier.isEmpty()) {
            FrontierEntry entry = frontier.poll();
            expandedStates++;
            budget.checkExpandedStates(expandedStates);

            GearState state = entry.state();
            if (!table.contains(state.position())) {
                log.debug("Expanded {} which has no transition table entry", state.position());
                throw new InvalidPositionException(state.position(), true);
            }

            for (Transition transition : table.transitionsFrom(state.position())) {
                GearState next = state.apply(transition);
                if (!visited.markVisited(next)) {
                    continue;
                }
                FrontierEntry child = entry.extend(transition, next);
                if (next.equals(target)) {
                    List<Transition> path = child.path();
                    log.debug("Found {}-move path after expanding {} states", path.size(), expandedStates);
                    return SolveResponse.builder()
                            .origin(origin)
                            .target(target)
                            .expandedStates(expandedStates)
                            .transitions(path)
                            .build();
                }
                frontier.add(child);
            }
        }

        log.debug("No path from {} to {} among {} reachable states", origin, target, visited.size());
        throw new NoSolutionFoundException(origin, target, visited.size());
    }
}
