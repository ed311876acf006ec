package org.ogear.app;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.ogear.solver.core.BreadthFirstSolver;
import org.ogear.solver.core.GearSolverException;
import org.ogear.solver.core.SolveRequest;
import org.ogear.solver.core.SolveResponse;
import org.ogear.solver.graph.GearPuzzleTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Command-line entry point: parses origin and target, solves, prints numbered steps.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_SOLVER_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Launches the solver.
     *
     * @param args command-line arguments, see {@code --help}.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Runs one invocation against the given streams and returns the exit status.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        SolverCommandLine commandLine = new SolverCommandLine();
        SolveRequest request;
        try {
            CommandLine parsed = commandLine.parse(args);
            if (commandLine.isHelpRequested(parsed)) {
                commandLine.printUsage(new PrintWriter(out));
                return EXIT_OK;
            }
            request = commandLine.toRequest(parsed);
        } catch (ParseException ex) {
            err.println("error: " + ex.getMessage());
            commandLine.printUsage(new PrintWriter(err));
            return EXIT_USAGE;
        }

        MoveRenderer renderer = new MoveRenderer();
        out.println(renderer.describe("Origin", request.getOrigin()));
        out.println(renderer.describe("Target", request.getTarget()));

        SolveResponse response;
        try {
            response = new BreadthFirstSolver(GearPuzzleTables.castOGear()).solve(request);
        } catch (GearSolverException ex) {
            log.debug("Solver failed with {}", ex.reasonCode(), ex);
            err.println("error: " + ex.getMessage());
            return EXIT_SOLVER_FAILURE;
        }

        for (String line : renderer.renderSteps(response)) {
            out.println(line);
        }
        out.flush();
        return EXIT_OK;
    }
}
