package org.ogear.app;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.ogear.solver.core.SolveRequest;
import org.ogear.solver.model.Axis;
import org.ogear.solver.model.GearState;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Command-line surface of the solver: option definitions and their translation into a
 * {@link SolveRequest}.
 * <p>
 * Every option has a default, so running without arguments asks for the puzzle's own
 * goal: from side 1 / X / tooth 0 / facing the axis to side 6 / X / tooth 4 / facing away.
 */
public final class SolverCommandLine {
    static final String COMMAND_NAME = "ogear-solver";

    static final String OPT_HELP = "h";
    static final String OPT_INITIAL_SIDE = "is";
    static final String OPT_INITIAL_AXIS = "ia";
    static final String OPT_INITIAL_TOOTH = "it";
    static final String OPT_INITIAL_POLARITY = "ip";
    static final String OPT_TARGET_SIDE = "ts";
    static final String OPT_TARGET_AXIS = "ta";
    static final String OPT_TARGET_TOOTH = "tt";
    static final String OPT_TARGET_POLARITY = "tp";

    static final int MIN_SIDE = 1;
    static final int MAX_SIDE = 6;

    private static final String FACING_AXIS = "T";
    private static final String FACING_AWAY = "F";

    private final Options options;

    public SolverCommandLine() {
        this.options = buildOptions();
    }

    /**
     * Parses raw arguments against the solver options.
     *
     * @throws ParseException on unknown options or missing option values.
     */
    public CommandLine parse(String[] args) throws ParseException {
        return new DefaultParser().parse(options, args);
    }

    public boolean isHelpRequested(CommandLine commandLine) {
        return commandLine.hasOption(OPT_HELP);
    }

    /**
     * Builds the origin/target pair from parsed options, applying defaults.
     *
     * @throws ParseException when a value is out of range or malformed.
     */
    public SolveRequest toRequest(CommandLine commandLine) throws ParseException {
        GearState origin = readState(
                commandLine,
                OPT_INITIAL_SIDE, "1",
                OPT_INITIAL_AXIS, "X",
                OPT_INITIAL_TOOTH, "0",
                OPT_INITIAL_POLARITY, FACING_AXIS
        );
        GearState target = readState(
                commandLine,
                OPT_TARGET_SIDE, "6",
                OPT_TARGET_AXIS, "X",
                OPT_TARGET_TOOTH, "4",
                OPT_TARGET_POLARITY, FACING_AWAY
        );
        return SolveRequest.builder()
                .origin(origin)
                .target(target)
                .build();
    }

    /**
     * Parses arguments straight into a request.
     */
    public SolveRequest parseRequest(String[] args) throws ParseException {
        return toRequest(parse(args));
    }

    /**
     * Prints option help.
     */
    public void printUsage(PrintWriter out) {
        new HelpFormatter().printHelp(
                out,
                HelpFormatter.DEFAULT_WIDTH,
                COMMAND_NAME,
                "Computes the shortest move sequence bringing the gear from an initial to a target position.",
                options,
                HelpFormatter.DEFAULT_LEFT_PAD,
                HelpFormatter.DEFAULT_DESC_PAD,
                "Polarity is T when the marked face of the gear points toward the positive side of its axis.",
                true
        );
        out.flush();
    }

    /**
     * Formats a polarity the way it is entered on the command line.
     */
    static String polarityFlag(int polarity) {
        return polarity > 0 ? FACING_AXIS : FACING_AWAY;
    }

    private static GearState readState(
            CommandLine commandLine,
            String sideOpt, String sideDefault,
            String axisOpt, String axisDefault,
            String toothOpt, String toothDefault,
            String polarityOpt, String polarityDefault
    ) throws ParseException {
        int side = readInt(commandLine, sideOpt, sideDefault, MIN_SIDE, MAX_SIDE);
        Axis axis = readAxis(commandLine, axisOpt, axisDefault);
        int tooth = readInt(commandLine, toothOpt, toothDefault, 0, GearState.TOOTH_COUNT - 1);
        int polarity = readPolarity(commandLine, polarityOpt, polarityDefault);
        return GearState.of(side, axis, tooth, polarity);
    }

    private static int readInt(CommandLine commandLine, String opt, String defaultValue, int min, int max)
            throws ParseException {
        String raw = commandLine.getOptionValue(opt, defaultValue).trim();
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new ParseException("option -" + opt + " expects an integer, got '" + raw + "'");
        }
        if (value < min || value > max) {
            throw new ParseException("option -" + opt + " must be in [" + min + ", " + max + "], got " + value);
        }
        return value;
    }

    private static Axis readAxis(CommandLine commandLine, String opt, String defaultValue) throws ParseException {
        String raw = commandLine.getOptionValue(opt, defaultValue);
        try {
            return Axis.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new ParseException("option -" + opt + ": " + ex.getMessage());
        }
    }

    private static int readPolarity(CommandLine commandLine, String opt, String defaultValue) throws ParseException {
        String raw = commandLine.getOptionValue(opt, defaultValue).trim().toUpperCase(Locale.ROOT);
        if (FACING_AXIS.equals(raw)) {
            return 1;
        }
        if (FACING_AWAY.equals(raw)) {
            return -1;
        }
        throw new ParseException("option -" + opt + " expects T or F, got '" + raw + "'");
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder(OPT_HELP).longOpt("help").desc("Print this help").build());
        options.addOption(valued(OPT_INITIAL_SIDE, "initial_side", "SIDE", "Initial side of the cube, 1-6 (default 1)"));
        options.addOption(valued(OPT_INITIAL_AXIS, "initial_axis", "AXIS", "Initial axis of the gear, X, Y or Z (default X)"));
        options.addOption(valued(OPT_INITIAL_TOOTH, "initial_tooth", "TOOTH", "Initial tooth inside the cube, 0-4 (default 0)"));
        options.addOption(valued(OPT_INITIAL_POLARITY, "initial_polarity", "T|F",
                "Initial polarity of the gear, T if facing the axis, F otherwise (default T)"));
        options.addOption(valued(OPT_TARGET_SIDE, "target_side", "SIDE", "Target side of the cube, 1-6 (default 6)"));
        options.addOption(valued(OPT_TARGET_AXIS, "target_axis", "AXIS", "Target axis of the gear, X, Y or Z (default X)"));
        options.addOption(valued(OPT_TARGET_TOOTH, "target_tooth", "TOOTH", "Target tooth inside the cube, 0-4 (default 4)"));
        options.addOption(valued(OPT_TARGET_POLARITY, "target_polarity", "T|F",
                "Target polarity of the gear, T if facing the axis, F otherwise (default F)"));
        return options;
    }

    private static Option valued(String opt, String longOpt, String argName, String description) {
        return Option.builder(opt)
                .longOpt(longOpt)
                .hasArg()
                .argName(argName)
                .desc(description)
                .build();
    }
}
