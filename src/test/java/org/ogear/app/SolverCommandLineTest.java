package org.ogear.app;

import org.apache.commons.cli.ParseException;
import org.ogear.solver.core.SolveRequest;
import org.ogear.solver.model.Axis;
import org.ogear.solver.model.GearState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class SolverCommandLineTest {

    private final SolverCommandLine commandLine = new SolverCommandLine();

    @Test
    @DisplayName("No arguments selects the canonical problem")
    void testDefaults() throws ParseException {
        SolveRequest request = commandLine.parseRequest(new String[0]);
        assertEquals(GearState.of(1, Axis.X, 0, 1), request.getOrigin());
        assertEquals(GearState.of(6, Axis.X, 4, -1), request.getTarget());
    }

    @Test
    @DisplayName("Short and long option names are both accepted")
    void testShortAndLongOptions() throws ParseException {
        SolveRequest request = commandLine.parseRequest(new String[]{
                "-is", "3", "-ia", "z", "-it", "2", "-ip", "F",
                "--target_side", "5", "--target_axis", "Y", "--target_tooth", "1", "--target_polarity", "t"
        });
        assertEquals(GearState.of(3, Axis.Z, 2, -1), request.getOrigin());
        assertEquals(GearState.of(5, Axis.Y, 1, 1), request.getTarget());
    }

    @Test
    @DisplayName("Out-of-range and malformed values are rejected")
    void testInvalidValues() {
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"-is", "7"}));
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"-is", "0"}));
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"-tt", "5"}));
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"-it", "one"}));
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"-ia", "W"}));
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"-tp", "yes"}));
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"--bogus"}));
        assertThrows(ParseException.class, () -> commandLine.parseRequest(new String[]{"-is"}));
    }

    @Test
    @DisplayName("Help flag is detected and usage lists every option")
    void testHelp() throws ParseException {
        assertTrue(commandLine.isHelpRequested(commandLine.parse(new String[]{"--help"})));
        assertFalse(commandLine.isHelpRequested(commandLine.parse(new String[0])));

        StringWriter buffer = new StringWriter();
        commandLine.printUsage(new PrintWriter(buffer));
        String usage = buffer.toString();
        assertTrue(usage.contains(SolverCommandLine.COMMAND_NAME));
        assertTrue(usage.contains("--initial_side"));
        assertTrue(usage.contains("--target_polarity"));
    }
}
