import org.junit.jupiter.api.Test;

import com.elara.calc.ElaraCalcCli;
import com.elara.debug.Debug;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ElaraCalcCliTest {

    private static String session(ElaraCalcCli cli, String input) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        cli.run(new BufferedReader(new StringReader(input)), out);
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsResultsAndKeepsGoingAfterErrors() throws Exception {
        String output = session(ElaraCalcCli.fromArgs(new String[0]),
                "2 + 3 * 4\n7 / 2\n1 + a\n(1 + 2\n\n10 - 2 - 3\nEXIT\n9\n");
        List<String> lines = Arrays.asList(output.split("\n"));

        assertEquals("> 14", lines.get(0));
        assertEquals("> 3.5", lines.get(1));
        assertTrue(lines.get(2).startsWith("> Error: "), lines.get(2));
        assertTrue(lines.get(2).contains("'a'"), lines.get(2));
        assertTrue(lines.get(3).startsWith("> Error: "), lines.get(3));
        assertEquals("> > 5", lines.get(4));
        assertFalse(lines.contains("> 9"), output);
    }

    @Test
    void endOfInputEndsSession() throws Exception {
        String output = session(ElaraCalcCli.fromArgs(new String[0]), "1 + 1");
        assertTrue(output.startsWith("> 2\n"), output);
    }

    @Test
    void lenientFlagIgnoresTrailingTokens() throws Exception {
        assertTrue(session(ElaraCalcCli.fromArgs(new String[0]), "1 + 2) 3\n").contains("Error: "));
        assertTrue(session(ElaraCalcCli.fromArgs(new String[] { "--lenient" }), "1 + 2) 3\n").startsWith("> 3\n"));
    }

    @Test
    void astAndJsonFlagsPrintTheTree() throws Exception {
        String output = session(ElaraCalcCli.fromArgs(new String[] { "--ast", "--json" }), "1 + 2\nexit\n");
        assertTrue(output.contains("BinOp:\n  left:\n    Num(1)"), output);
        assertTrue(output.contains("\"type\" : \"BinOp\""), output);
        assertTrue(output.contains("\n3\n"), output);
    }

    @Test
    void maxDepthFlag() throws Exception {
        ElaraCalcCli cli = ElaraCalcCli.fromArgs(new String[] { "--max-depth=1" });
        String output = session(cli, "(1)\n((1))\n");
        assertTrue(output.startsWith("> 1\n> Error: "), output);
    }

    @Test
    void badFlagsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ElaraCalcCli.fromArgs(new String[] { "--verbose" }));
        assertThrows(IllegalArgumentException.class, () -> ElaraCalcCli.fromArgs(new String[] { "--max-depth=abc" }));
        assertThrows(IllegalArgumentException.class, () -> ElaraCalcCli.fromArgs(new String[] { "--max-depth=0" }));
        assertThrows(IllegalArgumentException.class, () -> ElaraCalcCli.fromArgs(new String[] { "expr" }));
    }

    @Test
    void largeWholeNumbersPrintExactly() throws Exception {
        String output = session(ElaraCalcCli.fromArgs(new String[0]),
                "9007199254740993\n2 * 3 * 1000000000000000\n9007199254740993 / 1000000000000000\n"
                        + "9223372036854775807 + 1\n");
        List<String> lines = Arrays.asList(output.split("\n"));

        assertEquals("> 9007199254740993", lines.get(0));
        assertEquals("> 6000000000000000", lines.get(1));
        assertTrue(lines.get(2).startsWith("> 9.00719925474099"), lines.get(2));
        assertTrue(lines.get(3).startsWith("> Error: Integer overflow"), lines.get(3));
    }

    @Test
    void evaluationsAreLoggedAtDebug() throws Exception {
        List<String> entries = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> entries.add(level + " " + tag + " " + message));
        try {
            session(ElaraCalcCli.fromArgs(new String[0]), "1 + 2\nexit\n");
        } finally {
            Debug.get().setSink(null);
        }

        assertTrue(entries.contains("DEBUG elara.calc (1 + 2) = 3"), entries.toString());
    }

    @Test
    void formatsResults() {
        assertEquals("14", ElaraCalcCli.format(14L));
        assertEquals("-7", ElaraCalcCli.format(-7L));
        assertEquals("9223372036854775807", ElaraCalcCli.format(Long.MAX_VALUE));
        assertEquals("4", ElaraCalcCli.format(4.0));
        assertEquals("3.5", ElaraCalcCli.format(3.5));
        assertEquals("1000000000000000", ElaraCalcCli.format(1e15));
        assertEquals("100000000000000000000", ElaraCalcCli.format(1e20));
        assertEquals("Infinity", ElaraCalcCli.format(Double.POSITIVE_INFINITY));
        assertEquals("NaN", ElaraCalcCli.format(Double.NaN));
    }
}
