package com.elara.calc;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.elara.calc.parser.AstPrinter;
import com.elara.calc.parser.CalcException;
import com.elara.calc.parser.Expr.ExprInterface;
import com.elara.calc.protocol.util.AstJson;
import com.elara.debug.Debug;
import com.elara.debug.DebugLevel;
import com.elara.debug.StreamDebugSink;

/**
 * Line-oriented calculator shell.
 *
 * Flags:
 *   --lenient        ignore tokens after the first complete expression
 *   --ast            print the expression tree before the result
 *   --json           print the expression tree as JSON before the result
 *   --max-depth=N    parenthesis nesting limit
 *   --debug          log engine activity to stderr
 *
 * Type an expression per line; "exit" (any case) or end of input quits.
 */
public final class ElaraCalcCli {

    private static final String TAG = "elara.calc.cli";
    private static final String USAGE =
            "Usage: ElaraCalcCli [--lenient] [--ast] [--json] [--max-depth=N] [--debug]";

    private final ElaraCalc engine;
    private final boolean printAst;
    private final boolean printJson;

    ElaraCalcCli(ElaraCalc engine, boolean printAst, boolean printJson) {
        this.engine = engine;
        this.printAst = printAst;
        this.printJson = printJson;
    }

    public static void main(String[] args) {
        final ElaraCalcCli cli;
        try {
            cli = fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            cli.run(stdin, System.out);
        } catch (IOException e) {
            System.err.println("Failed to read input: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Builds a shell from command-line flags. Unknown flags or bad values throw IllegalArgumentException. */
    public static ElaraCalcCli fromArgs(String[] args) {
        Map<String, String> flags = parseArgs(args);
        ElaraCalc engine = new ElaraCalc();
        boolean ast = false;
        boolean json = false;

        for (Map.Entry<String, String> flag : flags.entrySet()) {
            switch (flag.getKey()) {
                case "lenient":
                    engine.setMode(ElaraCalc.Mode.LENIENT);
                    break;
                case "ast":
                    ast = true;
                    break;
                case "json":
                    json = true;
                    break;
                case "max-depth":
                    try {
                        engine.setMaxDepth(Integer.parseInt(flag.getValue()));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid --max-depth: " + flag.getValue(), e);
                    }
                    break;
                case "debug":
                    Debug.get().setSink(new StreamDebugSink(System.err, DebugLevel.DEBUG));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + flag.getKey());
            }
        }
        return new ElaraCalcCli(engine, ast, json);
    }

    /** Runs the read-evaluate-print loop until "exit" or end of input. */
    public void run(BufferedReader in, PrintStream out) throws IOException {
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) break;

            String text = line.trim();
            if (text.isEmpty()) continue;
            if (text.equalsIgnoreCase("exit")) break;

            try {
                ExprInterface expr = engine.parse(text);
                if (printAst) out.println(AstPrinter.print(expr));
                if (printJson) out.println(AstJson.toPrettyJson(expr));
                out.println(format(engine.evaluate(expr)));
            } catch (CalcException e) {
                Debug.get().w(TAG, "rejected input: " + text, e);
                out.println("Error: " + e.getMessage());
            }
        }
        out.println();
        Debug.get().i(TAG, "session closed");
    }

    /**
     * Whole numbers print as plain integers of any size ({@code 14}, {@code 6000000000000000});
     * fractional and non-finite doubles via Double.toString ({@code 3.5}, {@code Infinity}).
     */
    public static String format(Number value) {
        if (value instanceof Long) return value.toString();

        double d = value.doubleValue();
        if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d)) {
            return new BigDecimal(d).toPlainString();
        }
        return Double.toString(d);
    }

    /**
     * Minimal arg parser:
     *   --max-depth=64 -> ("max-depth", "64")
     *   --ast          -> ("ast", "true")
     * Anything not starting with "--" is rejected.
     */
    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new LinkedHashMap<String, String>();
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            } else {
                throw new IllegalArgumentException("Unexpected argument: " + a);
            }
        }
        return out;
    }
}
