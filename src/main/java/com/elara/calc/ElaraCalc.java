package com.elara.calc;

import com.elara.calc.parser.AstPrinter;
import com.elara.calc.parser.CalcException;
import com.elara.calc.parser.Expr.ExprInterface;
import com.elara.calc.parser.Interpreter;
import com.elara.calc.parser.Lexer;
import com.elara.calc.parser.Parser;
import com.elara.debug.Debug;

/**
 * ElaraCalc engine.
 *
 * - Integer literals, + - * / and parentheses
 * - Usual precedence, left-associative, true division
 * - Whole-number results are exact longs; division yields a double
 * - A fresh lexer/parser pair per input; the engine itself holds only configuration
 * - Mode:
 *     - STRICT (default): the whole input must be one expression
 *     - LENIENT: tokens after the first complete expression are ignored
 */
public class ElaraCalc {

    private static final String TAG = "elara.calc";

    /** How much of the input a parse must consume. Default STRICT. */
    public enum Mode {
        STRICT,
        LENIENT
    }

    private Mode mode = Mode.STRICT;
    private int maxDepth = Parser.DEFAULT_MAX_DEPTH;
    private final Interpreter interpreter = new Interpreter();

    public void setMode(Mode mode) { this.mode = (mode == null) ? Mode.STRICT : mode; }

    public Mode getMode() { return mode; }

    /** Maximum parenthesis nesting accepted by the parser. */
    public void setMaxDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max depth must be >= 1, got " + depth);
        this.maxDepth = depth;
    }

    public int getMaxDepth() { return maxDepth; }

    public ExprInterface parse(String source) {
        try {
            Parser parser = new Parser(new Lexer(source), maxDepth);
            return (mode == Mode.STRICT) ? parser.parse() : parser.parseExpression();
        } catch (CalcException e) {
            Debug.get().w(TAG, "'" + source + "' failed: " + e.getMessage());
            throw e;
        }
    }

    /** Parses and evaluates; the result is a {@code Long} unless the expression divides. */
    public Number evaluate(String source) {
        return evaluate(parse(source));
    }

    /** Evaluates an already parsed tree. */
    public Number evaluate(ExprInterface expr) {
        try {
            Number result = interpreter.evaluate(expr);
            Debug.get().d(TAG, AstPrinter.infix(expr) + " = " + result);
            return result;
        } catch (CalcException e) {
            Debug.get().w(TAG, AstPrinter.infix(expr) + " failed: " + e.getMessage());
            throw e;
        }
    }
}
