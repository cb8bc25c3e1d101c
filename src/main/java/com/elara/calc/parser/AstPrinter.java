package com.elara.calc.parser;

import com.elara.calc.parser.Expr.Binary;
import com.elara.calc.parser.Expr.ExprInterface;
import com.elara.calc.parser.Expr.ExprVisitor;
import com.elara.calc.parser.Expr.Literal;

/** Text renderings of an expression tree. */
public final class AstPrinter {

    /**
     * Indented tree, two spaces per level:
     * <pre>
     * BinOp:
     *   left:
     *     Num(2)
     *   op: PLUS
     *   right:
     *     Num(3)
     * </pre>
     * Lines are separated by '\n', no trailing newline.
     */
    public static String print(ExprInterface expr) {
        TreeWriter writer = new TreeWriter();
        expr.accept(writer);
        return writer.out.toString();
    }

    /** Fully parenthesized infix form with single spaces, e.g. {@code ((2 + 3) * 4)}. */
    public static String infix(ExprInterface expr) {
        return expr.accept(INFIX);
    }

    private static final ExprVisitor<String> INFIX = new ExprVisitor<String>() {
        @Override
        public String visitBinaryExpr(Binary expr) {
            return "(" + expr.left.accept(this) + " " + expr.operator.lexeme + " " + expr.right.accept(this) + ")";
        }

        @Override
        public String visitLiteralExpr(Literal expr) {
            return Long.toString(expr.value);
        }
    };

    private static final class TreeWriter implements ExprVisitor<Void> {
        private final StringBuilder out = new StringBuilder();
        private int level = 0;

        @Override
        public Void visitBinaryExpr(Binary expr) {
            line("BinOp:");
            level++;
            line("left:");
            nested(expr.left);
            line("op: " + expr.operator.type);
            line("right:");
            nested(expr.right);
            level--;
            return null;
        }

        @Override
        public Void visitLiteralExpr(Literal expr) {
            line("Num(" + expr.value + ")");
            return null;
        }

        private void nested(ExprInterface child) {
            level++;
            child.accept(this);
            level--;
        }

        private void line(String text) {
            if (out.length() > 0) out.append('\n');
            for (int i = 0; i < level; i++) out.append("  ");
            out.append(text);
        }
    }

    private AstPrinter() {}
}
