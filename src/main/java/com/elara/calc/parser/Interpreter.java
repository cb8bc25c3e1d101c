package com.elara.calc.parser;

import com.elara.calc.parser.Expr.Binary;
import com.elara.calc.parser.Expr.ExprInterface;
import com.elara.calc.parser.Expr.ExprVisitor;
import com.elara.calc.parser.Expr.Literal;

/**
 * Evaluates an expression tree.
 *
 * - Literals and the results of + - * on whole numbers stay exact {@code Long}s
 * - Overflowing the long range raises EvaluationException
 * - '/' is true division and always yields a {@code Double} (IEEE-754 for a zero divisor)
 * - Any operation with a {@code Double} operand is done in double
 */
public class Interpreter implements ExprVisitor<Number> {

    public Number evaluate(ExprInterface expr) {
        if (expr == null) throw new IllegalArgumentException("expr must not be null");
        return eval(expr);
    }

    @Override
    public Number visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Number visitBinaryExpr(Binary expr) {
        Number left = eval(expr.left);
        Number right = eval(expr.right);
        TokenType op = expr.operator.type;

        if (op == TokenType.SLASH) {
            return left.doubleValue() / right.doubleValue();
        }
        if (left instanceof Long && right instanceof Long) {
            return exact(op, left.longValue(), right.longValue());
        }

        double l = left.doubleValue();
        double r = right.doubleValue();
        switch (op) {
            case PLUS:
                return l + r;
            case MINUS:
                return l - r;
            case STAR:
                return l * r;
            default:
                throw new EvaluationException("Unsupported binary operator: " + op);
        }
    }

    private static Long exact(TokenType op, long l, long r) {
        try {
            switch (op) {
                case PLUS:
                    return Math.addExact(l, r);
                case MINUS:
                    return Math.subtractExact(l, r);
                case STAR:
                    return Math.multiplyExact(l, r);
                default:
                    throw new EvaluationException("Unsupported binary operator: " + op);
            }
        } catch (ArithmeticException e) {
            throw new EvaluationException("Integer overflow: " + l + " " + symbol(op) + " " + r, e);
        }
    }

    private static String symbol(TokenType op) {
        switch (op) {
            case PLUS: return "+";
            case MINUS: return "-";
            default: return "*";
        }
    }

    private Number eval(ExprInterface expr) { return expr.accept(this); }
}
