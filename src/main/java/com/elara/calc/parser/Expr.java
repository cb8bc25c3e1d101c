package com.elara.calc.parser;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitLiteralExpr(Literal expr);
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            if (left == null || right == null) throw new IllegalArgumentException("operands must not be null");
            if (!isArithmetic(operator)) {
                throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
            }
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        private static boolean isArithmetic(Token operator) {
            if (operator == null) return false;
            switch (operator.type) {
                case PLUS: case MINUS: case STAR: case SLASH: return true;
                default: return false;
            }
        }
    }

    public static final class Literal implements ExprInterface {
        public final long value;

        public Literal(long value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    private Expr() {}
}
