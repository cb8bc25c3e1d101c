package com.elara.calc.protocol.util;

import com.elara.calc.parser.Expr.Binary;
import com.elara.calc.parser.Expr.ExprInterface;
import com.elara.calc.parser.Expr.ExprVisitor;
import com.elara.calc.parser.Expr.Literal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of an expression tree:
 *   {"type":"Num","value":2}
 *   {"type":"BinOp","op":"+","left":{...},"right":{...}}
 */
public final class AstJson {

    private static final ObjectMapper om = new ObjectMapper();

    private AstJson() {}

    public static JsonNode toTree(ExprInterface expr) {
        return expr.accept(new ExprVisitor<JsonNode>() {
            @Override
            public JsonNode visitBinaryExpr(Binary expr) {
                ObjectNode node = om.createObjectNode();
                node.put("type", "BinOp");
                node.put("op", expr.operator.lexeme);
                node.set("left", expr.left.accept(this));
                node.set("right", expr.right.accept(this));
                return node;
            }

            @Override
            public JsonNode visitLiteralExpr(Literal expr) {
                ObjectNode node = om.createObjectNode();
                node.put("type", "Num");
                node.put("value", expr.value);
                return node;
            }
        });
    }

    public static String toJson(ExprInterface expr) {
        return write(toTree(expr), false);
    }

    public static String toPrettyJson(ExprInterface expr) {
        return write(toTree(expr), true);
    }

    private static String write(JsonNode n, boolean pretty) {
        try {
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(n) : om.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize expression tree", e);
        }
    }
}
