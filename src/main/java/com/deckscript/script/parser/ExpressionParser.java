package com.deckscript.script.parser;

import java.util.List;

/**
 * Recursive-descent evaluator for the arithmetic form.
 *
 * Grammar (lowest precedence first):
 *   or         -> and ( "||" and )*
 *   and        -> equality ( "&&" equality )*
 *   equality   -> comparison ( ( "==" | "!=" ) comparison )*
 *   comparison -> expression ( ( "<" | "<=" | ">" | ">=" ) expression )*
 *   expression -> term ( ( "+" | "-" ) term )*
 *   term       -> unary ( ( "*" | "/" | "%" ) unary )*
 *   unary      -> ( "-" | "!" ) unary | factor
 *   factor     -> NUMBER | STRING | TEMPLATE | IDENTIFIER | CALL | keyword | "(" or ")"
 *
 * IDENTIFIER and CALL tokens are substituted through the evaluator. Anything that does not
 * resolve becomes NaN, and NaN poisons the arithmetic around it.
 */
public class ExpressionParser {
    private static final int MAX_NESTING = 128;

    private final List<Token> tokens;
    private final ExpressionEvaluator evaluator;
    private final Environment env;
    private int current = 0;
    private int nesting = 0;

    public ExpressionParser(List<Token> tokens, ExpressionEvaluator evaluator, Environment env) {
        this.tokens = tokens;
        this.evaluator = evaluator;
        this.env = env;
    }

    public Value parse() {
        Value result = or();
        if (!isAtEnd()) throw error(peek(), "unexpected token");
        return result;
    }

    private Value or() {
        Value left = and();
        while (match(TokenType.OR_OR)) {
            Value right = and();
            left = left.truthy() ? left : right;
        }
        return left;
    }

    private Value and() {
        Value left = equality();
        while (match(TokenType.AND_AND)) {
            Value right = equality();
            left = left.truthy() ? right : left;
        }
        return left;
    }

    private Value equality() {
        Value left = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            boolean negate = previous().type == TokenType.BANG_EQUAL;
            Value right = comparison();
            left = Value.bool(looselyEqual(left, right) != negate);
        }
        return left;
    }

    private Value comparison() {
        Value left = expression();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            TokenType op = previous().type;
            Value right = expression();
            left = Value.bool(compare(op, left, right));
        }
        return left;
    }

    private Value expression() {
        Value val = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            TokenType op = previous().type;
            Value rhs = term();
            if (val.isMissing() || rhs.isMissing()) {
                val = Value.nan();
            } else if (op == TokenType.PLUS && (val.isString() || rhs.isString())) {
                val = Value.string(val.toDisplayString() + rhs.toDisplayString());
            } else if (op == TokenType.PLUS) {
                val = Value.number(toNumber(val) + toNumber(rhs));
            } else {
                val = Value.number(toNumber(val) - toNumber(rhs));
            }
        }
        return val;
    }

    private Value term() {
        Value val = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            TokenType op = previous().type;
            Value rhs = unary();
            if (val.isMissing() || rhs.isMissing()) {
                val = Value.nan();
                continue;
            }
            double a = toNumber(val);
            double b = toNumber(rhs);
            if (op == TokenType.STAR) val = Value.number(a * b);
            else if (op == TokenType.SLASH) val = Value.number(a / b);
            else val = Value.number(a % b);
        }
        return val;
    }

    private Value unary() {
        if (match(TokenType.MINUS, TokenType.BANG)) {
            Token op = previous();
            if (++nesting > MAX_NESTING) throw error(op, "unary operators nested too deeply");
            try {
                Value right = unary();
                if (op.type == TokenType.BANG) return Value.bool(!right.truthy());
                return right.isMissing() ? Value.nan() : Value.number(-toNumber(right));
            } finally {
                nesting--;
            }
        }
        return factor();
    }

    private Value factor() {
        if (match(TokenType.NUMBER)) return Value.number((Double) previous().literal);
        if (match(TokenType.STRING)) return Value.string((String) previous().literal);
        if (match(TokenType.TRUE)) return Value.bool(true);
        if (match(TokenType.FALSE)) return Value.bool(false);
        if (match(TokenType.NULL)) return Value.nil();
        if (match(TokenType.UNDEFINED)) return Value.nan();

        if (match(TokenType.TEMPLATE)) return evaluator.evaluate(previous().lexeme, env);
        if (match(TokenType.IDENTIFIER)) return substitute(evaluator.resolvePath(previous().lexeme, env));
        if (match(TokenType.CALL)) {
            try {
                return substitute(evaluator.evaluate(previous().lexeme, env));
            } catch (SnippetSyntaxException e) {
                return Value.nan();
            }
        }

        if (match(TokenType.LEFT_PAREN)) {
            if (++nesting > MAX_NESTING) throw error(previous(), "parentheses nested too deeply");
            try {
                Value inner = or();
                consume(TokenType.RIGHT_PAREN, "expect ')'");
                return inner;
            } finally {
                nesting--;
            }
        }

        throw error(peek(), "expect operand");
    }

    // Only plain data takes part in arithmetic; everything else is "no value".
    private static Value substitute(Value v) {
        switch (v.getType()) {
            case NUMBER:
            case STRING:
            case BOOL:
            case NULL:
                return v;
            default:
                return Value.nan();
        }
    }

    static double toNumber(Value v) {
        switch (v.getType()) {
            case NUMBER:
                return v.asNumber();
            case BOOL:
                return v.asBool() ? 1 : 0;
            case NULL:
                return 0;
            case STRING: {
                String s = v.asString().trim();
                if (s.isEmpty()) return 0;
                try {
                    return Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    return Double.NaN;
                }
            }
            default:
                return Double.NaN;
        }
    }

    private static boolean compare(TokenType op, Value a, Value b) {
        if (a.isString() && b.isString()) {
            int c = a.asString().compareTo(b.asString());
            switch (op) {
                case LESS: return c < 0;
                case LESS_EQUAL: return c <= 0;
                case GREATER: return c > 0;
                default: return c >= 0;
            }
        }
        double x = toNumber(a);
        double y = toNumber(b);
        switch (op) {
            case LESS: return x < y;
            case LESS_EQUAL: return x <= y;
            case GREATER: return x > y;
            default: return x >= y;
        }
    }

    private static boolean looselyEqual(Value a, Value b) {
        if (a.isNullish() && b.isNullish()) return true;
        if (a.getType() == Value.Type.NUMBER && b.getType() == Value.Type.NUMBER) {
            return a.asNumber() == b.asNumber();
        }
        if (a.getType() != b.getType()) return false;
        if (a.isString()) return a.asString().equals(b.asString());
        if (a.getType() == Value.Type.BOOL) return a.asBool() == b.asBool();
        return a == b;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private SnippetSyntaxException error(Token token, String message) {
        return new SnippetSyntaxException("Unsupported expression: " + message + " at offset " + token.offset);
    }
}
