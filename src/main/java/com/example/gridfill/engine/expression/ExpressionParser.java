package com.example.gridfill.engine.expression;

import com.example.gridfill.exception.ExpressionEvaluationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser. Precedence, loosest first:
 * {@code ?:}, {@code ||}, {@code &&}, {@code == !=}, {@code < <= > >=}, {@code + -}, {@code * / %},
 * unary {@code ! -}, then property access and calls.
 */
class ExpressionParser {
    private final String source;
    private final ExpressionLexer lexer;
    private final FunctionRegistry functions;
    private Token lookahead;

    ExpressionParser(String source, FunctionRegistry functions) {
        this.source = source;
        this.lexer = new ExpressionLexer(source);
        this.functions = functions;
        this.lookahead = lexer.next();
    }

    Expression parse() {
        if (lookahead.is(Token.Type.EOF)) {
            throw malformed("Empty expression");
        }
        Expression expression = parseConditional();
        if (!lookahead.is(Token.Type.EOF)) {
            throw malformed("Unexpected " + lookahead);
        }
        return expression;
    }

    private Expression parseConditional() {
        Expression condition = parseOr();
        if (lookahead.is(Token.Type.QUESTION)) {
            eat(Token.Type.QUESTION);
            Expression whenTrue = parseConditional();
            eat(Token.Type.COLON);
            Expression whenFalse = parseConditional();
            return new Expression.Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (lookahead.is(Token.Type.OR)) {
            eat(Token.Type.OR);
            left = new Expression.Binary(Token.Type.OR, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (lookahead.is(Token.Type.AND)) {
            eat(Token.Type.AND);
            left = new Expression.Binary(Token.Type.AND, left, parseEquality());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (lookahead.is(Token.Type.EQ) || lookahead.is(Token.Type.NE)) {
            Token.Type op = eat(lookahead.getType()).getType();
            left = new Expression.Binary(op, left, parseRelational());
        }
        return left;
    }

    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (lookahead.is(Token.Type.LT) || lookahead.is(Token.Type.LE)
                || lookahead.is(Token.Type.GT) || lookahead.is(Token.Type.GE)) {
            Token.Type op = eat(lookahead.getType()).getType();
            left = new Expression.Binary(op, left, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (lookahead.is(Token.Type.PLUS) || lookahead.is(Token.Type.MINUS)) {
            Token.Type op = eat(lookahead.getType()).getType();
            left = new Expression.Binary(op, left, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (lookahead.is(Token.Type.STAR) || lookahead.is(Token.Type.SLASH) || lookahead.is(Token.Type.PERCENT)) {
            Token.Type op = eat(lookahead.getType()).getType();
            left = new Expression.Binary(op, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (lookahead.is(Token.Type.NOT) || lookahead.is(Token.Type.MINUS)) {
            Token.Type op = eat(lookahead.getType()).getType();
            return new Expression.Unary(op, parseUnary());
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        Expression expression = parsePrimary();
        while (lookahead.is(Token.Type.DOT)) {
            eat(Token.Type.DOT);
            Token name = eat(Token.Type.IDENT);
            expression = new Expression.Property(expression, name.getText());
        }
        return expression;
    }

    private Expression parsePrimary() {
        Token token = lookahead;
        switch (token.getType()) {
            case NUMBER:
                eat(Token.Type.NUMBER);
                return new Expression.Literal(token.getText().contains(".")
                        ? (Object) Double.parseDouble(token.getText())
                        : (Object) parseIntegral(token.getText()));
            case STRING:
                eat(Token.Type.STRING);
                return new Expression.Literal(token.getText());
            case TRUE:
                eat(Token.Type.TRUE);
                return new Expression.Literal(Boolean.TRUE);
            case FALSE:
                eat(Token.Type.FALSE);
                return new Expression.Literal(Boolean.FALSE);
            case NULL:
                eat(Token.Type.NULL);
                return new Expression.Literal(null);
            case LPAREN: {
                eat(Token.Type.LPAREN);
                Expression inner = parseConditional();
                eat(Token.Type.RPAREN);
                return inner;
            }
            case IDENT: {
                eat(Token.Type.IDENT);
                if (lookahead.is(Token.Type.LPAREN)) {
                    return parseCall(token);
                }
                return new Expression.Variable(token.getText());
            }
            default:
                throw malformed("Unexpected " + token);
        }
    }

    private Expression parseCall(Token name) {
        if (functions != null && !functions.contains(name.getText())) {
            throw new ExpressionEvaluationException(FunctionRegistry.UNKNOWN_FUNCTION,
                    "Unknown function '" + name.getText() + "' in '" + source + "'");
        }
        eat(Token.Type.LPAREN);
        List<Expression> arguments = new ArrayList<>();
        if (!lookahead.is(Token.Type.RPAREN)) {
            arguments.add(parseConditional());
            while (lookahead.is(Token.Type.COMMA)) {
                eat(Token.Type.COMMA);
                arguments.add(parseConditional());
            }
        }
        eat(Token.Type.RPAREN);
        return new Expression.Call(name.getText(), arguments);
    }

    private Object parseIntegral(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException tooLarge) {
            return Double.parseDouble(text);
        }
    }

    private Token eat(Token.Type expected) {
        if (!lookahead.is(expected)) {
            throw malformed("Expected " + expected + " but found " + lookahead);
        }
        Token current = lookahead;
        lookahead = lexer.next();
        return current;
    }

    private ExpressionEvaluationException malformed(String message) {
        return new ExpressionEvaluationException(ExpressionLexer.MALFORMED_EXPRESSION, message + " in '" + source + "'");
    }
}
