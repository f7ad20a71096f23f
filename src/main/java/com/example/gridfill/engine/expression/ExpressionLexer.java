package com.example.gridfill.engine.expression;

import com.example.gridfill.exception.ExpressionEvaluationException;

/**
 * Splits expression text into tokens. Words {@code and}, {@code or}, {@code not} are aliases of
 * {@code && || !}; strings take single or double quotes with backslash escapes.
 */
class ExpressionLexer {
    static final String MALFORMED_EXPRESSION = "MALFORMED_EXPRESSION";

    private final String source;
    private int pos;

    ExpressionLexer(String source) {
        this.source = source;
    }

    Token next() {
        skipWhitespace();
        if (pos >= source.length()) {
            return new Token(Token.Type.EOF, "", pos);
        }
        int start = pos;
        char c = source.charAt(pos);
        if (Character.isJavaIdentifierStart(c)) {
            pos++;
            while (pos < source.length() && Character.isJavaIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            String word = source.substring(start, pos);
            switch (word) {
                case "true":
                    return new Token(Token.Type.TRUE, word, start);
                case "false":
                    return new Token(Token.Type.FALSE, word, start);
                case "null":
                    return new Token(Token.Type.NULL, word, start);
                case "and":
                    return new Token(Token.Type.AND, word, start);
                case "or":
                    return new Token(Token.Type.OR, word, start);
                case "not":
                    return new Token(Token.Type.NOT, word, start);
                default:
                    return new Token(Token.Type.IDENT, word, start);
            }
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '\'' || c == '"') {
            return string(start, c);
        }
        if (pos + 1 < source.length()) {
            String two = source.substring(pos, pos + 2);
            Token.Type type = twoCharOperator(two);
            if (type != null) {
                pos += 2;
                return new Token(type, two, start);
            }
        }
        pos++;
        switch (c) {
            case '.':
                return new Token(Token.Type.DOT, ".", start);
            case ',':
                return new Token(Token.Type.COMMA, ",", start);
            case '(':
                return new Token(Token.Type.LPAREN, "(", start);
            case ')':
                return new Token(Token.Type.RPAREN, ")", start);
            case '?':
                return new Token(Token.Type.QUESTION, "?", start);
            case ':':
                return new Token(Token.Type.COLON, ":", start);
            case '+':
                return new Token(Token.Type.PLUS, "+", start);
            case '-':
                return new Token(Token.Type.MINUS, "-", start);
            case '*':
                return new Token(Token.Type.STAR, "*", start);
            case '/':
                return new Token(Token.Type.SLASH, "/", start);
            case '%':
                return new Token(Token.Type.PERCENT, "%", start);
            case '<':
                return new Token(Token.Type.LT, "<", start);
            case '>':
                return new Token(Token.Type.GT, ">", start);
            case '!':
                return new Token(Token.Type.NOT, "!", start);
            default:
                throw new ExpressionEvaluationException(MALFORMED_EXPRESSION,
                        "Unexpected character '" + c + "' at " + start + " in '" + source + "'");
        }
    }

    private Token.Type twoCharOperator(String two) {
        switch (two) {
            case "&&":
                return Token.Type.AND;
            case "||":
                return Token.Type.OR;
            case "==":
                return Token.Type.EQ;
            case "!=":
                return Token.Type.NE;
            case "<=":
                return Token.Type.LE;
            case ">=":
                return Token.Type.GE;
            default:
                return null;
        }
    }

    private Token number(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start);
    }

    private Token string(int start, char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char ch = source.charAt(pos++);
            if (ch == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (ch == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    default:
                        sb.append(escaped);
                }
            } else {
                sb.append(ch);
            }
        }
        throw new ExpressionEvaluationException(MALFORMED_EXPRESSION,
                "Unterminated string starting at " + start + " in '" + source + "'");
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
