package com.expertagent.authz.condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a condition expression into tokens.
 */
final class Lexer {

    private final String source;
    private int pos;

    private Lexer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        return new Lexer(source).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);
        switch (c) {
            case '(':
                pos++;
                return new Token(Token.Type.LEFT_PAREN, "(", start);
            case ')':
                pos++;
                return new Token(Token.Type.RIGHT_PAREN, ")", start);
            case '[':
                pos++;
                return new Token(Token.Type.LEFT_BRACKET, "[", start);
            case ']':
                pos++;
                return new Token(Token.Type.RIGHT_BRACKET, "]", start);
            case '.':
                pos++;
                return new Token(Token.Type.DOT, ".", start);
            case ',':
                pos++;
                return new Token(Token.Type.COMMA, ",", start);
            case '&':
                return pair('&', Token.Type.AND, start);
            case '|':
                return pair('|', Token.Type.OR, start);
            case '!':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(Token.Type.OPERATOR, "!=", start);
                }
                pos++;
                return new Token(Token.Type.NOT, "!", start);
            case '=':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(Token.Type.OPERATOR, "==", start);
                }
                throw new InvalidConditionException("single '=' is not an operator, use '=='", start);
            case '<':
            case '>':
                if (peek(1) == '=') {
                    pos += 2;
                    return new Token(Token.Type.OPERATOR, c + "=", start);
                }
                pos++;
                return new Token(Token.Type.OPERATOR, String.valueOf(c), start);
            case '"':
            case '\'':
                return string(c, start);
            default:
                if (Character.isDigit(c) || (c == '-' && Character.isDigit(peek(1)))) {
                    return number(start);
                }
                if (Character.isLetter(c) || c == '_') {
                    return identifier(start);
                }
                throw new InvalidConditionException("unexpected character '" + c + "'", start);
        }
    }

    private Token pair(char c, Token.Type type, int start) {
        if (peek(1) != c) {
            throw new InvalidConditionException("expected '" + c + c + "'", start);
        }
        pos += 2;
        return new Token(type, "" + c + c, start);
    }

    private Token string(char quote, int start) {
        StringBuilder value = new StringBuilder();
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Token.Type.STRING, value.toString(), start);
            }
            if (c == '\\') {
                if (pos >= source.length()) {
                    break;
                }
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n':
                        value.append('\n');
                        break;
                    case 't':
                        value.append('\t');
                        break;
                    default:
                        value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        throw new InvalidConditionException("unterminated string literal", start);
    }

    private Token number(int start) {
        pos++;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (peek(0) == '.' && Character.isDigit(peek(1))) {
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), start);
    }

    private Token identifier(int start) {
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        return new Token(Token.Type.IDENTIFIER, source.substring(start, pos), start);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }
}
