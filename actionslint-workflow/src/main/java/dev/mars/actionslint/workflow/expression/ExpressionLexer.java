/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.actionslint.workflow.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * Splits the inner text of one {@code ${{ ... }}} region into tokens. Token bounds are indexes
 * into the scalar value; {@code offsetOf} maps them to absolute source offsets for error
 * reporting.
 */
final class ExpressionLexer {

    enum TokenKind {
        IDENT,
        NUMBER,
        STRING,
        LPAREN,
        RPAREN,
        LBRACKET,
        RBRACKET,
        DOT,
        COMMA,
        STAR,
        OPERATOR,
        EOF
    }

    /**
     * @param text  the source text of the token
     * @param value the unescaped content for strings, otherwise the same as {@code text}
     */
    record Token(TokenKind kind, String text, String value, int start, int end) {

        boolean is(TokenKind expected) {
            return kind == expected;
        }

        boolean isOperator(String symbol) {
            return kind == TokenKind.OPERATOR && text.equals(symbol);
        }
    }

    private final String input;
    private final int to;
    private final IntUnaryOperator offsetOf;
    private int index;

    ExpressionLexer(String input, int from, int to, IntUnaryOperator offsetOf) {
        this.input = input;
        this.index = from;
        this.to = to;
        this.offsetOf = offsetOf;
    }

    List<Token> tokenize() throws ExpressionSyntaxException {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (index >= to) {
                tokens.add(new Token(TokenKind.EOF, "", "", to, to));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() throws ExpressionSyntaxException {
        char c = input.charAt(index);
        int start = index;
        switch (c) {
            case '(':
                return single(TokenKind.LPAREN);
            case ')':
                return single(TokenKind.RPAREN);
            case '[':
                return single(TokenKind.LBRACKET);
            case ']':
                return single(TokenKind.RBRACKET);
            case ',':
                return single(TokenKind.COMMA);
            case '*':
                return single(TokenKind.STAR);
            case '\'':
                return string();
            case '=':
            case '!':
            case '<':
            case '>':
                if (peek(1) == '=') {
                    index += 2;
                    return token(TokenKind.OPERATOR, start);
                }
                if (c == '=') {
                    throw error("Unexpected '=', did you mean '=='?", start);
                }
                index++;
                return token(TokenKind.OPERATOR, start);
            case '&':
            case '|':
                if (peek(1) == c) {
                    index += 2;
                    return token(TokenKind.OPERATOR, start);
                }
                throw error("Unexpected '" + c + "', did you mean '" + c + c + "'?", start);
            case '.':
                if (isDigit(peek(1))) {
                    return number();
                }
                return single(TokenKind.DOT);
            default:
                break;
        }
        if (isDigit(c) || (c == '-' && (isDigit(peek(1)) || peek(1) == '.'))) {
            return number();
        }
        if (isIdentifierStart(c)) {
            while (index < to && isIdentifierPart(input.charAt(index))) {
                index++;
            }
            return token(TokenKind.IDENT, start);
        }
        throw error("Unexpected character '" + c + "'", start);
    }

    private Token number() throws ExpressionSyntaxException {
        int start = index;
        if (input.charAt(index) == '-') {
            index++;
        }
        if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            index += 2;
            int digits = index;
            while (index < to && Character.digit(input.charAt(index), 16) >= 0) {
                index++;
            }
            if (index == digits) {
                throw error("Invalid hexadecimal number", start);
            }
        } else {
            skipDigits();
            if (peek(0) == '.') {
                index++;
                skipDigits();
            }
            if (peek(0) == 'e' || peek(0) == 'E') {
                index++;
                if (peek(0) == '+' || peek(0) == '-') {
                    index++;
                }
                int digits = index;
                skipDigits();
                if (index == digits) {
                    throw error("Invalid number exponent", start);
                }
            }
        }
        if (index < to && isIdentifierPart(input.charAt(index))) {
            throw error("Invalid number", start);
        }
        return token(TokenKind.NUMBER, start);
    }

    private Token string() throws ExpressionSyntaxException {
        int start = index;
        StringBuilder value = new StringBuilder();
        index++;
        while (index < to) {
            char c = input.charAt(index);
            if (c == '\'') {
                if (peek(1) == '\'') {
                    value.append('\'');
                    index += 2;
                    continue;
                }
                index++;
                return new Token(TokenKind.STRING, input.substring(start, index), value.toString(), start, index);
            }
            value.append(c);
            index++;
        }
        throw error("Unterminated string literal", start);
    }

    private Token single(TokenKind kind) {
        int start = index++;
        return token(kind, start);
    }

    private Token token(TokenKind kind, int start) {
        String text = input.substring(start, index);
        return new Token(kind, text, text, start, index);
    }

    private void skipDigits() {
        while (index < to && isDigit(input.charAt(index))) {
            index++;
        }
    }

    private void skipWhitespace() {
        while (index < to && Character.isWhitespace(input.charAt(index))) {
            index++;
        }
    }

    private char peek(int ahead) {
        int i = index + ahead;
        return i < to ? input.charAt(i) : '\0';
    }

    private ExpressionSyntaxException error(String message, int at) {
        return new ExpressionSyntaxException(message, offsetOf.applyAsInt(at));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
