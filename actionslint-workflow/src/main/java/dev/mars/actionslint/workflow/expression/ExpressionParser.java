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

import dev.mars.actionslint.core.Pos;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.expression.ExpressionLexer.Token;
import dev.mars.actionslint.workflow.expression.ExpressionLexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import java.util.function.IntUnaryOperator;
import java.util.logging.Logger;

/**
 * Parser for the {@code ${{ ... }}} micro-expressions embedded in workflow scalars.
 *
 * <p>Regions are not nested. A closing {@code }}} inside a single-quoted string literal does not
 * end a region. Precedence from lowest to highest: {@code ||}, {@code &&}, {@code == !=},
 * {@code < <= > >=}, unary {@code !}, postfix ({@code .name}, {@code .*}, {@code [expr]}),
 * primary. A region that cannot be parsed becomes a {@link RawExpression} and one problem; the
 * remaining regions of the scalar are still parsed.</p>
 *
 * <p>The parser is stateless and may be shared between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExpressionParser {

    private static final Logger logger = Logger.getLogger(ExpressionParser.class.getName());

    public static final String RULE_ID = "expressions-syntax";
    public static final String OPEN = "${{";
    public static final String CLOSE = "}}";

    private static final int MAX_DEPTH = 64;

    /**
     * Quick check used to skip scalars without any expression.
     */
    public static boolean containsExpression(String text) {
        return text != null && text.contains(OPEN);
    }

    /**
     * Parses the expressions of a scalar whose value is a verbatim copy of the source starting at
     * {@code baseOffset}.
     */
    public ParsedExpressions parseEmbedded(String text, int baseOffset, IntFunction<Pos> posAt) {
        return parseEmbedded(text, i -> baseOffset + i, posAt);
    }

    /**
     * Parses all {@code ${{ ... }}} regions of {@code text}.
     *
     * @param text     the scalar value
     * @param offsetOf maps an index into {@code text} (up to and including its length) to an
     *                 absolute source offset
     * @param posAt    resolves an absolute source offset to a position
     * @return the parsed regions in order and the syntax problems found
     */
    public ParsedExpressions parseEmbedded(String text, IntUnaryOperator offsetOf, IntFunction<Pos> posAt) {
        if (!containsExpression(text)) {
            return ParsedExpressions.NONE;
        }
        List<EmbeddedExpression> expressions = new ArrayList<>();
        List<Problem> problems = new ArrayList<>();

        int from = 0;
        int open;
        while ((open = text.indexOf(OPEN, from)) >= 0) {
            int innerFrom = open + OPEN.length();
            int close = findClose(text, innerFrom);
            int start = offsetOf.applyAsInt(open);
            Pos pos = posAt.apply(start);

            if (close < 0) {
                int end = endOffset(offsetOf, text.length());
                String inner = text.substring(innerFrom);
                expressions.add(new EmbeddedExpression(inner,
                        new RawExpression(text.substring(open), start, end),
                        start, end, offsetOf.applyAsInt(innerFrom), pos));
                problems.add(Problem.error(pos, "Unterminated expression, missing '" + CLOSE + "'", RULE_ID));
                break;
            }

            String inner = text.substring(innerFrom, close);
            int end = endOffset(offsetOf, close + CLOSE.length());
            int innerStart = offsetOf.applyAsInt(innerFrom);
            Expression root;
            if (inner.isBlank()) {
                root = new RawExpression(text.substring(open, close + CLOSE.length()), start, end);
                problems.add(Problem.error(pos, "Empty expression", RULE_ID));
            } else {
                try {
                    root = new Parser(text, innerFrom, close, offsetOf).parse();
                } catch (ExpressionSyntaxException e) {
                    logger.fine("Unparsable expression '" + inner + "': " + e.getMessage());
                    root = new RawExpression(text.substring(open, close + CLOSE.length()), start, end);
                    problems.add(Problem.error(posAt.apply(e.getOffset()),
                            "Invalid expression '" + inner.trim() + "': " + e.getMessage(), RULE_ID));
                }
            }
            expressions.add(new EmbeddedExpression(inner, root, start, end, innerStart, pos));
            from = close + CLOSE.length();
        }
        return new ParsedExpressions(expressions, problems);
    }

    /**
     * Parses a bare expression (without delimiters). Offsets are relative to the start of
     * {@code expression}.
     *
     * @throws ExpressionSyntaxException if the expression is malformed
     */
    public Expression parse(String expression) throws ExpressionSyntaxException {
        if (expression.isBlank()) {
            throw new ExpressionSyntaxException("Empty expression", 0);
        }
        return new Parser(expression, 0, expression.length(), IntUnaryOperator.identity()).parse();
    }

    static int findClose(String text, int from) {
        boolean inString = false;
        for (int i = from; i + 1 < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                inString = !inString;
            } else if (!inString && c == '}' && text.charAt(i + 1) == '}') {
                return i;
            }
        }
        // An unbalanced quote should not hide a closing delimiter
        return text.indexOf(CLOSE, from);
    }

    private static int endOffset(IntUnaryOperator offsetOf, int index) {
        return index > 0 ? offsetOf.applyAsInt(index - 1) + 1 : offsetOf.applyAsInt(0);
    }

    /**
     * Recursive descent over the tokens of one region.
     */
    private static final class Parser {

        private final List<Token> tokens;
        private final IntUnaryOperator offsetOf;
        private int position;
        private int depth;

        Parser(String text, int from, int to, IntUnaryOperator offsetOf) throws ExpressionSyntaxException {
            this.tokens = new ExpressionLexer(text, from, to, offsetOf).tokenize();
            this.offsetOf = offsetOf;
        }

        Expression parse() throws ExpressionSyntaxException {
            Expression expression = parseOr();
            Token trailing = peek();
            if (!trailing.is(TokenKind.EOF)) {
                throw error("Unexpected '" + trailing.text() + "'", trailing);
            }
            return expression;
        }

        private Expression parseOr() throws ExpressionSyntaxException {
            enter();
            Expression left = parseAnd();
            while (peek().isOperator("||")) {
                advance();
                Expression right = parseAnd();
                left = new BinaryOp(Operator.OR, left, right, left.start(), right.end());
            }
            depth--;
            return left;
        }

        private Expression parseAnd() throws ExpressionSyntaxException {
            Expression left = parseEquality();
            while (peek().isOperator("&&")) {
                advance();
                Expression right = parseEquality();
                left = new BinaryOp(Operator.AND, left, right, left.start(), right.end());
            }
            return left;
        }

        private Expression parseEquality() throws ExpressionSyntaxException {
            Expression left = parseComparison();
            while (peek().isOperator("==") || peek().isOperator("!=")) {
                Operator operator = Operator.fromSymbol(advance().text());
                Expression right = parseComparison();
                left = new BinaryOp(operator, left, right, left.start(), right.end());
            }
            return left;
        }

        private Expression parseComparison() throws ExpressionSyntaxException {
            Expression left = parseUnary();
            while (peek().isOperator("<") || peek().isOperator("<=")
                    || peek().isOperator(">") || peek().isOperator(">=")) {
                Operator operator = Operator.fromSymbol(advance().text());
                Expression right = parseUnary();
                left = new BinaryOp(operator, left, right, left.start(), right.end());
            }
            return left;
        }

        private Expression parseUnary() throws ExpressionSyntaxException {
            if (peek().isOperator("!")) {
                Token bang = advance();
                enter();
                Expression operand = parseUnary();
                depth--;
                return new UnaryOp(Operator.NOT, operand, start(bang), operand.end());
            }
            return parsePostfix();
        }

        private Expression parsePostfix() throws ExpressionSyntaxException {
            Expression base = parsePrimary();
            while (true) {
                Token token = peek();
                if (token.is(TokenKind.DOT)) {
                    advance();
                    Token name = advance();
                    if (!name.is(TokenKind.IDENT) && !name.is(TokenKind.STAR)) {
                        throw error("Expected a property name after '.'", name);
                    }
                    base = property(base, name.text(), start(name), end(name), false);
                } else if (token.is(TokenKind.LBRACKET)) {
                    advance();
                    Expression index = parseOr();
                    Token closing = expect(TokenKind.RBRACKET, "']'");
                    if (base.kind() == Expression.Kind.CONTEXT_REFERENCE && isStringLiteral(index)) {
                        base = property(base, ((Literal) index).value(), index.start(), end(closing), true);
                    } else {
                        base = new BinaryOp(Operator.INDEX, base, index, base.start(), end(closing));
                    }
                } else if (token.is(TokenKind.LPAREN)) {
                    throw error("Only built-in functions can be called", token);
                } else {
                    return base;
                }
            }
        }

        private Expression property(Expression base, String name, int nameOffset, int end, boolean bracketed) {
            if (base.kind() == Expression.Kind.CONTEXT_REFERENCE) {
                ContextReference reference = (ContextReference) base;
                List<PathSegment> segments = new ArrayList<>(reference.segments());
                segments.add(new PathSegment(name, nameOffset, bracketed));
                return new ContextReference(segments, reference.start(), end);
            }
            Literal key = new Literal(LiteralType.STRING, name, nameOffset, end);
            return new BinaryOp(Operator.INDEX, base, key, base.start(), end);
        }

        private Expression parsePrimary() throws ExpressionSyntaxException {
            Token token = advance();
            switch (token.kind()) {
                case LPAREN: {
                    Expression inner = parseOr();
                    expect(TokenKind.RPAREN, "')'");
                    return inner;
                }
                case NUMBER:
                    return new Literal(LiteralType.NUMBER, token.text(), start(token), end(token));
                case STRING:
                    return new Literal(LiteralType.STRING, token.value(), start(token), end(token));
                case IDENT:
                    return identifier(token);
                case EOF:
                    throw error("Unexpected end of expression", token);
                default:
                    throw error("Unexpected '" + token.text() + "'", token);
            }
        }

        private Expression identifier(Token token) throws ExpressionSyntaxException {
            String name = token.text();
            if (peek().is(TokenKind.LPAREN)) {
                advance();
                List<Expression> arguments = new ArrayList<>();
                if (!peek().is(TokenKind.RPAREN)) {
                    arguments.add(parseOr());
                    while (peek().is(TokenKind.COMMA)) {
                        advance();
                        arguments.add(parseOr());
                    }
                }
                Token closing = expect(TokenKind.RPAREN, "')' or ','");
                return new FunctionCall(name, start(token), arguments, start(token), end(closing));
            }
            switch (name) {
                case "true":
                case "false":
                    return new Literal(LiteralType.BOOLEAN, name, start(token), end(token));
                case "null":
                    return new Literal(LiteralType.NULL, name, start(token), end(token));
                default:
                    return new ContextReference(List.of(new PathSegment(name, start(token))),
                            start(token), end(token));
            }
        }

        private static boolean isStringLiteral(Expression expression) {
            return expression.kind() == Expression.Kind.LITERAL
                    && ((Literal) expression).type() == LiteralType.STRING;
        }

        private void enter() throws ExpressionSyntaxException {
            if (++depth > MAX_DEPTH) {
                throw error("Expression is nested too deeply", peek());
            }
        }

        private Token expect(TokenKind kind, String description) throws ExpressionSyntaxException {
            Token token = advance();
            if (!token.is(kind)) {
                String found = token.is(TokenKind.EOF) ? "end of expression" : "'" + token.text() + "'";
                throw error("Expected " + description + " but found " + found, token);
            }
            return token;
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token advance() {
            Token token = tokens.get(position);
            if (!token.is(TokenKind.EOF)) {
                position++;
            }
            return token;
        }

        private int start(Token token) {
            return offsetOf.applyAsInt(token.start());
        }

        private int end(Token token) {
            return token.end() > token.start() ? offsetOf.applyAsInt(token.end() - 1) + 1 : start(token);
        }

        private ExpressionSyntaxException error(String message, Token token) {
            return new ExpressionSyntaxException(message, start(token));
        }
    }
}
