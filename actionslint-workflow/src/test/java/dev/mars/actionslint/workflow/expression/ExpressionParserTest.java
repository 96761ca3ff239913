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

import dev.mars.actionslint.core.LineMap;
import dev.mars.actionslint.core.Problem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ExpressionParser}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
class ExpressionParserTest {

    private ExpressionParser parser;

    @BeforeEach
    void setUp() {
        parser = new ExpressionParser();
    }

    private ParsedExpressions embedded(String text, int base) {
        String source = " ".repeat(base) + text;
        LineMap lineMap = new LineMap(source);
        return parser.parseEmbedded(text, base, lineMap::posAt);
    }

    @Test
    void testContextReferenceOffsets() {
        ParsedExpressions parsed = embedded("echo ${{ github.ref }}", 10);

        assertTrue(parsed.problems().isEmpty());
        assertEquals(1, parsed.expressions().size());
        EmbeddedExpression expression = parsed.expressions().get(0);
        assertEquals(15, expression.start());
        assertEquals(32, expression.end());
        assertEquals(" github.ref ", expression.text());
        assertTrue(expression.isValid());

        ContextReference reference = (ContextReference) expression.root();
        assertEquals("github.ref", reference.path());
        assertEquals(19, reference.segment(0).offset());
        assertEquals(26, reference.segment(1).offset());
        assertEquals(29, reference.segment(1).end());
    }

    @Test
    void testEverySegmentOffsetPointsAtItsName() {
        String text = "${{ steps.build.outputs.artifact-name }}";
        String source = "run: " + text;
        ParsedExpressions parsed = parser.parseEmbedded(text, 5, new LineMap(source)::posAt);

        ContextReference reference = (ContextReference) parsed.expressions().get(0).root();
        assertEquals(4, reference.size());
        for (PathSegment segment : reference.segments()) {
            assertEquals(segment.name(), source.substring(segment.offset(), segment.end()));
        }
    }

    @Test
    void testOperatorPrecedence() throws ExpressionSyntaxException {
        Expression root = parser.parse("github.event_name == 'push' && !cancelled() || false");

        BinaryOp or = (BinaryOp) root;
        assertEquals(Operator.OR, or.operator());
        BinaryOp and = (BinaryOp) or.left();
        assertEquals(Operator.AND, and.operator());
        BinaryOp equality = (BinaryOp) and.left();
        assertEquals(Operator.EQ, equality.operator());
        assertEquals(Expression.Kind.CONTEXT_REFERENCE, equality.left().kind());
        assertEquals("push", ((Literal) equality.right()).value());
        UnaryOp not = (UnaryOp) and.right();
        assertEquals(Operator.NOT, not.operator());
        assertEquals("cancelled", ((FunctionCall) not.operand()).name());
        assertEquals(LiteralType.BOOLEAN, ((Literal) or.right()).type());
    }

    @Test
    void testFunctionCallArguments() throws ExpressionSyntaxException {
        FunctionCall call = (FunctionCall) parser.parse("format('{0}-{1}', matrix.os, 3.5)");

        assertEquals("format", call.name());
        assertEquals(0, call.nameOffset());
        assertEquals(3, call.arguments().size());
        assertEquals(LiteralType.NUMBER, ((Literal) call.arguments().get(2)).type());
        assertEquals(2, Expressions.contextReferences(call).size() + Expressions.functionCalls(call).size());
    }

    @Test
    void testIndexAndWildcard() throws ExpressionSyntaxException {
        ContextReference bracketed = (ContextReference) parser.parse("github['event_name']");
        assertEquals(2, bracketed.size());
        assertTrue(bracketed.segment(1).bracketed());
        assertEquals("event_name", bracketed.segment(1).name());

        BinaryOp index = (BinaryOp) parser.parse("matrix.include[0]");
        assertEquals(Operator.INDEX, index.operator());

        ContextReference wildcard = (ContextReference) parser.parse("needs.*.result");
        assertTrue(wildcard.segment(1).isWildcard());
        assertEquals("result", wildcard.segment(2).name());
    }

    @Test
    void testStringEscapes() throws ExpressionSyntaxException {
        Literal literal = (Literal) parser.parse("'it''s'");

        assertEquals("it's", literal.value());
    }

    @Test
    void testClosingDelimiterInsideString() {
        ParsedExpressions parsed = embedded("${{ format('}}', github.sha) }}", 0);

        assertTrue(parsed.problems().isEmpty());
        FunctionCall call = (FunctionCall) parsed.expressions().get(0).root();
        assertEquals("}}", ((Literal) call.arguments().get(0)).value());
    }

    @Test
    void testMultipleRegions() {
        ParsedExpressions parsed = embedded("${{ matrix.os }}-${{ matrix.node }}", 0);

        assertEquals(2, parsed.expressions().size());
        assertEquals(17, parsed.expressions().get(1).start());
    }

    @Test
    void testUnterminatedRegion() {
        ParsedExpressions parsed = embedded("echo ${{ github.ref", 0);

        assertEquals(1, parsed.problems().size());
        assertTrue(parsed.problems().get(0).getMessage().startsWith("Unterminated expression"));
        assertFalse(parsed.expressions().get(0).isValid());
        assertEquals(ExpressionParser.RULE_ID, parsed.problems().get(0).getRuleId());
    }

    @Test
    void testEmptyRegion() {
        ParsedExpressions parsed = embedded("${{   }}", 0);

        assertEquals("Empty expression", parsed.problems().get(0).getMessage());
    }

    @Test
    void testInvalidRegionDoesNotStopLaterRegions() {
        ParsedExpressions parsed = embedded("${{ github.ref = 'main' }} ${{ runner.os }}", 0);

        assertEquals(2, parsed.expressions().size());
        assertFalse(parsed.expressions().get(0).isValid());
        assertTrue(parsed.expressions().get(1).isValid());
        List<Problem> problems = parsed.problems();
        assertEquals(1, problems.size());
        assertTrue(problems.get(0).getMessage().contains("did you mean '=='?"));
        assertEquals(15, problems.get(0).getPos().offset());
    }

    @Test
    void testSyntaxErrors() {
        assertThrows(ExpressionSyntaxException.class, () -> parser.parse(""));
        assertThrows(ExpressionSyntaxException.class, () -> parser.parse("github."));
        assertThrows(ExpressionSyntaxException.class, () -> parser.parse("contains(a, b"));
        assertThrows(ExpressionSyntaxException.class, () -> parser.parse("github.ref()"));
        assertThrows(ExpressionSyntaxException.class, () -> parser.parse("'open"));
        assertThrows(ExpressionSyntaxException.class, () -> parser.parse("a b"));
    }

    @Test
    void testNestingLimit() {
        String deep = "(".repeat(100) + "true" + ")".repeat(100);

        ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class, () -> parser.parse(deep));
        assertTrue(e.getMessage().contains("nested too deeply"));
    }

    @Test
    void testNoExpressions() {
        assertSame(ParsedExpressions.NONE, embedded("echo plain", 0));
        assertFalse(ExpressionParser.containsExpression("$ {{ x }}"));
    }
}
