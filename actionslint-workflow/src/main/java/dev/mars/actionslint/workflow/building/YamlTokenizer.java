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

package dev.mars.actionslint.workflow.building;

import dev.mars.actionslint.core.LineMap;
import dev.mars.actionslint.core.Pos;
import dev.mars.actionslint.core.Problem;
import dev.mars.actionslint.workflow.ast.ScalarStyle;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.events.AliasEvent;
import org.yaml.snakeyaml.events.Event;
import org.yaml.snakeyaml.events.ScalarEvent;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Adapts SnakeYAML's event parser to the {@link YamlToken} stream consumed by
 * {@link WorkflowAstBuilder}.
 *
 * <p>SnakeYAML marks count code points; they are translated to UTF-16 offsets here, and every
 * position is resolved through a {@link LineMap} of the source. A syntax error ends the stream with
 * one {@code syntax-error} problem; aliases are passed on as scalars with a warning.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlTokenizer {

    private static final Logger logger = Logger.getLogger(YamlTokenizer.class.getName());

    public static final String SYNTAX_RULE = "syntax-error";
    public static final String ALIAS_RULE = "syntax-alias";

    private final Yaml yaml;

    public YamlTokenizer() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    /**
     * Tokenizes {@code source}. Never throws for malformed input.
     */
    public TokenStream tokenize(String source) {
        Objects.requireNonNull(source, "Source cannot be null");
        LineMap lineMap = new LineMap(source);
        CodePoints codePoints = new CodePoints(source);
        List<YamlToken> tokens = new ArrayList<>();
        List<Problem> problems = new ArrayList<>();

        try {
            for (Event event : yaml.parse(new StringReader(source))) {
                Pos start = position(event.getStartMark(), lineMap, codePoints);
                Pos end = position(event.getEndMark(), lineMap, codePoints);
                YamlToken token = adapt(event, start, end);
                if (token == null) {
                    continue;
                }
                if (token.alias()) {
                    problems.add(Problem.warning(start,
                            "Alias '" + token.value() + "' is not expanded; its value is linted as plain text",
                            ALIAS_RULE));
                }
                tokens.add(token);
            }
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark() != null ? e.getProblemMark() : e.getContextMark();
            Pos pos = mark != null ? position(mark, lineMap, codePoints) : lastPosition(tokens);
            String problem = e.getProblem() != null ? e.getProblem() : e.getMessage();
            logger.fine("YAML syntax error at " + pos + ": " + problem);
            problems.add(Problem.error(pos, "Invalid YAML: " + problem, SYNTAX_RULE));
        } catch (YAMLException e) {
            Pos pos = lastPosition(tokens);
            logger.fine("YAML error at " + pos + ": " + e.getMessage());
            problems.add(Problem.error(pos, "Invalid YAML: " + e.getMessage(), SYNTAX_RULE));
        }
        return new TokenStream(tokens, problems);
    }

    private static YamlToken adapt(Event event, Pos start, Pos end) {
        switch (event.getEventId()) {
            case StreamStart:
                return YamlToken.marker(YamlToken.STREAM_START, start, end);
            case StreamEnd:
                return YamlToken.marker(YamlToken.STREAM_END, start, end);
            case DocumentStart:
                return YamlToken.marker(YamlToken.DOCUMENT_START, start, end);
            case DocumentEnd:
                return YamlToken.marker(YamlToken.DOCUMENT_END, start, end);
            case MappingStart:
                return YamlToken.of(TokenType.MAPPING_START, start, end);
            case MappingEnd:
                return YamlToken.of(TokenType.MAPPING_END, start, end);
            case SequenceStart:
                return YamlToken.of(TokenType.SEQUENCE_START, start, end);
            case SequenceEnd:
                return YamlToken.of(TokenType.SEQUENCE_END, start, end);
            case Scalar: {
                ScalarEvent scalar = (ScalarEvent) event;
                return YamlToken.scalar(scalar.getValue(), start, end, style(scalar.getScalarStyle()));
            }
            case Alias:
                return YamlToken.alias(((AliasEvent) event).getAnchor(), start, end);
            default:
                return null;
        }
    }

    private static ScalarStyle style(DumperOptions.ScalarStyle style) {
        if (style == null) {
            return ScalarStyle.PLAIN;
        }
        switch (style) {
            case SINGLE_QUOTED:
                return ScalarStyle.SINGLE_QUOTED;
            case DOUBLE_QUOTED:
                return ScalarStyle.DOUBLE_QUOTED;
            case LITERAL:
                return ScalarStyle.LITERAL;
            case FOLDED:
                return ScalarStyle.FOLDED;
            default:
                return ScalarStyle.PLAIN;
        }
    }

    private static Pos position(Mark mark, LineMap lineMap, CodePoints codePoints) {
        if (mark == null) {
            return Pos.START;
        }
        return lineMap.posAt(codePoints.toCharOffset(mark.getIndex()));
    }

    private static Pos lastPosition(List<YamlToken> tokens) {
        return tokens.isEmpty() ? Pos.START : tokens.get(tokens.size() - 1).end();
    }

    /**
     * Code point index to UTF-16 offset translation. Identity unless the source contains
     * supplementary characters.
     */
    private static final class CodePoints {

        private final int length;
        private final int[] charOffsets;

        CodePoints(String source) {
            this.length = source.length();
            int count = source.codePointCount(0, length);
            if (count == length) {
                this.charOffsets = null;
                return;
            }
            this.charOffsets = new int[count + 1];
            int offset = 0;
            for (int i = 0; i < count; i++) {
                charOffsets[i] = offset;
                offset += Character.charCount(source.codePointAt(offset));
            }
            charOffsets[count] = length;
        }

        int toCharOffset(int codePointIndex) {
            if (charOffsets == null) {
                return Math.max(0, Math.min(codePointIndex, length));
            }
            return charOffsets[Math.max(0, Math.min(codePointIndex, charOffsets.length - 1))];
        }
    }
}
