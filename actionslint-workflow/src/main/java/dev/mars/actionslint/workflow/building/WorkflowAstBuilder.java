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
import dev.mars.actionslint.workflow.ast.Job;
import dev.mars.actionslint.workflow.ast.ScalarStyle;
import dev.mars.actionslint.workflow.ast.SourceString;
import dev.mars.actionslint.workflow.ast.Step;
import dev.mars.actionslint.workflow.ast.Workflow;
import dev.mars.actionslint.workflow.ast.YamlMapping;
import dev.mars.actionslint.workflow.ast.YamlNode;
import dev.mars.actionslint.workflow.ast.YamlSequence;
import dev.mars.actionslint.workflow.expression.ExpressionParser;
import dev.mars.actionslint.workflow.expression.ParsedExpressions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.function.IntUnaryOperator;
import java.util.logging.Logger;

/**
 * Builds the {@link Workflow} AST from a {@link YamlToken} stream.
 *
 * <p>The builder keeps an explicit stack of frames. A start token pushes a frame whose kind is
 * inferred from the parent frame and the pending key (a mapping under {@code jobs} is a job
 * table, a sequence under a job's {@code steps} is a step list, and so on); an end token pops the
 * frame and attaches its node to the parent. Unknown keys are kept in the raw mappings.</p>
 *
 * <p>Malformed streams never make the builder throw. Shape errors, mismatched or unmatched end
 * tokens, keys without values, non-scalar keys and unclosed collections become problems with rule
 * {@value #STRUCTURE_RULE} and the builder substitutes placeholders. Duplicate keys become
 * {@value #DUPLICATE_KEY_RULE} problems; the first entry is kept and later ones are dropped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowAstBuilder {

    private static final Logger logger = Logger.getLogger(WorkflowAstBuilder.class.getName());

    public static final String STRUCTURE_RULE = "syntax-error";
    public static final String DUPLICATE_KEY_RULE = "syntax-duplicate-key";

    private final ExpressionParser expressionParser;

    public WorkflowAstBuilder() {
        this(new ExpressionParser());
    }

    public WorkflowAstBuilder(ExpressionParser expressionParser) {
        this.expressionParser = Objects.requireNonNull(expressionParser, "Expression parser cannot be null");
    }

    /**
     * Builds the workflow.
     *
     * @param source the text the tokens were produced from, or {@code null} for synthetic token
     *               streams, in which case scalar offsets are derived from the token positions
     * @param tokens the token stream
     * @return the workflow, possibly partial, and the structural problems in token order
     */
    public BuildResult build(String source, List<YamlToken> tokens) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        Session session = new Session(source);
        for (YamlToken token : tokens) {
            session.accept(token);
        }
        Workflow workflow = session.finish();
        logger.fine("Built workflow with " + workflow.getJobs().size() + " job(s) and "
                + session.problems.size() + " structural problem(s)");
        return new BuildResult(workflow, session.problems);
    }

    enum FrameKind {
        DOCUMENT(Shape.NONE),
        WORKFLOW(Shape.MAPPING),
        JOBS(Shape.MAPPING),
        JOB(Shape.MAPPING),
        NEEDS(Shape.SEQUENCE),
        STEPS(Shape.SEQUENCE),
        STEP(Shape.MAPPING),
        GENERIC_MAPPING(Shape.MAPPING),
        GENERIC_SEQUENCE(Shape.SEQUENCE);

        private final Shape shape;

        FrameKind(Shape shape) {
            this.shape = shape;
        }

        boolean isMapping() {
            return shape == Shape.MAPPING;
        }

        boolean isSequence() {
            return shape == Shape.SEQUENCE;
        }
    }

    private enum Shape {
        NONE,
        MAPPING,
        SEQUENCE
    }

    /**
     * An open collection (or the document) under construction.
     */
    private static final class Frame {
        final FrameKind kind;
        final Pos start;
        final List<YamlMapping.Entry> entries = new ArrayList<>();
        final List<YamlNode> items = new ArrayList<>();
        final Map<String, SourceString> seenKeys = new HashMap<>();
        SourceString pendingKey;
        boolean discardValue;

        // Domain objects gathered from children
        final List<Job> jobs = new ArrayList<>();
        final List<Step> steps = new ArrayList<>();
        final List<SourceString> needs = new ArrayList<>();
        YamlNode root;
        List<Job> rootJobs = List.of();

        Frame(FrameKind kind, Pos start) {
            this.kind = kind;
            this.start = start;
        }

        String describe() {
            return kind.isMapping() ? "mapping" : "sequence";
        }
    }

    /**
     * State of one build.
     */
    private final class Session {
        private final String source;
        private final LineMap lineMap;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final List<Problem> problems = new ArrayList<>();
        private Frame document;
        private boolean documentClosed;
        private boolean extraDocumentReported;
        private boolean skippingDocument;
        private Pos lastPos = Pos.START;

        Session(String source) {
            this.source = source;
            this.lineMap = source != null ? new LineMap(source) : null;
        }

        void accept(YamlToken token) {
            if (skippingDocument) {
                if (token.isMarker(YamlToken.DOCUMENT_END)) {
                    skippingDocument = false;
                }
                return;
            }
            switch (token.type()) {
                case BLOCK_MARKER:
                    acceptMarker(token);
                    break;
                case MAPPING_START:
                case SEQUENCE_START:
                    if (ensureDocument(token)) {
                        openFrame(token);
                    }
                    break;
                case MAPPING_END:
                case SEQUENCE_END:
                    closeMatching(token);
                    break;
                case SCALAR:
                    if (ensureDocument(token)) {
                        attach(toSourceString(token), null);
                    }
                    break;
                default:
                    break;
            }
            lastPos = token.end();
        }

        private void acceptMarker(YamlToken token) {
            if (token.isMarker(YamlToken.DOCUMENT_START)) {
                if (document != null) {
                    reportExtraDocument(token.start());
                    skippingDocument = true;
                    return;
                }
                document = new Frame(FrameKind.DOCUMENT, token.start());
                stack.push(document);
            } else if (token.isMarker(YamlToken.DOCUMENT_END)) {
                closeDocument(token.start(), true);
            }
        }

        /**
         * Makes sure content has a document to go to. Returns false when the token belongs to
         * content after the first document and must be ignored.
         */
        private boolean ensureDocument(YamlToken token) {
            if (document == null) {
                document = new Frame(FrameKind.DOCUMENT, token.start());
                stack.push(document);
                return true;
            }
            if (documentClosed) {
                reportExtraDocument(token.start());
                return false;
            }
            return true;
        }

        private void reportExtraDocument(Pos pos) {
            if (!extraDocumentReported) {
                extraDocumentReported = true;
                problems.add(Problem.error(pos,
                        "Only a single YAML document is supported; additional documents are ignored",
                        STRUCTURE_RULE));
            }
        }

        private void openFrame(YamlToken token) {
            boolean mapping = token.type() == TokenType.MAPPING_START;
            Frame parent = stack.peek();
            FrameKind kind = childKind(parent, mapping, token.start());
            stack.push(new Frame(kind, token.start()));
        }

        /**
         * Infers the kind of a new collection from its parent and reports collections of the
         * wrong shape.
         */
        private FrameKind childKind(Frame parent, boolean mapping, Pos pos) {
            FrameKind generic = mapping ? FrameKind.GENERIC_MAPPING : FrameKind.GENERIC_SEQUENCE;
            if (parent.kind.isMapping() && parent.pendingKey == null) {
                // A collection used as a key; reported when it is attached
                return generic;
            }
            String key = parent.pendingKey != null ? parent.pendingKey.getValue() : null;
            switch (parent.kind) {
                case DOCUMENT:
                    if (parent.root != null) {
                        return generic;
                    }
                    if (!mapping) {
                        structural(pos, "Workflow root must be a mapping");
                    }
                    return mapping ? FrameKind.WORKFLOW : generic;
                case WORKFLOW:
                    if (Workflow.JOBS.equals(key)) {
                        if (!mapping) {
                            structural(pos, "'jobs' must be a mapping of job ids to jobs");
                        }
                        return mapping ? FrameKind.JOBS : generic;
                    }
                    return generic;
                case JOBS:
                    if (!mapping) {
                        structural(pos, "Job '" + key + "' must be a mapping");
                    }
                    return mapping ? FrameKind.JOB : generic;
                case JOB:
                    if (Job.STEPS.equals(key)) {
                        if (mapping) {
                            structural(pos, "'steps' must be a sequence of steps");
                        }
                        return mapping ? generic : FrameKind.STEPS;
                    }
                    if (Job.NEEDS.equals(key)) {
                        if (mapping) {
                            structural(pos, "'needs' must be a job id or a list of job ids");
                        }
                        return mapping ? generic : FrameKind.NEEDS;
                    }
                    return generic;
                case STEPS:
                    if (!mapping) {
                        structural(pos, "Step must be a mapping");
                    }
                    return mapping ? FrameKind.STEP : generic;
                case NEEDS:
                    structural(pos, "'needs' entries must be job ids");
                    return generic;
                default:
                    return generic;
            }
        }

        private void closeMatching(YamlToken token) {
            boolean mapping = token.type() == TokenType.MAPPING_END;
            String expected = mapping ? "mapping" : "sequence";
            Frame match = null;
            for (Frame frame : stack) {
                if (frame.kind == FrameKind.DOCUMENT) {
                    break;
                }
                if (mapping ? frame.kind.isMapping() : frame.kind.isSequence()) {
                    match = frame;
                    break;
                }
            }
            if (match == null) {
                structural(token.start(), "Unexpected end of " + expected + " with no open " + expected);
                return;
            }
            while (stack.peek() != match) {
                Frame unclosed = stack.peek();
                structural(unclosed.start, "Unclosed " + unclosed.describe() + " started at " + unclosed.start
                        + " (found end of " + expected + " at " + token.start() + ")");
                closeTop();
            }
            closeTop();
        }

        private void closeTop() {
            Frame frame = stack.peek();
            if (frame.kind.isMapping() && frame.pendingKey != null) {
                SourceString key = frame.pendingKey;
                if (!frame.discardValue) {
                    structural(key.getPos(), "Key '" + key.getValue() + "' has no value");
                }
                attach(SourceString.placeholder(endOf(key)), null);
            }
            stack.pop();
            YamlNode node = frame.kind.isMapping()
                    ? new YamlMapping(frame.start, frame.entries)
                    : new YamlSequence(frame.start, frame.items);
            attach(node, frame);
        }

        /**
         * Adds a finished node to the frame on top of the stack.
         *
         * @param closed the frame the node was built from, {@code null} for scalars
         */
        private void attach(YamlNode node, Frame closed) {
            Frame top = stack.peek();
            if (top.kind == FrameKind.DOCUMENT) {
                attachToDocument(top, node, closed);
            } else if (top.kind.isMapping()) {
                attachToMapping(top, node, closed);
            } else {
                attachToSequence(top, node, closed);
            }
        }

        private void attachToDocument(Frame top, YamlNode node, Frame closed) {
            if (top.root != null) {
                structural(node.getPos(), "Unexpected content after the workflow root");
                return;
            }
            top.root = node;
            if (closed != null && closed.kind == FrameKind.WORKFLOW) {
                top.rootJobs = closed.jobs;
            } else if (node.isScalar() && !((SourceString) node).isEmpty()) {
                structural(node.getPos(), "Workflow root must be a mapping");
            }
        }

        private void attachToMapping(Frame top, YamlNode node, Frame closed) {
            if (top.pendingKey == null) {
                if (!node.isScalar()) {
                    structural(node.getPos(), "Mapping keys must be scalars");
                    top.pendingKey = SourceString.placeholder(node.getPos());
                    top.discardValue = true;
                    return;
                }
                SourceString key = (SourceString) node;
                top.pendingKey = key;
                SourceString first = top.seenKeys.putIfAbsent(key.getValue(), key);
                if (first != null) {
                    top.discardValue = true;
                    problems.add(Problem.error(key.getPos(), duplicateMessage(top, key, first), DUPLICATE_KEY_RULE));
                }
                return;
            }

            SourceString key = top.pendingKey;
            boolean discard = top.discardValue;
            top.pendingKey = null;
            top.discardValue = false;
            if (discard) {
                return;
            }
            interpretValue(top, key, node, closed);
            top.entries.add(new YamlMapping.Entry(key, node));
        }

        private String duplicateMessage(Frame top, SourceString key, SourceString first) {
            if (top.kind == FrameKind.JOBS) {
                return "Duplicate job id '" + key.getValue() + "'; the job declared at " + first.getPos() + " is kept";
            }
            return "Duplicate key '" + key.getValue() + "'; the entry at " + first.getPos() + " is kept";
        }

        private void interpretValue(Frame top, SourceString key, YamlNode node, Frame closed) {
            switch (top.kind) {
                case WORKFLOW:
                    if (Workflow.JOBS.equals(key.getValue())) {
                        if (closed != null && closed.kind == FrameKind.JOBS) {
                            top.jobs.addAll(closed.jobs);
                        } else if (isNonEmptyScalar(node)) {
                            structural(node.getPos(), "'jobs' must be a mapping of job ids to jobs");
                        }
                    }
                    break;
                case JOBS:
                    if (closed != null && closed.kind == FrameKind.JOB) {
                        top.jobs.add(Job.of(key, (YamlMapping) node, closed.needs, closed.steps));
                    } else {
                        if (node.isScalar()) {
                            structural(key.getPos(), "Job '" + key.getValue() + "' must be a mapping");
                        }
                        top.jobs.add(Job.placeholder(key, node.getPos()));
                    }
                    break;
                case JOB:
                    if (Job.NEEDS.equals(key.getValue())) {
                        if (closed != null && closed.kind == FrameKind.NEEDS) {
                            top.needs.addAll(closed.needs);
                        } else if (isNonEmptyScalar(node)) {
                            top.needs.add((SourceString) node);
                        }
                    } else if (Job.STEPS.equals(key.getValue())) {
                        if (closed != null && closed.kind == FrameKind.STEPS) {
                            top.steps.addAll(closed.steps);
                        } else if (isNonEmptyScalar(node)) {
                            structural(node.getPos(), "'steps' must be a sequence of steps");
                        }
                    }
                    break;
                default:
                    break;
            }
        }

        private void attachToSequence(Frame top, YamlNode node, Frame closed) {
            if (top.kind == FrameKind.STEPS) {
                int index = top.items.size();
                if (closed != null && closed.kind == FrameKind.STEP) {
                    top.steps.add(Step.of(index, (YamlMapping) node));
                } else {
                    if (node.isScalar()) {
                        structural(node.getPos(), "Step must be a mapping");
                    }
                    top.steps.add(Step.placeholder(index, node.getPos()));
                }
            } else if (top.kind == FrameKind.NEEDS && node.isScalar()) {
                top.needs.add((SourceString) node);
            }
            top.items.add(node);
        }

        private void closeDocument(Pos at, boolean explicit) {
            if (document == null || documentClosed) {
                return;
            }
            int open = 0;
            while (stack.peek() != document) {
                Frame unclosed = stack.peek();
                if (explicit) {
                    structural(unclosed.start, "Unclosed " + unclosed.describe() + " started at " + unclosed.start);
                }
                open++;
                closeTop();
            }
            if (!explicit && open > 0) {
                structural(at, "Unexpected end of input with " + open + " unclosed collection(s)");
            }
            stack.pop();
            documentClosed = true;
        }

        Workflow finish() {
            closeDocument(lastPos, false);
            if (document == null || document.root == null
                    || (document.root.isScalar() && ((SourceString) document.root).isEmpty())) {
                problems.add(Problem.error(document != null ? document.start : Pos.START,
                        "Workflow document is empty", STRUCTURE_RULE));
                return Workflow.empty();
            }
            if (!document.root.isMapping()) {
                return Workflow.empty();
            }
            return new Workflow((YamlMapping) document.root, document.rootJobs);
        }

        private SourceString toSourceString(YamlToken token) {
            String value = token.value();
            ScalarStyle style = token.style();
            Pos contentStart = style.isQuoted() ? posAt(token.start().offset() + 1, token.start()) : token.start();
            int sourceEnd = token.end().offset();

            if (!ExpressionParser.containsExpression(value)) {
                return new SourceString(value, contentStart, sourceEnd, style, List.of());
            }
            IntUnaryOperator offsetOf = source != null
                    ? ValueOffsets.of(source, contentStart.offset(), sourceEnd, value)
                    : ValueOffsets.shifted(contentStart.offset());
            IntFunction<Pos> positions = offset -> posAt(offset, contentStart);
            ParsedExpressions parsed = expressionParser.parseEmbedded(value, offsetOf, positions);
            problems.addAll(parsed.problems());
            return new SourceString(value, contentStart, sourceEnd, style, parsed.expressions());
        }

        /**
         * Position of {@code offset}. Without a source, positions are extrapolated on the line of
         * {@code anchor}.
         */
        private Pos posAt(int offset, Pos anchor) {
            if (lineMap != null) {
                return lineMap.posAt(Math.max(0, Math.min(offset, lineMap.length())));
            }
            int delta = offset - anchor.offset();
            return delta >= 0 ? anchor.shift(delta) : anchor;
        }

        private Pos endOf(SourceString key) {
            int end = key.getPos().offset() + key.getValue().length();
            return posAt(end, key.getPos());
        }

        private void structural(Pos pos, String message) {
            problems.add(Problem.error(pos, message, STRUCTURE_RULE));
        }

        private boolean isNonEmptyScalar(YamlNode node) {
            return node.isScalar() && !((SourceString) node).isEmpty();
        }
    }
}
