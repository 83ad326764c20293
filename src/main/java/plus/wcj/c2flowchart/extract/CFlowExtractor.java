/*
 *  Copyright 2025-present The original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       https://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package plus.wcj.c2flowchart.extract;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plus.wcj.c2flowchart.ir.ControlFlowGraph;
import plus.wcj.c2flowchart.ir.EdgeCondition;
import plus.wcj.c2flowchart.ir.GraphBuilder;
import plus.wcj.c2flowchart.ir.Node;
import plus.wcj.c2flowchart.ir.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the control flow graph of the first C-style function definition found in a source text.
 * <p>
 * The graph always starts with a {@code START} node. When a signature is found it is followed by a node holding the
 * signature text, the nodes of the body and a final {@code END} node. Without a signature the graph holds only
 * {@code START}. Instances keep no state between calls.
 */
public class CFlowExtractor implements FlowExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(CFlowExtractor.class);

    private static final Pattern FUNCTION_SIGNATURE = Pattern.compile("(\\w+\\s+\\w+\\s*\\([^)]*\\)\\s*\\{)");

    static final String START_LABEL = "START";
    static final String END_LABEL = "END";

    @Override
    public ControlFlowGraph extract(String source, @Nullable ExtractOptions options) {
        Objects.requireNonNull(source, "source");
        ExtractOptions safeOptions = options != null ? options : ExtractOptions.defaultOptions();
        String code = safeOptions.stripComments() ? CommentStripper.strip(source) : source;

        GraphBuilder graph = new GraphBuilder();
        Node start = graph.addNode(START_LABEL, NodeType.START);
        Matcher signature = FUNCTION_SIGNATURE.matcher(code);
        if (!signature.find()) {
            LOG.warn("No function definition found, graph holds only the start node");
            return graph.build();
        }
        Node function = graph.addNode(signature.group(1), NodeType.STATEMENT);
        graph.addEdge(start, function);

        List<Token> tokens = StatementTokenizer.tokenize(functionBody(code, signature.end()));
        Node exit = new Builder(graph, safeOptions).process(function, tokens, null);
        Node end = graph.addNode(END_LABEL, NodeType.END);
        graph.addEdge(exit, end);

        ControlFlowGraph result = graph.build();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Extracted {} nodes and {} edges from {} tokens", result.nodes().size(), result.edges().size(), tokens.size());
        }
        return result;
    }

    /**
     * Returns the text between {@code bodyStart} and the brace that closes the function, or an empty string when the
     * braces never balance.
     */
    static String functionBody(String code, int bodyStart) {
        int depth = 1;
        for (int i = bodyStart; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return code.substring(bodyStart, i).trim();
                }
            }
        }
        LOG.debug("Function body starting at offset {} is never closed", bodyStart);
        return "";
    }

    private static final class Builder {
        private static final Pattern IF_CONDITION = Pattern.compile("if\\s*\\((.*)\\)", Pattern.DOTALL);
        private static final Pattern WHILE_CONDITION = Pattern.compile("while\\s*\\((.*)\\)", Pattern.DOTALL);
        private static final Pattern FOR_CLAUSES = Pattern.compile("for\\s*\\((.*?);(.*?);(.*?)\\)", Pattern.DOTALL);

        private static final String IF_MERGE = "After If-Else (Merge Node)";
        private static final String FOR_MERGE = "After For Loop (Merge Node)";
        private static final String WHILE_MERGE = "After Loop (Merge Node)";
        private static final String DO_WHILE_MERGE = "After Do-While Loop (Merge Node)";
        private static final String EMPTY_FOR_CONDITION = "true";

        private final GraphBuilder graph;
        private final ExtractOptions options;

        Builder(GraphBuilder graph, ExtractOptions options) {
            this.graph = graph;
            this.options = options;
        }

        /**
         * Wires {@code tokens} after {@code entry} and returns the node where control leaves the block.
         */
        Node process(Node entry, List<Token> tokens, @Nullable LoopContext loop) {
            Node current = entry;
            List<String> pending = new ArrayList<>();
            int i = 0;
            while (i < tokens.size()) {
                Token token = tokens.get(i);
                if (token.isBlank()) {
                    i++;
                    continue;
                }
                if (token.isContinue()) {
                    handleContinue(token, current, loop);
                    i++;
                    continue;
                }
                if (token.isBreak()) {
                    handleBreak(token, current, loop);
                    i++;
                    continue;
                }
                Step step = switch (token.kind()) {
                    case IF -> handleIf(flush(current, pending), tokens, i, loop);
                    case FOR -> handleFor(flush(current, pending), tokens, i, loop);
                    case WHILE -> handleWhile(flush(current, pending), tokens, i, loop);
                    case DO -> handleDoWhile(flush(current, pending), tokens, i, loop);
                    case STATEMENT -> {
                        pending.add(token.text());
                        yield new Step(current, i + 1);
                    }
                    case ELSE, OPEN_BRACE, CLOSE_BRACE -> new Step(current, i + 1);
                };
                current = step.current();
                i = step.next();
            }
            return flush(current, pending);
        }

        // Control stays at the jump's predecessor, so statements after break/continue are still wired sequentially.
        private void handleContinue(Token token, Node current, @Nullable LoopContext loop) {
            if (loop == null) {
                LOG.warn("continue outside loop ignored: {}", token.text());
                return;
            }
            graph.addEdge(current.id(), loop.conditionId(), EdgeCondition.NONE);
        }

        private void handleBreak(Token token, Node current, @Nullable LoopContext loop) {
            if (loop == null) {
                LOG.warn("break outside loop ignored: {}", token.text());
                return;
            }
            graph.addEdge(current.id(), loop.mergeId(), EdgeCondition.NONE);
        }

        private Step handleIf(Node current, List<Token> tokens, int index, @Nullable LoopContext loop) {
            Token header = tokens.get(index);
            Matcher matcher = IF_CONDITION.matcher(header.text());
            if (!matcher.find()) {
                return skip(header, current, index);
            }
            Node condition = graph.addNode(matcher.group(1).trim(), NodeType.CONDITION);
            graph.addEdge(current, condition);

            ClauseExtractor.IfElse clauses = ClauseExtractor.ifElse(tokens, index);
            Node merge = graph.addNode(IF_MERGE, NodeType.MERGE);
            branch(condition, merge, clauses.thenBody(), "If Branch Entry", EdgeCondition.TRUE, loop);
            branch(condition, merge, clauses.elseBody(), "Else Branch Entry", EdgeCondition.FALSE, loop);
            return new Step(merge, clauses.next());
        }

        private void branch(Node condition, Node merge, List<Token> body, String entryLabel, EdgeCondition edge,
                            @Nullable LoopContext loop) {
            if (ClauseExtractor.isBlank(body)) {
                graph.addEdge(condition, merge, edge);
                return;
            }
            Node entry = graph.addNode(entryLabel, NodeType.STATEMENT);
            graph.addEdge(condition, entry, edge);
            Node exit = process(entry, body, loop);
            graph.addEdge(exit, merge);
        }

        private Step handleFor(Node current, List<Token> tokens, int index, @Nullable LoopContext loop) {
            Token header = tokens.get(index);
            Matcher matcher = FOR_CLAUSES.matcher(header.text());
            if (!matcher.find()) {
                return skip(header, current, index);
            }
            String init = matcher.group(1).trim();
            String test = matcher.group(2).trim();
            String update = matcher.group(3).trim();

            Node beforeTest = current;
            if (!init.isEmpty()) {
                Node initNode = graph.addNode(init, NodeType.STATEMENT);
                graph.addEdge(current, initNode);
                beforeTest = initNode;
            }
            Node condition = graph.addNode(test.isEmpty() ? EMPTY_FOR_CONDITION : test, NodeType.LOOP_CONDITION);
            graph.addEdge(beforeTest, condition);

            ClauseExtractor.Clause body = ClauseExtractor.body(tokens, index);
            Node merge = graph.addNode(FOR_MERGE, NodeType.MERGE);
            graph.addEdge(condition, merge, EdgeCondition.FALSE);

            LoopContext frame = new LoopContext(condition.id(), merge.id(), loop);
            if (!body.isEmpty()) {
                Node entry = graph.addNode("For Loop Body Entry", NodeType.STATEMENT);
                graph.addEdge(condition, entry, EdgeCondition.TRUE);
                Node exit = process(entry, body.body(), frame);
                if (!update.isEmpty()) {
                    Node updateNode = graph.addNode(update, NodeType.STATEMENT);
                    graph.addEdge(exit, updateNode);
                    graph.addEdge(updateNode, condition);
                } else {
                    graph.addEdge(exit, condition);
                }
            } else if (!update.isEmpty()) {
                Node updateNode = graph.addNode(update, NodeType.STATEMENT);
                graph.addEdge(condition, updateNode, EdgeCondition.TRUE);
                graph.addEdge(updateNode, condition);
            } else {
                graph.addEdge(condition, condition, EdgeCondition.TRUE);
            }
            return new Step(merge, body.next());
        }

        private Step handleWhile(Node current, List<Token> tokens, int index, @Nullable LoopContext loop) {
            Token header = tokens.get(index);
            Matcher matcher = WHILE_CONDITION.matcher(header.text());
            if (!matcher.find()) {
                return skip(header, current, index);
            }
            Node condition = graph.addNode(matcher.group(1).trim(), NodeType.LOOP_CONDITION);
            graph.addEdge(current, condition);

            ClauseExtractor.Clause body = ClauseExtractor.body(tokens, index);
            Node merge = graph.addNode(WHILE_MERGE, NodeType.MERGE);
            graph.addEdge(condition, merge, EdgeCondition.FALSE);

            LoopContext frame = new LoopContext(condition.id(), merge.id(), loop);
            if (!body.isEmpty()) {
                Node entry = graph.addNode("While Loop Body Entry", NodeType.STATEMENT);
                graph.addEdge(condition, entry, EdgeCondition.TRUE);
                Node exit = process(entry, body.body(), frame);
                graph.addEdge(exit, condition);
            } else {
                graph.addEdge(condition, condition, EdgeCondition.TRUE);
            }
            return new Step(merge, body.next());
        }

        private Step handleDoWhile(Node current, List<Token> tokens, int index, @Nullable LoopContext loop) {
            ClauseExtractor.DoWhile clauses = ClauseExtractor.doWhile(tokens, index);
            String test = clauses.condition();
            if (test.isEmpty()) {
                LOG.debug("do-while without a readable condition, using '{}'", options.doWhileFallbackCondition());
                test = options.doWhileFallbackCondition();
            }
            Node entry = graph.addNode("do", NodeType.STATEMENT);
            graph.addEdge(current, entry);

            // The body sees only the enclosing loop: this loop's frame does not exist until its test node does.
            Node exit = ClauseExtractor.isBlank(clauses.body()) ? entry : process(entry, clauses.body(), loop);

            Node condition = graph.addNode(test, NodeType.LOOP_CONDITION);
            graph.addEdge(exit, condition);
            Node merge = graph.addNode(DO_WHILE_MERGE, NodeType.MERGE);
            graph.addEdge(condition, entry, EdgeCondition.TRUE);
            graph.addEdge(condition, merge, EdgeCondition.FALSE);
            return new Step(merge, clauses.next());
        }

        private Step skip(Token header, Node current, int index) {
            LOG.debug("Skipping {} header without a readable condition: {}", header.kind(), header.text());
            return new Step(current, index + 1);
        }

        private Node flush(Node current, List<String> pending) {
            if (pending.isEmpty()) {
                return current;
            }
            Node statement = graph.addNode(String.join("\n", pending), NodeType.STATEMENT);
            graph.addEdge(current, statement);
            pending.clear();
            return statement;
        }
    }

    private record Step(Node current, int next) {
    }

    /**
     * Innermost enclosing loop; {@code parent} links to the loop around it.
     */
    private record LoopContext(long conditionId, long mergeId, @Nullable LoopContext parent) {
    }
}
