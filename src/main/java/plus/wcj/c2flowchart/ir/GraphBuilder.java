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

package plus.wcj.c2flowchart.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only accumulator for one graph. Owned by a single extraction call and never shared.
 * <p>
 * Holds at most one edge per ordered (source, target) pair. Requesting an existing pair again
 * upgrades an unconditional edge to the requested branch condition, keeping its position; every
 * other combination leaves the stored edge as it is.
 */
public final class GraphBuilder {
    private final List<Node> nodes = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<EdgeKey, Integer> edgeIndex = new HashMap<>();

    public Node addNode(String content, NodeType type) {
        Node node = new Node(nodes.size(), type, content);
        nodes.add(node);
        return node;
    }

    public Edge addEdge(Node source, Node target) {
        return addEdge(source, target, EdgeCondition.NONE);
    }

    public Edge addEdge(Node source, Node target, EdgeCondition condition) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        return addEdge(source.id(), target.id(), condition);
    }

    public Edge addEdge(long source, long target, EdgeCondition condition) {
        requireKnown(source);
        requireKnown(target);
        EdgeCondition requested = condition == null ? EdgeCondition.NONE : condition;
        EdgeKey key = new EdgeKey(source, target);
        Integer existingIndex = edgeIndex.get(key);
        if (existingIndex != null) {
            Edge existing = edges.get(existingIndex);
            if (existing.condition() == EdgeCondition.NONE && requested.isBranch()) {
                Edge upgraded = existing.withCondition(requested);
                edges.set(existingIndex, upgraded);
                return upgraded;
            }
            return existing;
        }
        Edge edge = new Edge(source, target, requested);
        edgeIndex.put(key, edges.size());
        edges.add(edge);
        return edge;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public ControlFlowGraph build() {
        return new ControlFlowGraph(nodes, edges);
    }

    private void requireKnown(long id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("unknown node id " + id);
        }
    }

    private record EdgeKey(long source, long target) {
    }
}
