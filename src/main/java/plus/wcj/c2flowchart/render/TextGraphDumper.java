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

package plus.wcj.c2flowchart.render;

import plus.wcj.c2flowchart.ir.ControlFlowGraph;
import plus.wcj.c2flowchart.ir.Edge;
import plus.wcj.c2flowchart.ir.Node;

/**
 * Plain listing of nodes in creation order and edges in insertion order. Content is printed in full; the options
 * are ignored.
 */
public class TextGraphDumper implements DiagramRenderer {
    @Override
    public String id() {
        return "text-dump";
    }

    @Override
    public String displayName() {
        return "Text Dump";
    }

    @Override
    public String render(ControlFlowGraph graph, RenderOptions options) {
        StringBuilder builder = new StringBuilder();
        builder.append("Control Flow Graph:\n");
        builder.append("Nodes:\n");
        for (Node node : graph.nodes()) {
            builder.append("Node ").append(node.id())
                    .append(" (").append(node.type().key()).append("): ")
                    .append(node.content()).append("\n");
        }
        builder.append("\nEdges:\n");
        for (Edge edge : graph.edges()) {
            builder.append("Edge: ").append(edge.source()).append(" -> ").append(edge.target());
            if (edge.condition().isBranch()) {
                builder.append(" (Condition: ").append(edge.condition().label()).append(")");
            }
            builder.append("\n");
        }
        return builder.toString();
    }
}
