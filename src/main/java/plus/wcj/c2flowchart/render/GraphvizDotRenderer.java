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
import plus.wcj.c2flowchart.ir.EdgeCondition;
import plus.wcj.c2flowchart.ir.Node;
import plus.wcj.c2flowchart.ir.NodeType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Graphviz DOT output. Shape and fill follow the node type, branch edges are labelled and colored.
 */
public class GraphvizDotRenderer implements DiagramRenderer {
    private static final NodeStyle DEFAULT_STYLE = new NodeStyle("box", null);
    private static final Map<NodeType, NodeStyle> STYLES = new EnumMap<>(NodeType.class);

    static {
        STYLES.put(NodeType.START, new NodeStyle("oval", "lightblue"));
        STYLES.put(NodeType.END, new NodeStyle("oval", "lightgreen"));
        STYLES.put(NodeType.STATEMENT, new NodeStyle("box", "white"));
        STYLES.put(NodeType.CONDITION, new NodeStyle("diamond", "lightyellow"));
        STYLES.put(NodeType.LOOP_CONDITION, new NodeStyle("diamond", "lightpink"));
        STYLES.put(NodeType.MERGE, new NodeStyle("box", "lightgray"));
    }

    @Override
    public String id() {
        return "graphviz-dot";
    }

    @Override
    public String displayName() {
        return "Graphviz DOT";
    }

    @Override
    public String render(ControlFlowGraph graph, RenderOptions options) {
        RenderOptions renderOptions = options == null ? RenderOptions.topDown() : options;
        StringBuilder builder = new StringBuilder();
        builder.append("// Control Flow Graph\n");
        builder.append("digraph {\n");
        for (Node node : graph.nodes()) {
            String label = "Node " + node.id() + ": " + escape(renderOptions.truncate(node.content()));
            builder.append("  ").append(node.id())
                    .append(" [label=\"").append(label).append("\"")
                    .append(styleAttributes(node.type()))
                    .append(" width=\"2.5\" height=\"1.2\" fontsize=\"12\"];\n");
        }
        for (Edge edge : graph.edges()) {
            builder.append("  ").append(edge.source()).append(" -> ").append(edge.target());
            if (edge.condition().isBranch()) {
                String color = edge.condition() == EdgeCondition.TRUE ? "green" : "red";
                builder.append(" [label=\"").append(edge.condition().label()).append("\" color=").append(color).append("]");
            }
            builder.append(";\n");
        }
        builder.append("}\n");
        return builder.toString();
    }

    static NodeStyle styleOf(NodeType type) {
        return STYLES.getOrDefault(type, DEFAULT_STYLE);
    }

    private String styleAttributes(NodeType type) {
        NodeStyle style = styleOf(type);
        if (style.fillColor() == null) {
            return " shape=" + style.shape();
        }
        return " shape=" + style.shape() + " style=filled fillcolor=" + style.fillColor();
    }

    private String escape(String label) {
        return label
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
    }

    record NodeStyle(String shape, String fillColor) {
    }
}
