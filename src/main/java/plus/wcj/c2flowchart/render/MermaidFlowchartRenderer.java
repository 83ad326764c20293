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
import plus.wcj.c2flowchart.ir.NodeType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class MermaidFlowchartRenderer implements DiagramRenderer {
    @Override
    public String id() {
        return "mermaid-flowchart";
    }

    @Override
    public String displayName() {
        return "Mermaid Flowchart";
    }

    @Override
    public String render(ControlFlowGraph graph, RenderOptions options) {
        RenderOptions renderOptions = options == null ? RenderOptions.topDown() : options;
        StringBuilder builder = new StringBuilder();
        builder.append("%%{init: {\"flowchart\": {\"wrappingWidth\": 9999}} }%%").append("\n");
        builder.append("flowchart ").append(renderOptions.direction()).append("\n");
        Map<NodeType, List<String>> byType = new EnumMap<>(NodeType.class);
        for (Node node : graph.nodes()) {
            builder.append("  ").append(nodeId(node.id())).append(nodeShape(node, renderOptions)).append("\n");
            byType.computeIfAbsent(node.type(), k -> new ArrayList<>()).add(nodeId(node.id()));
        }
        builder.append("\n");
        for (Edge edge : graph.edges()) {
            builder.append("  ").append(nodeId(edge.source())).append(formatEdge(edge)).append(nodeId(edge.target())).append("\n");
        }
        builder.append("\n");
        for (Map.Entry<NodeType, List<String>> entry : byType.entrySet()) {
            NodeType type = entry.getKey();
            GraphvizDotRenderer.NodeStyle style = GraphvizDotRenderer.styleOf(type);
            if (style.fillColor() == null) {
                continue;
            }
            builder.append("  classDef ").append(className(type)).append(" fill:").append(style.fillColor()).append(";\n");
            builder.append("  class ").append(String.join(",", entry.getValue())).append(" ").append(className(type)).append(";\n");
        }
        return builder.toString();
    }

    private String nodeId(long id) {
        return "n" + id;
    }

    private String className(NodeType type) {
        return type.key().replace("_", "");
    }

    private String nodeShape(Node node, RenderOptions options) {
        String label = escape(options.truncate(node.content()));
        return switch (node.type()) {
            case START, END -> "([\"%s\"])".formatted(label);
            case CONDITION, LOOP_CONDITION -> "{\"%s\"}".formatted(label);
            default -> "[\"%s\"]".formatted(label);
        };
    }

    private String formatEdge(Edge edge) {
        String label = edge.condition().label();
        if (label.isBlank()) {
            return " --> ";
        }
        return " -- \"" + label + "\" --> ";
    }

    private String escape(String label) {
        if (label == null) {
            return "";
        }
        return label
                .replace("\\", "\\\\")
                // Mermaid renders \" as a quote terminator; use entity instead
                .replace("\"", "&quot;")
                .replace("\n", "<br/>");
    }
}
