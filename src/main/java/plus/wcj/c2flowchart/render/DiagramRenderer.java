package plus.wcj.c2flowchart.render;

import plus.wcj.c2flowchart.ir.ControlFlowGraph;

public interface DiagramRenderer {
    String id();

    String displayName();

    String render(ControlFlowGraph graph, RenderOptions options);
}
