package plus.wcj.c2flowchart.render;

import org.junit.jupiter.api.Test;
import plus.wcj.c2flowchart.ir.NodeType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphvizDotRendererTest {

    private final GraphvizDotRenderer renderer = new GraphvizDotRenderer();

    @Test
    void rendersStyledNodesAndColoredBranches() {
        String dot = renderer.render(RendererTestGraphs.ifWithoutElse(), RenderOptions.topDown());

        assertTrue(dot.startsWith("// Control Flow Graph\ndigraph {\n"), dot);
        assertTrue(dot.endsWith("}\n"), dot);
        assertTrue(dot.contains("  0 [label=\"Node 0: START\" shape=oval style=filled fillcolor=lightblue width=\"2.5\" height=\"1.2\" fontsize=\"12\"];\n"), dot);
        assertTrue(dot.contains("  1 [label=\"Node 1: x > 0\" shape=diamond style=filled fillcolor=lightyellow"), dot);
        assertTrue(dot.contains("  2 [label=\"Node 2: y = 1;\" shape=box style=filled fillcolor=white"), dot);
        assertTrue(dot.contains("  3 [label=\"Node 3: m\" shape=box style=filled fillcolor=lightgray"), dot);
        assertTrue(dot.contains("  4 [label=\"Node 4: END\" shape=oval style=filled fillcolor=lightgreen"), dot);
        assertTrue(dot.contains("  0 -> 1;\n"), dot);
        assertTrue(dot.contains("  1 -> 2 [label=\"True\" color=green];\n"), dot);
        assertTrue(dot.contains("  1 -> 3 [label=\"False\" color=red];\n"), dot);
    }

    @Test
    void loopConditionIsPinkDiamond() {
        assertEquals(new GraphvizDotRenderer.NodeStyle("diamond", "lightpink"), GraphvizDotRenderer.styleOf(NodeType.LOOP_CONDITION));
    }

    @Test
    void truncatesLongLabels() {
        String dot = renderer.render(RendererTestGraphs.single("a".repeat(60), NodeType.STATEMENT), RenderOptions.topDown());

        assertTrue(dot.contains("label=\"Node 0: " + "a".repeat(47) + "...\""), dot);
    }

    @Test
    void labelAtLimitIsKept() {
        String dot = renderer.render(RendererTestGraphs.single("b".repeat(50), NodeType.STATEMENT), RenderOptions.topDown());

        assertTrue(dot.contains("label=\"Node 0: " + "b".repeat(50) + "\""), dot);
    }

    @Test
    void escapesQuotesBackslashesAndNewlines() {
        String dot = renderer.render(RendererTestGraphs.single("printf(\"hi\\n\");\nx++;", NodeType.STATEMENT),
                RenderOptions.topDown());

        assertTrue(dot.contains("label=\"Node 0: printf(\\\"hi\\\\n\\\");\\nx++;\""), dot);
    }
}
