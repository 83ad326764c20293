package plus.wcj.c2flowchart.extract;

import plus.wcj.c2flowchart.ir.ControlFlowGraph;

public interface FlowExtractor {
    ControlFlowGraph extract(String source, ExtractOptions options);
}
