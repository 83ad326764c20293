package plus.wcj.c2flowchart.ir;

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a graph produced by {@link GraphBuilder}. Nodes are in creation order,
 * edges in insertion order.
 */
public record ControlFlowGraph(List<Node> nodes, List<Edge> edges) {
    public ControlFlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<Node> node(long id) {
        if (id < 0 || id >= nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get((int) id));
    }

    public Optional<Node> start() {
        return nodesOfType(NodeType.START).stream().findFirst();
    }

    public Optional<Node> end() {
        return nodesOfType(NodeType.END).stream().findFirst();
    }

    public List<Node> nodesOfType(NodeType type) {
        return nodes.stream().filter(n -> n.type() == type).toList();
    }

    public List<Edge> outgoing(long id) {
        return edges.stream().filter(e -> e.source() == id).toList();
    }

    public List<Edge> incoming(long id) {
        return edges.stream().filter(e -> e.target() == id).toList();
    }

    public Optional<Edge> edge(long source, long target) {
        return edges.stream()
                .filter(e -> e.source() == source && e.target() == target)
                .findFirst();
    }
}
