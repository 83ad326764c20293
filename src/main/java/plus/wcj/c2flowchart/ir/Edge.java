package plus.wcj.c2flowchart.ir;

import java.util.Objects;
import java.util.Optional;

public record Edge(
        long source,
        long target,
        EdgeCondition condition)
{
    public Edge {
        condition = Optional.ofNullable(condition).orElse(EdgeCondition.NONE);
    }

    public Edge withCondition(EdgeCondition newCondition) {
        Objects.requireNonNull(newCondition, "newCondition");
        return new Edge(source, target, newCondition);
    }

    public boolean isSelfLoop() {
        return source == target;
    }
}
