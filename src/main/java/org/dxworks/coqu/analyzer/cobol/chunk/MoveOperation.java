package org.dxworks.coqu.analyzer.cobol.chunk;

import java.util.Objects;

/**
 * One {@code MOVE source TO target}. Literal sources keep their quotes.
 */
public final class MoveOperation {

    private final String source;
    private final String target;

    public MoveOperation(String source, String target) {
        this.source = source;
        this.target = target;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MoveOperation)) return false;
        MoveOperation that = (MoveOperation) o;
        return source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
