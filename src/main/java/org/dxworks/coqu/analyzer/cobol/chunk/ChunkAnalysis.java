package org.dxworks.coqu.analyzer.cobol.chunk;

import java.util.List;

/**
 * Facts extracted from one fragment of procedure code. All names are upper case.
 */
public final class ChunkAnalysis {

    private static final ChunkAnalysis EMPTY = new ChunkAnalysis(List.of(), List.of(), List.of(), List.of());

    private final List<String> performs;
    private final List<String> calls;
    private final List<MoveOperation> moves;
    private final List<String> dataRefs;

    public ChunkAnalysis(List<String> performs, List<String> calls, List<MoveOperation> moves, List<String> dataRefs) {
        this.performs = List.copyOf(performs);
        this.calls = List.copyOf(calls);
        this.moves = List.copyOf(moves);
        this.dataRefs = List.copyOf(dataRefs);
    }

    public static ChunkAnalysis empty() {
        return EMPTY;
    }

    /** PERFORM targets followed by GO TO targets, without duplicates. */
    public List<String> getPerforms() {
        return performs;
    }

    public List<String> getCalls() {
        return calls;
    }

    public List<MoveOperation> getMoves() {
        return moves;
    }

    public List<String> getDataRefs() {
        return dataRefs;
    }

    @Override
    public String toString() {
        return "ChunkAnalysis{performs=" + performs + ", calls=" + calls
                + ", moves=" + moves + ", dataRefs=" + dataRefs + "}";
    }
}
