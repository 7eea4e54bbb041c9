package org.dxworks.coqu.analyzer.cobol.index;

/**
 * Synchronous progress callback invoked from inside the indexer's scan loop.
 */
@FunctionalInterface
public interface IndexProgressListener {

    IndexProgressListener NONE = (stage, percent) -> { };

    /**
     * @param stage   scan stage being worked on ("divisions", "paragraphs", ...)
     * @param percent overall completion, 0..100
     */
    void onProgress(String stage, int percent);
}
