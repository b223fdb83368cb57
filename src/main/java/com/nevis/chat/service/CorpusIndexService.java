package com.nevis.chat.service;

import com.nevis.chat.index.CorpusIndex;

public interface CorpusIndexService {

    /**
     * Returns the process-wide index, building it on first use. Concurrent first callers wait on the same build.
     */
    CorpusIndex getIndex();

    /**
     * Builds a fresh index and swaps it in once complete. Readers keep using the previous index meanwhile.
     */
    CorpusIndex rebuild();

    IndexDiagnostics diagnostics();

    CorpusStats stats();
}
