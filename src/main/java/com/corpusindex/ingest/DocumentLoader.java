package com.corpusindex.ingest;

import java.io.IOException;

public interface DocumentLoader {
    /**
     * Loads every supported document. Per-document problems are reported in the result; only a
     * problem with the source as a whole is thrown.
     */
    DocumentLoadResult loadAll() throws IOException;
}
