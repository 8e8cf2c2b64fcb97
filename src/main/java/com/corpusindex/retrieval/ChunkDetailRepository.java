package com.corpusindex.retrieval;

import java.io.IOException;

public interface ChunkDetailRepository extends AutoCloseable {
    ChunkDetailSnapshot snapshot() throws IOException;

    @Override
    void close();
}
