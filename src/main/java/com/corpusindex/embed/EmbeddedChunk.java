package com.corpusindex.embed;

import com.corpusindex.ingest.Chunk;

public record EmbeddedChunk(Chunk chunk, float[] vector) {
}
