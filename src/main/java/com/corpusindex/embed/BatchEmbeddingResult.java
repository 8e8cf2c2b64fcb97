package com.corpusindex.embed;

import java.util.List;

public record BatchEmbeddingResult(List<EmbeddedChunk> embedded, List<EmbeddingFailure> failures) {

    public int failedChunkCount() {
        return failures.stream().mapToInt(failure -> failure.failedChunkIds().size()).sum();
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
