package com.corpusindex.embed;

import java.util.List;

/**
 * A sub-batch that could not be embedded after its retry budget. The listed chunks are left out of
 * the index for this run.
 */
public record EmbeddingFailure(int batchIndex, List<String> failedChunkIds, String cause, int attempts) {
}
