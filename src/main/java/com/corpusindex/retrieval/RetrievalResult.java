package com.corpusindex.retrieval;

import java.util.List;

public record RetrievalResult(String indexVersion, List<HydratedChunk> chunks, List<RetrievalIntegrityWarning> warnings) {
}
