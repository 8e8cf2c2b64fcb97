package com.corpusindex.ingest;

import java.util.List;

public record DocumentLoadResult(List<Document> documents, List<DocumentFailure> failures) {
}
