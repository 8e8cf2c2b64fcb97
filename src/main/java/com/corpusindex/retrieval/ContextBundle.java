package com.corpusindex.retrieval;

import java.util.List;
import java.util.Locale;

/**
 * Retrieved chunks in the form handed to the generation step: numbered snippets, each naming the
 * document it came from.
 */
public record ContextBundle(String indexVersion, List<HydratedChunk> chunks) {

    public static ContextBundle from(RetrievalResult result) {
        return new ContextBundle(result.indexVersion(), result.chunks());
    }

    public List<String> citedDocuments() {
        return chunks.stream().map(HydratedChunk::documentName).distinct().toList();
    }

    public String render() {
        if (chunks.isEmpty()) {
            return "(no retrieved context)";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            HydratedChunk chunk = chunks.get(i);
            builder.append('[')
                    .append(i + 1)
                    .append("] ")
                    .append(chunk.citation())
                    .append(" (score ")
                    .append(String.format(Locale.ROOT, "%.4f", chunk.score()))
                    .append("): ")
                    .append(chunk.text().strip())
                    .append('\n');
        }
        return builder.toString();
    }
}
