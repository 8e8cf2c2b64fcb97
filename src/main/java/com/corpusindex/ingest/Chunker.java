package com.corpusindex.ingest;

import java.util.ArrayList;
import java.util.List;

import com.corpusindex.runtime.ConfigurationException;

public class Chunker {
    static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", ". ", "? ", "! ", " ");

    private final int maxSize;
    private final int overlap;
    private final ChunkIdStrategy idStrategy;
    private final List<String> separators;

    public Chunker(int maxSize, int overlap, ChunkIdStrategy idStrategy) {
        this(maxSize, overlap, idStrategy, DEFAULT_SEPARATORS);
    }

    public Chunker(int maxSize, int overlap, ChunkIdStrategy idStrategy, List<String> separators) {
        if (maxSize <= 0) {
            throw new ConfigurationException("chunk maxSize must be positive but was " + maxSize);
        }
        if (overlap < 0 || overlap >= maxSize) {
            throw new ConfigurationException("chunk overlap must be in [0, " + maxSize + ") but was " + overlap);
        }
        this.maxSize = maxSize;
        this.overlap = overlap;
        this.idStrategy = idStrategy;
        this.separators = List.copyOf(separators);
    }

    public List<Chunk> chunk(Document document) {
        String text = document.text();
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Chunk> chunks = new ArrayList<>();
        int coreStart = 0;
        int budget = maxSize;
        int coreLength = 0;
        for (String piece : split(text, maxSize - overlap, 0)) {
            if (coreLength > 0 && coreLength + piece.length() > budget) {
                chunks.add(toChunk(document, text, chunks.size(), coreStart, coreStart + coreLength));
                coreStart += coreLength;
                coreLength = 0;
                budget = maxSize - overlap;
            }
            coreLength += piece.length();
        }
        chunks.add(toChunk(document, text, chunks.size(), coreStart, coreStart + coreLength));
        return chunks;
    }

    public int maxSize() {
        return maxSize;
    }

    public int overlap() {
        return overlap;
    }

    public ChunkIdStrategy idStrategy() {
        return idStrategy;
    }

    /**
     * Identifies the boundary rules. Two chunkers with the same signature cut any text identically.
     */
    public String signature() {
        return "recursive-v1:max=%d:overlap=%d:separators=%s".formatted(
                maxSize,
                overlap,
                separators.stream().map(Chunker::escape).toList());
    }

    private Chunk toChunk(Document document, String text, int index, int coreStart, int coreEnd) {
        int overlapLength = index == 0 ? 0 : Math.min(overlap, coreStart);
        int start = coreStart - overlapLength;
        String chunkText = text.substring(start, coreEnd);
        String id = idStrategy.idFor(document.name(), index, start, chunkText);
        return new Chunk(id, document.name(), chunkText, index, start, chunkText.length(), overlapLength);
    }

    // Pieces keep their trailing separator so that joining them gives back the input.
    private List<String> split(String text, int limit, int separatorIndex) {
        if (text.length() <= limit) {
            return List.of(text);
        }
        for (int i = separatorIndex; i < separators.size(); i++) {
            String separator = separators.get(i);
            if (!text.contains(separator)) {
                continue;
            }
            List<String> pieces = new ArrayList<>();
            for (String part : splitKeepingSeparator(text, separator)) {
                if (part.length() <= limit) {
                    pieces.add(part);
                } else {
                    pieces.addAll(split(part, limit, i + 1));
                }
            }
            return pieces;
        }
        return hardCut(text, limit);
    }

    private static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        int at = text.indexOf(separator, from);
        while (at >= 0) {
            int end = at + separator.length();
            parts.add(text.substring(from, end));
            from = end;
            at = text.indexOf(separator, from);
        }
        if (from < text.length()) {
            parts.add(text.substring(from));
        }
        return parts;
    }

    private static List<String> hardCut(String text, int limit) {
        List<String> pieces = new ArrayList<>();
        for (int start = 0; start < text.length(); start += limit) {
            pieces.add(text.substring(start, Math.min(text.length(), start + limit)));
        }
        return pieces;
    }

    private static String escape(String separator) {
        return separator.replace("\n", "\\n");
    }
}
