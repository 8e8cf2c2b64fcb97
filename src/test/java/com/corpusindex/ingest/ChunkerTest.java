package com.corpusindex.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.corpusindex.runtime.ConfigurationException;

class ChunkerTest {

    @Test
    void shouldSplitLongDocumentIntoThreeOverlappingChunks() {
        String text = "x".repeat(2500);
        Chunker chunker = new Chunker(1000, 150, ChunkIdStrategy.CONTENT_DERIVED);

        List<Chunk> chunks = chunker.chunk(new Document("long.txt", text, "long.txt"));

        assertEquals(3, chunks.size());
        String first = chunks.get(0).text();
        String second = chunks.get(1).text();
        assertEquals(first.substring(first.length() - 150), second.substring(0, 150));
        assertEquals(150, chunks.get(1).overlapLength());
        assertEquals(0, chunks.get(0).overlapLength());
    }

    @Test
    void shouldKeepShortDocumentAsSingleChunk() {
        Chunker chunker = new Chunker(1000, 150, ChunkIdStrategy.CONTENT_DERIVED);

        List<Chunk> chunks = chunker.chunk(new Document("short.md", "A short note.\nSecond line.", "short.md"));

        assertEquals(1, chunks.size());
        assertEquals("A short note.\nSecond line.", chunks.get(0).text());
        assertEquals(0, chunks.get(0).startOffset());
    }

    @Test
    void shouldReconstructTextAndRespectMaxSize() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            builder.append("Paragraph ").append(i).append(" talks about retrieval. ")
                    .append("It has a second sentence? Yes! And a third one.\n");
            if (i % 4 == 0) {
                builder.append('\n');
            }
        }
        String text = builder.toString();
        Chunker chunker = new Chunker(200, 40, ChunkIdStrategy.CONTENT_DERIVED);

        List<Chunk> chunks = chunker.chunk(new Document("doc.md", text, "doc.md"));

        StringBuilder rebuilt = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            assertEquals(i, chunk.indexInDocument());
            assertTrue(chunk.text().length() <= 200, "chunk " + i + " is " + chunk.text().length() + " chars");
            assertEquals(text.substring(chunk.startOffset(), chunk.startOffset() + chunk.length()), chunk.text());
            rebuilt.append(chunk.text().substring(chunk.overlapLength()));
        }
        assertEquals(text, rebuilt.toString());
    }

    @Test
    void shouldProduceSameIdsOnRerunWithContentDerivedIds() {
        String text = "alpha beta gamma. ".repeat(200);
        Chunker chunker = new Chunker(300, 50, ChunkIdStrategy.CONTENT_DERIVED);
        Document document = new Document("greek.txt", text, "greek.txt");

        List<String> first = chunker.chunk(document).stream().map(Chunk::chunkId).toList();
        List<String> second = chunker.chunk(document).stream().map(Chunk::chunkId).toList();
        List<String> otherDocument = chunker.chunk(new Document("copy.txt", text, "copy.txt")).stream()
                .map(Chunk::chunkId)
                .toList();

        assertEquals(first, second);
        assertNotEquals(first.get(0), otherDocument.get(0));
    }

    @Test
    void shouldAssignFreshIdsWithRandomStrategy() {
        Chunker chunker = new Chunker(300, 50, ChunkIdStrategy.RANDOM);
        Document document = new Document("notes.txt", "some text", "notes.txt");

        assertNotEquals(chunker.chunk(document).get(0).chunkId(), chunker.chunk(document).get(0).chunkId());
    }

    @Test
    void shouldReturnNoChunksForEmptyText() {
        Chunker chunker = new Chunker(100, 10, ChunkIdStrategy.CONTENT_DERIVED);

        assertTrue(chunker.chunk(new Document("empty.txt", "", "empty.txt")).isEmpty());
    }

    @Test
    void shouldRejectOverlapNotSmallerThanMaxSize() {
        assertThrows(ConfigurationException.class, () -> new Chunker(100, 100, ChunkIdStrategy.CONTENT_DERIVED));
        assertThrows(ConfigurationException.class, () -> new Chunker(0, 0, ChunkIdStrategy.CONTENT_DERIVED));
        assertThrows(ConfigurationException.class, () -> new Chunker(100, -1, ChunkIdStrategy.CONTENT_DERIVED));
    }
}
