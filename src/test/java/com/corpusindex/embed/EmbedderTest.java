package com.corpusindex.embed;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.corpusindex.ingest.Chunk;

class EmbedderTest {

    private static Embedder embedder(EmbeddingClient client) {
        return new Embedder(client, new RetryPolicy(2, 1, 4), Duration.ofSeconds(5), Duration.ofSeconds(1), 1, 2);
    }

    private static List<Chunk> chunks(int count) {
        List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String text = "chunk text " + i;
            chunks.add(new Chunk("id-" + i, "doc.md", text, i, i * 20, text.length(), 0));
        }
        return chunks;
    }

    @Test
    void shouldCallServiceOncePerSubBatchAndKeepInputOrder() throws Exception {
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(16, 2);
        List<Chunk> chunks = chunks(5);

        try (Embedder embedder = embedder(client)) {
            BatchEmbeddingResult result = embedder.embedChunks(chunks);

            assertEquals(List.of(2, 2, 1), client.callSizes());
            assertTrue(result.isComplete());
            assertEquals(5, result.embedded().size());
            HashingEmbeddingClient reference = new HashingEmbeddingClient(16, 1);
            for (int i = 0; i < chunks.size(); i++) {
                EmbeddedChunk embedded = result.embedded().get(i);
                assertSame(chunks.get(i), embedded.chunk());
                assertArrayEquals(reference.embed(List.of(chunks.get(i).text()), Duration.ZERO).get(0), embedded.vector());
            }
        }
    }

    @Test
    void shouldIsolatePermanentlyFailingSubBatch() throws Exception {
        List<Chunk> chunks = chunks(5);
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(16, 2).failPermanently(chunks.get(2).text());

        try (Embedder embedder = embedder(client)) {
            BatchEmbeddingResult result = embedder.embedChunks(chunks);

            assertEquals(3, result.embedded().size());
            assertEquals(List.of("id-0", "id-1", "id-4"),
                    result.embedded().stream().map(embedded -> embedded.chunk().chunkId()).toList());
            assertEquals(1, result.failures().size());
            EmbeddingFailure failure = result.failures().get(0);
            assertEquals(1, failure.batchIndex());
            assertEquals(List.of("id-2", "id-3"), failure.failedChunkIds());
            assertEquals(1, failure.attempts());
            assertEquals(2, result.failedChunkCount());
            assertEquals(3, client.calls().size());
        }
    }

    @Test
    void shouldRetryTransientFailureWithinBudget() throws Exception {
        List<Chunk> chunks = chunks(2);
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(8, 2).failTransiently(chunks.get(0).text(), 2);

        try (Embedder embedder = embedder(client)) {
            BatchEmbeddingResult result = embedder.embedChunks(chunks);

            assertTrue(result.isComplete());
            assertEquals(2, result.embedded().size());
            assertEquals(3, client.calls().size());
        }
    }

    @Test
    void shouldReportBatchWhenRetriesAreExhausted() throws Exception {
        List<Chunk> chunks = chunks(2);
        ScriptedEmbeddingClient client = new ScriptedEmbeddingClient(8, 2).failTransiently(chunks.get(0).text(), 10);

        try (Embedder embedder = embedder(client)) {
            BatchEmbeddingResult result = embedder.embedChunks(chunks);

            assertTrue(result.embedded().isEmpty());
            assertEquals(3, result.failures().get(0).attempts());
            assertTrue(result.failures().get(0).cause().contains("503"));
        }
    }

    @Test
    void shouldRejectVectorsOfWrongDimension() throws Exception {
        EmbeddingClient wrongDimension = new EmbeddingClient() {
            @Override
            public List<float[]> embed(List<String> texts, Duration timeout) {
                return texts.stream().map(text -> new float[3]).toList();
            }

            @Override
            public int dimension() {
                return 4;
            }

            @Override
            public int maxBatchSize() {
                return 5;
            }
        };

        try (Embedder embedder = embedder(wrongDimension)) {
            BatchEmbeddingResult result = embedder.embedChunks(chunks(2));

            assertFalse(result.isComplete());
            assertEquals(1, result.failures().get(0).attempts());
        }
    }

    @Test
    void shouldRetryQueryOnceThenGiveUp() throws Exception {
        ScriptedEmbeddingClient recovering = new ScriptedEmbeddingClient(8, 2).failTransiently("where is it", 1);
        try (Embedder embedder = embedder(recovering)) {
            assertEquals(8, embedder.embedQuery("where is it").length);
            assertEquals(2, recovering.calls().size());
        }

        ScriptedEmbeddingClient failing = new ScriptedEmbeddingClient(8, 2).failTransiently("where is it", 2);
        try (Embedder embedder = embedder(failing)) {
            assertThrows(EmbeddingException.class, () -> embedder.embedQuery("where is it"));
            assertEquals(2, failing.calls().size());
        }

        ScriptedEmbeddingClient rejecting = new ScriptedEmbeddingClient(8, 2).failPermanently("where is it");
        try (Embedder embedder = embedder(rejecting)) {
            EmbeddingException error = assertThrows(EmbeddingException.class, () -> embedder.embedQuery("where is it"));
            assertFalse(error.isRetryable());
            assertEquals(1, rejecting.calls().size());
        }
    }

    @Test
    void shouldPartitionIntoCeilingOfBatches() {
        assertEquals(3, Embedder.partition(List.of(1, 2, 3, 4, 5), 2).size());
        assertEquals(List.of(List.of(1, 2, 3)), Embedder.partition(List.of(1, 2, 3), 5));
        assertTrue(Embedder.partition(List.of(), 5).isEmpty());
    }

    @Test
    void shouldCapExponentialBackoff() {
        RetryPolicy policy = new RetryPolicy(5, 100, 350);

        assertEquals(6, policy.maxAttempts());
        assertEquals(100, policy.backoffMs(1));
        assertEquals(200, policy.backoffMs(2));
        assertEquals(350, policy.backoffMs(3));
        assertEquals(350, policy.backoffMs(5));
    }
}
