package com.corpusindex.embed;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.corpusindex.ingest.Chunk;
import com.corpusindex.runtime.AppConfig;

/**
 * Splits chunk lists into service-sized sub-batches, embeds them concurrently with retries and
 * reassembles the vectors in input order. A sub-batch that keeps failing is reported, not thrown.
 */
public class Embedder implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Embedder.class);

    private final EmbeddingClient client;
    private final RetryPolicy retryPolicy;
    private final Duration batchTimeout;
    private final Duration queryTimeout;
    private final long queryRetryBackoffMs;
    private final ExecutorService batchExecutor;

    public Embedder(EmbeddingClient client,
            RetryPolicy retryPolicy,
            Duration batchTimeout,
            Duration queryTimeout,
            long queryRetryBackoffMs,
            int maxConcurrentRequests) {
        this.client = client;
        this.retryPolicy = retryPolicy;
        this.batchTimeout = batchTimeout;
        this.queryTimeout = queryTimeout;
        this.queryRetryBackoffMs = queryRetryBackoffMs;
        AtomicInteger threadCount = new AtomicInteger();
        this.batchExecutor = Executors.newFixedThreadPool(maxConcurrentRequests, runnable -> {
            Thread thread = new Thread(runnable, "embedding-batch-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Embedder fromConfig(EmbeddingClient client, AppConfig.EmbeddingConfig config) {
        return new Embedder(
                client,
                new RetryPolicy(config.getMaxRetries(), config.getInitialBackoffMs(), config.getMaxBackoffMs()),
                Duration.ofMillis(config.getTimeoutMs()),
                Duration.ofMillis(config.getQueryTimeoutMs()),
                config.getQueryRetryBackoffMs(),
                config.getMaxConcurrentRequests());
    }

    public BatchEmbeddingResult embedChunks(List<Chunk> chunks) throws InterruptedException {
        if (chunks.isEmpty()) {
            return new BatchEmbeddingResult(List.of(), List.of());
        }
        List<List<Chunk>> batches = partition(chunks, client.maxBatchSize());
        List<Future<BatchOutcome>> pending = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            int batchIndex = i;
            pending.add(batchExecutor.submit(() -> embedBatch(batchIndex, batches.get(batchIndex))));
        }

        List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
        List<EmbeddingFailure> failures = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            try {
                BatchOutcome outcome = pending.get(i).get();
                embedded.addAll(outcome.embedded());
                if (outcome.failure() != null) {
                    failures.add(outcome.failure());
                }
            } catch (InterruptedException e) {
                pending.forEach(future -> future.cancel(true));
                throw e;
            } catch (ExecutionException e) {
                log.error("embedding.batch.crashed batch={} chunks={}", i, batches.get(i).size(), e.getCause());
                failures.add(new EmbeddingFailure(i, chunkIds(batches.get(i)), String.valueOf(e.getCause()), 0));
            }
        }
        return new BatchEmbeddingResult(embedded, failures);
    }

    /**
     * Embeds a single query on the interactive path: tighter timeout and at most one fast retry.
     */
    public float[] embedQuery(String text) throws EmbeddingException, InterruptedException {
        try {
            return embedQueryOnce(text);
        } catch (EmbeddingException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            log.warn("embedding.query.retry backoffMs={} reason={}", queryRetryBackoffMs, e.getMessage());
            Thread.sleep(queryRetryBackoffMs);
            return embedQueryOnce(text);
        }
    }

    public EmbeddingClient client() {
        return client;
    }

    @Override
    public void close() {
        batchExecutor.shutdownNow();
    }

    private float[] embedQueryOnce(String text) throws EmbeddingException, InterruptedException {
        List<float[]> vectors = client.embed(List.of(text), queryTimeout);
        if (vectors.size() != 1) {
            throw new EmbeddingException("expected 1 query embedding but got " + vectors.size(), false);
        }
        checkDimension(vectors.get(0));
        return vectors.get(0);
    }

    private BatchOutcome embedBatch(int batchIndex, List<Chunk> batch) throws InterruptedException {
        List<String> texts = batch.stream().map(Chunk::text).toList();
        int maxAttempts = retryPolicy.maxAttempts();
        EmbeddingException last = null;
        int attempt = 1;
        for (; attempt <= maxAttempts; attempt++) {
            try {
                List<float[]> vectors = client.embed(texts, batchTimeout);
                if (vectors.size() != batch.size()) {
                    throw new EmbeddingException("expected " + batch.size() + " embeddings but got " + vectors.size(), false);
                }
                List<EmbeddedChunk> embedded = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    checkDimension(vectors.get(i));
                    embedded.add(new EmbeddedChunk(batch.get(i), vectors.get(i)));
                }
                log.debug("embedding.batch.ok batch={} chunks={} attempt={}", batchIndex, batch.size(), attempt);
                return new BatchOutcome(embedded, null);
            } catch (EmbeddingException e) {
                last = e;
                if (!e.isRetryable() || attempt == maxAttempts) {
                    break;
                }
                long backoff = retryPolicy.backoffMs(attempt);
                log.warn("embedding.batch.retry batch={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        batchIndex, attempt, maxAttempts, backoff, e.getMessage());
                Thread.sleep(backoff);
            }
        }
        int attempts = Math.min(attempt, maxAttempts);
        log.error("embedding.batch.failed batch={} chunks={} attempts={} retryable={} reason={}",
                batchIndex, batch.size(), attempts, last.isRetryable(), last.getMessage());
        return new BatchOutcome(List.of(), new EmbeddingFailure(batchIndex, chunkIds(batch), last.getMessage(), attempts));
    }

    private void checkDimension(float[] vector) throws EmbeddingException {
        if (vector.length != client.dimension()) {
            throw new EmbeddingException("expected dimension " + client.dimension() + " but got " + vector.length, false);
        }
    }

    static <T> List<List<T>> partition(List<T> items, int batchSize) {
        List<List<T>> batches = new ArrayList<>((items.size() + batchSize - 1) / batchSize);
        for (int start = 0; start < items.size(); start += batchSize) {
            batches.add(items.subList(start, Math.min(items.size(), start + batchSize)));
        }
        return batches;
    }

    private static List<String> chunkIds(List<Chunk> batch) {
        return batch.stream().map(Chunk::chunkId).toList();
    }

    private record BatchOutcome(List<EmbeddedChunk> embedded, EmbeddingFailure failure) {
    }
}
