package com.examkit.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.examkit.ingest.DocumentChunk;
import com.examkit.runtime.WorkerPool;

/**
 * Embeds chunks in fixed-size batches on the worker pool. Each batch call is bounded by a timeout
 * and retried once; a batch that fails twice is reported without affecting the other batches.
 * Single query texts go through {@link #embedText(String)} under the same policy.
 */
public class BatchEmbedder {
    private static final Logger log = LoggerFactory.getLogger(BatchEmbedder.class);
    private static final int MAX_ATTEMPTS = 2;

    private final EmbeddingService embeddingService;
    private final WorkerPool workerPool;
    private final int batchSize;
    private final long timeoutMs;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public BatchEmbedder(EmbeddingService embeddingService, WorkerPool workerPool, int batchSize, long timeoutMs) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (timeoutMs < 1) {
            throw new IllegalArgumentException("timeoutMs must be >= 1");
        }
        this.embeddingService = embeddingService;
        this.workerPool = workerPool;
        this.batchSize = batchSize;
        this.timeoutMs = timeoutMs;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public EmbeddingOutcome embed(List<DocumentChunk> chunks) {
        List<List<DocumentChunk>> batches = new ArrayList<>();
        for (int start = 0; start < chunks.size(); start += batchSize) {
            batches.add(chunks.subList(start, Math.min(chunks.size(), start + batchSize)));
        }

        List<Future<BatchResult>> futures = new ArrayList<>();
        for (int i = 0; i < batches.size(); i++) {
            int batchIndex = i;
            List<DocumentChunk> batch = batches.get(i);
            futures.add(workerPool.submit(() -> runBatch(batchIndex, batch)));
        }

        List<EmbeddedChunk> embedded = new ArrayList<>();
        List<EmbeddingFailure> failures = new ArrayList<>();
        int cancelledChunks = 0;
        for (int i = 0; i < futures.size(); i++) {
            BatchResult result;
            try {
                result = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                futures.subList(i, futures.size()).forEach(future -> future.cancel(true));
                cancelledChunks += batches.subList(i, batches.size()).stream().mapToInt(List::size).sum();
                break;
            } catch (CancellationException e) {
                cancelledChunks += batches.get(i).size();
                continue;
            } catch (ExecutionException e) {
                failures.add(new EmbeddingFailure(i, ids(batches.get(i)), describe(e.getCause())));
                continue;
            }
            embedded.addAll(result.embedded());
            if (result.failure() != null) {
                failures.add(result.failure());
            }
            if (result.cancelled()) {
                cancelledChunks += batches.get(i).size();
            }
        }

        log.info("Embedded {} chunks in {} batches, failedChunks={}, cancelledChunks={}",
                embedded.size(), batches.size(),
                failures.stream().mapToInt(failure -> failure.chunkIds().size()).sum(),
                cancelledChunks);
        return new EmbeddingOutcome(List.copyOf(embedded), List.copyOf(failures), cancelledChunks);
    }

    /**
     * Embeds a single query text under the same timeout and retry policy as a batch.
     *
     * @throws EmbeddingException when both attempts fail, or the embedder was cancelled or
     *         interrupted
     */
    public float[] embedText(String text) {
        try {
            return withRetry("text", () -> checkDimension("query text", embeddingService.embed(text)));
        } catch (CancellationException e) {
            throw new EmbeddingException("Embedding cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while embedding text", e);
        }
    }

    private BatchResult runBatch(int batchIndex, List<DocumentChunk> batch) {
        List<String> texts = batch.stream().map(DocumentChunk::text).toList();
        try {
            return BatchResult.success(withRetry("batch " + batchIndex,
                    () -> pair(batch, embeddingService.embedBatch(texts))));
        } catch (CancellationException e) {
            return BatchResult.wasCancelled();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BatchResult.wasCancelled();
        } catch (EmbeddingException e) {
            return BatchResult.failed(new EmbeddingFailure(batchIndex, ids(batch), e.getMessage()));
        }
    }

    private <T> T withRetry(String label, Callable<T> work) throws InterruptedException {
        String lastError = "";
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Embedding " + label + " cancelled");
            }
            Future<T> call = workerPool.call(work);
            try {
                return call.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                call.cancel(true);
                lastError = "timed out after " + timeoutMs + "ms";
            } catch (ExecutionException e) {
                lastError = describe(e.getCause());
            } catch (InterruptedException e) {
                call.cancel(true);
                throw e;
            }
            log.warn("Embedding {} attempt {}/{} failed: {}", label, attempt, MAX_ATTEMPTS, lastError);
        }
        throw new EmbeddingException(lastError);
    }

    private List<EmbeddedChunk> pair(List<DocumentChunk> batch, List<float[]> vectors) {
        if (vectors == null || vectors.size() != batch.size()) {
            throw new EmbeddingException("Expected " + batch.size() + " vectors but got "
                    + (vectors == null ? 0 : vectors.size()));
        }
        List<EmbeddedChunk> out = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            out.add(new EmbeddedChunk(batch.get(i), checkDimension("Chunk " + batch.get(i).id(), vectors.get(i))));
        }
        return out;
    }

    private float[] checkDimension(String subject, float[] vector) {
        if (vector == null || vector.length != embeddingService.dimension()) {
            throw new EmbeddingException(subject + " embedded with dimension "
                    + (vector == null ? 0 : vector.length) + ", expected " + embeddingService.dimension());
        }
        return vector;
    }

    private static List<String> ids(List<DocumentChunk> batch) {
        return batch.stream().map(DocumentChunk::id).toList();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private record BatchResult(List<EmbeddedChunk> embedded, EmbeddingFailure failure, boolean cancelled) {
        static BatchResult success(List<EmbeddedChunk> embedded) {
            return new BatchResult(embedded, null, false);
        }

        static BatchResult failed(EmbeddingFailure failure) {
            return new BatchResult(List.of(), failure, false);
        }

        static BatchResult wasCancelled() {
            return new BatchResult(List.of(), null, true);
        }
    }
}
