package com.novelsource.core.batch;

import com.novelsource.common.error.SourceException;
import com.novelsource.common.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Imports a list of book urls one after another.
 * <p>
 * At most one import runs at a time and consecutive imports are at least {@code minDelay} apart.
 * The cancel flag is checked between items: once set, the remaining urls are reported as skipped.
 * A running import is never interrupted.
 */
public class BatchImportCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(BatchImportCoordinator.class);

    private final BookImporter importer;
    private final SourceResolver resolver;
    private final Duration minDelay;

    public BatchImportCoordinator(BookImporter importer, SourceResolver resolver, Duration minDelay) {
        this.importer = importer;
        this.resolver = resolver == null ? SourceResolver.NONE : resolver;
        this.minDelay = minDelay == null || minDelay.isNegative() ? Duration.ZERO : minDelay;
    }

    public BatchSummary run(BatchRequest request, BatchProgressListener listener, AtomicBoolean cancel) {
        BatchProgressListener progress = listener == null ? BatchProgressListener.NONE : listener;
        AtomicBoolean cancelFlag = cancel == null ? new AtomicBoolean(false) : cancel;
        List<String> urls = request.urls();
        int total = urls.size();

        List<ItemOutcome> outcomes = new ArrayList<>(total);
        int succeeded = 0;
        int failed = 0;
        boolean cancelled = false;
        long lastImportEnd = -1;

        logger.info("📦 Batch import of {} url(s) started", total);

        for (int i = 0; i < total; i++) {
            String url = urls.get(i);

            if (!cancelled && cancelFlag.get()) {
                cancelled = true;
                logger.info("⏹️ Batch cancelled before item {}/{}", i + 1, total);
            }
            if (cancelled) {
                outcomes.add(new ItemOutcome(i, url, null, ItemOutcome.Status.SKIPPED, "Cancelled"));
                continue;
            }

            progress.onItemStarted(new BatchProgress(i, total, url, fraction(i, total), succeeded, failed));
            ItemOutcome outcome;

            if (!UrlUtils.isHttpUrl(url)) {
                outcome = new ItemOutcome(i, url, null, ItemOutcome.Status.FAILED, "Invalid url");
            } else {
                Optional<String> sourceId = resolveSource(request, url);
                if (sourceId.isEmpty()) {
                    outcome = new ItemOutcome(i, url, null, ItemOutcome.Status.UNRESOLVED_SOURCE,
                            "No matching source");
                } else {
                    if (!waitForSlot(lastImportEnd, cancelFlag)) {
                        cancelled = true;
                        logger.info("⏹️ Batch cancelled while waiting for item {}/{}", i + 1, total);
                        ItemOutcome skipped = new ItemOutcome(i, url, sourceId.get(), ItemOutcome.Status.SKIPPED, "Cancelled");
                        outcomes.add(skipped);
                        // the item was started, so listeners see it finish
                        progress.onItemFinished(skipped,
                                new BatchProgress(i, total, url, fraction(i + 1, total), succeeded, failed));
                        continue;
                    }
                    outcome = importOne(i, url, sourceId.get());
                    lastImportEnd = System.nanoTime();
                }
            }

            if (outcome.status() == ItemOutcome.Status.SUCCEEDED) succeeded++;
            else failed++;
            outcomes.add(outcome);
            if (outcome.isFailure()) {
                logger.warn("❌ [{}/{}] {}: {}", i + 1, total, url, outcome.message());
            } else {
                logger.info("✅ [{}/{}] {}: {}", i + 1, total, url, outcome.message());
            }

            progress.onItemFinished(outcome, new BatchProgress(i, total, url, fraction(i + 1, total), succeeded, failed));
        }

        int skipped = total - succeeded - failed;
        BatchSummary summary = new BatchSummary(succeeded, failed, skipped, cancelled, outcomes);
        logger.info("📦 Batch import finished: {}", summary);
        return summary;
    }

    /**
     * Runs the batch on a dedicated daemon thread.
     */
    public CompletableFuture<BatchSummary> runAsync(BatchRequest request, BatchProgressListener listener,
                                                    AtomicBoolean cancel) {
        CompletableFuture<BatchSummary> future = new CompletableFuture<>();
        Thread worker = new Thread(() -> {
            try {
                future.complete(run(request, listener, cancel));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        }, "BatchImportWorker");
        worker.setDaemon(true);
        worker.start();
        return future;
    }

    private Optional<String> resolveSource(BatchRequest request, String url) {
        if (request.hasFixedSource()) return Optional.of(request.fixedSourceId().trim());
        if (!request.autoDetect()) return Optional.empty();
        return resolver.resolve(url);
    }

    private ItemOutcome importOne(int index, String url, String sourceId) {
        try {
            String message = importer.importBook(sourceId, url);
            return new ItemOutcome(index, url, sourceId, ItemOutcome.Status.SUCCEEDED, message);
        } catch (SourceException e) {
            return new ItemOutcome(index, url, sourceId, ItemOutcome.Status.FAILED, e.describe());
        } catch (RuntimeException e) {
            logger.error("Import of {} crashed", url, e);
            return new ItemOutcome(index, url, sourceId, ItemOutcome.Status.FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Sleeps out the rest of the minimum delay. False when cancelled or interrupted meanwhile.
     */
    private boolean waitForSlot(long lastImportEnd, AtomicBoolean cancel) {
        if (lastImportEnd < 0 || minDelay.isZero()) return !cancel.get();
        long remainingMillis = minDelay.toMillis() - (System.nanoTime() - lastImportEnd) / 1_000_000;
        if (remainingMillis > 0) {
            try {
                Thread.sleep(remainingMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Batch interrupted, treating as cancellation");
                return false;
            }
        }
        return !cancel.get();
    }

    private static double fraction(int done, int total) {
        return total == 0 ? 1.0 : (double) done / total;
    }
}
