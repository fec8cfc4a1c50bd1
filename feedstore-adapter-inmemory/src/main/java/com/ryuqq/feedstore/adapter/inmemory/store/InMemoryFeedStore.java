package com.ryuqq.feedstore.adapter.inmemory.store;

import com.ryuqq.feedstore.core.failure.StoreFailure;
import com.ryuqq.feedstore.core.model.CachedFeed;
import com.ryuqq.feedstore.core.model.FeedImage;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;
import com.ryuqq.feedstore.core.spi.FeedStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory implementation of {@link FeedStore} SPI for testing and reference purposes.
 *
 * <p>The slot is a single guarded field; every operation runs and completes synchronously
 * on the calling thread, so the returned futures are already complete.</p>
 *
 * <p><strong>Slot State:</strong></p>
 * <ul>
 *   <li><strong>cachedFeed:</strong> the occupied slot, or null when empty</li>
 *   <li><strong>corrupted:</strong> simulated undecodable storage; retrieval fails until the
 *       slot is replaced by insert, delete or {@link #clear()}</li>
 * </ul>
 *
 * <p><strong>Fault Simulation (test hooks):</strong></p>
 * <ul>
 *   <li>{@link #simulateCorruption()}: retrieval reports RETRIEVAL failures</li>
 *   <li>{@link #simulateInsertionFailure(boolean)}: inserts fail and leave the slot untouched</li>
 *   <li>{@link #simulateDeletionFailure(boolean)}: deletes fail and leave the slot untouched</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * FeedStore store = new SerialFeedStore(new InMemoryFeedStore());
 *
 * store.insert(feed, Instant.now())
 *      .thenCompose(error -&gt; store.retrieve())
 *      .thenAccept(result -&gt; ...);
 * </pre>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public class InMemoryFeedStore implements FeedStore {

    private final Object lock = new Object();

    private CachedFeed cachedFeed;
    private boolean corrupted;
    private boolean insertionFailing;
    private boolean deletionFailing;

    /**
     * Creates a new InMemoryFeedStore with an empty slot.
     */
    public InMemoryFeedStore() {
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Empty when nothing was inserted or the slot was deleted</li>
     *   <li>Failure while simulated corruption is active, repeatedly</li>
     * </ul>
     */
    @Override
    public CompletableFuture<RetrievalResult> retrieve() {
        synchronized (lock) {
            if (corrupted) {
                return CompletableFuture.completedFuture(
                        RetrievalResult.failure(StoreFailure.retrieval("in-memory slot is corrupted", null)));
            }
            if (cachedFeed == null) {
                return CompletableFuture.completedFuture(RetrievalResult.empty());
            }
            return CompletableFuture.completedFuture(RetrievalResult.found(cachedFeed));
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Replaces the slot wholesale, clearing simulated corruption</li>
     *   <li>CachedFeed copies the list, later changes to the argument are not visible</li>
     * </ul>
     */
    @Override
    public CompletableFuture<Optional<StoreFailure>> insert(List<FeedImage> feed, Instant timestamp) {
        CachedFeed replacement = CachedFeed.of(feed, timestamp);

        synchronized (lock) {
            if (insertionFailing) {
                return CompletableFuture.completedFuture(
                        Optional.of(StoreFailure.insertion("in-memory slot is not writable", null)));
            }
            cachedFeed = replacement;
            corrupted = false;
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public CompletableFuture<Optional<StoreFailure>> deleteCachedFeed() {
        synchronized (lock) {
            if (deletionFailing) {
                return CompletableFuture.completedFuture(
                        Optional.of(StoreFailure.deletion("in-memory slot is not deletable", null)));
            }
            cachedFeed = null;
            corrupted = false;
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    /**
     * Marks the slot as corrupted.
     *
     * <p>This method is used to exercise the retrieval failure path in tests.
     * The current value stays in place but cannot be read.</p>
     */
    public void simulateCorruption() {
        synchronized (lock) {
            corrupted = true;
        }
    }

    /**
     * Makes subsequent inserts fail (or succeed again).
     *
     * @param failing true to reject inserts
     */
    public void simulateInsertionFailure(boolean failing) {
        synchronized (lock) {
            insertionFailing = failing;
        }
    }

    /**
     * Makes subsequent deletes fail (or succeed again).
     *
     * @param failing true to reject deletes
     */
    public void simulateDeletionFailure(boolean failing) {
        synchronized (lock) {
            deletionFailing = failing;
        }
    }

    /**
     * Clears all stored data and simulated faults.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        synchronized (lock) {
            cachedFeed = null;
            corrupted = false;
            insertionFailing = false;
            deletionFailing = false;
        }
    }
}
