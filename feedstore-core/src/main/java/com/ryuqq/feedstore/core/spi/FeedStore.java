package com.ryuqq.feedstore.core.spi;

import com.ryuqq.feedstore.core.failure.StoreFailure;
import com.ryuqq.feedstore.core.model.FeedImage;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Single-slot feed cache storage SPI.
 *
 * <p>This interface is the contract every storage backend (in-memory, file-based,
 * embedded database) implements. Backends are interchangeable and selected at
 * construction time.</p>
 *
 * <p><strong>Slot Semantics:</strong></p>
 * <pre>
 * Empty    --insert(F, T)--&gt; Occupied(F, T)
 * Occupied --insert(F2, T2)-&gt; Occupied(F2, T2)   (full overwrite, never merged)
 * any      --deleteCachedFeed()--&gt; Empty
 * any      --retrieve()--&gt; same state             (pure observation)
 * </pre>
 *
 * <p><strong>Completion Rules:</strong></p>
 * <ul>
 *   <li>Every returned future completes exactly once</li>
 *   <li>Storage failures are delivered as values ({@link StoreFailure}), never as exceptional completion</li>
 *   <li>A failed operation leaves the slot exactly as it was before the call</li>
 * </ul>
 *
 * <p><strong>Ordering:</strong> Implementations may run operations concurrently internally.
 * Callers that need strict FIFO execution and completion wrap the backend in
 * {@code SerialFeedStore} (feedstore-application).</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public interface FeedStore {

    /**
     * Retrieves the cached feed.
     *
     * <p><strong>Results:</strong></p>
     * <ul>
     *   <li>{@code Empty}: nothing cached, or the storage object has never been created</li>
     *   <li>{@code Found}: exactly the feed and timestamp of the last successful insert</li>
     *   <li>{@code Failure}: storage exists but cannot be decoded (kind RETRIEVAL)</li>
     * </ul>
     *
     * <p>Retrieval never alters the persisted slot. Two consecutive calls without an
     * intervening write yield the same result, including two failures on corrupted data.</p>
     *
     * @return future of the retrieval result
     */
    CompletableFuture<RetrievalResult> retrieve();

    /**
     * Replaces the slot content with the given feed and timestamp.
     *
     * <p>The previous content, if any, is fully replaced. An empty feed is a valid,
     * occupied snapshot.</p>
     *
     * @param feed the ordered images to cache (may be empty)
     * @param timestamp the insertion instant
     * @return future of an empty optional on success, or an INSERTION failure
     * @throws IllegalArgumentException if feed, any of its elements, or timestamp is null
     */
    CompletableFuture<Optional<StoreFailure>> insert(List<FeedImage> feed, Instant timestamp);

    /**
     * Clears the slot.
     *
     * <p>Idempotent: deleting an empty slot succeeds and leaves it empty.</p>
     *
     * @return future of an empty optional on success, or a DELETION failure
     */
    CompletableFuture<Optional<StoreFailure>> deleteCachedFeed();
}
