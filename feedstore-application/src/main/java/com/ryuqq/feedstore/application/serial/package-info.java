/**
 * Operation serialization package.
 *
 * <p>Provides {@link com.ryuqq.feedstore.application.serial.SerialFeedStore}, a
 * {@link com.ryuqq.feedstore.core.spi.FeedStore} decorator that turns any backend into
 * one with strict FIFO execution and completion order.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (SerialFeedStore store = new SerialFeedStore(new InMemoryFeedStore())) {
 *     store.insert(feed, Instant.now())
 *          .thenCompose(error -&gt; store.retrieve())
 *          .thenAccept(result -&gt; ...);
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author FeedStore Team
 */
package com.ryuqq.feedstore.application.serial;
