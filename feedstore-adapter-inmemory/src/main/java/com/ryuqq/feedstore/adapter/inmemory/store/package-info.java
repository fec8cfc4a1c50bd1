/**
 * In-memory FeedStore adapter implementation package.
 *
 * <p>This package provides the reference implementation of the FeedStore SPI
 * for testing and educational purposes.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.feedstore.adapter.inmemory.store.InMemoryFeedStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.feedstore.core.spi.FeedStore}
 *       with fault simulation hooks</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.feedstore.core.spi.FeedStore
 * @author FeedStore Team
 * @since 1.0.0
 */
package com.ryuqq.feedstore.adapter.inmemory.store;
