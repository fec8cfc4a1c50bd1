/**
 * File-based FeedStore adapter.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.feedstore.adapter.file.store.FileSystemFeedStore}: one JSON document per store,
 *       replaced through a staging file</li>
 *   <li>{@link com.ryuqq.feedstore.adapter.file.store.FileFeedStoreConfig}: store path and I/O threads</li>
 * </ul>
 *
 * @see com.ryuqq.feedstore.core.spi.FeedStore
 * @author FeedStore Team
 * @since 1.0.0
 */
package com.ryuqq.feedstore.adapter.file.store;
