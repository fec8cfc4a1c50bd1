/**
 * Cache retrieval result package.
 *
 * <p>This package defines the sealed interface hierarchy for {@code retrieve()} results.</p>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.feedstore.core.retrieval.Empty} - Slot holds nothing (absence is not a failure)</li>
 *   <li>{@link com.ryuqq.feedstore.core.retrieval.Found} - Last inserted feed and timestamp</li>
 *   <li>{@link com.ryuqq.feedstore.core.retrieval.Failure} - Storage exists but cannot be decoded</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FeedStore Team
 */
package com.ryuqq.feedstore.core.retrieval;
