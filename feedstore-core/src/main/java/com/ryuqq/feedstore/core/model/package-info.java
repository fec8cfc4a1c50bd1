/**
 * Feed record model package.
 *
 * <p>Immutable value types stored in the single cache slot.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.feedstore.core.model.FeedImage} - One feed item (id, description, location, url)</li>
 *   <li>{@link com.ryuqq.feedstore.core.model.CachedFeed} - Ordered feed snapshot plus insertion timestamp</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Java records, defensive list copies</li>
 *   <li><strong>Structural equality:</strong> Two snapshots are equal when all fields and record order match</li>
 *   <li><strong>Self-validation:</strong> Invalid values are rejected in compact constructors</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FeedStore Team
 */
package com.ryuqq.feedstore.core.model;
