/**
 * Store failure taxonomy.
 *
 * @since 1.0.0
 * @author FeedStore Team
 */
package com.ryuqq.feedstore.core.failure;
