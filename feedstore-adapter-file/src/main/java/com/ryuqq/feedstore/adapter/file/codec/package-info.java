/**
 * JSON encoding of the persisted slot, built on Jackson databind.
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
package com.ryuqq.feedstore.adapter.file.codec;
