/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage interface that must be implemented by backend adapters.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.feedstore.core.spi.FeedStore} - Single-slot feed cache (retrieve / insert / delete)</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (feedstore-adapter-inmemory, feedstore-adapter-file) provide concrete
 * implementations. Every implementation must pass the contract test oracle in feedstore-testkit.</p>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Absence vs. corruption:</strong> A missing storage object is Empty, undecodable content is Failure</li>
 *   <li><strong>Atomicity:</strong> Write and delete are all-or-nothing</li>
 *   <li><strong>Failure channel:</strong> Return failures as values, do not complete futures exceptionally</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FeedStore Team
 */
package com.ryuqq.feedstore.core.spi;
