/**
 * FeedStore contract test oracle.
 *
 * <p>Backend-agnostic JUnit Jupiter suites that certify any
 * {@link com.ryuqq.feedstore.core.spi.FeedStore} implementation.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.feedstore.testkit.contract.AbstractFeedStoreContractTest}:
 *       retrieval, overwrite, deletion and ordering properties every backend must pass</li>
 *   <li>{@link com.ryuqq.feedstore.testkit.contract.FailableRetrieveFeedStoreContract},
 *       {@link com.ryuqq.feedstore.testkit.contract.FailableInsertFeedStoreContract},
 *       {@link com.ryuqq.feedstore.testkit.contract.FailableDeleteFeedStoreContract}:
 *       opt-in failure-path properties for backends that can fail</li>
 *   <li>{@link com.ryuqq.feedstore.testkit.contract.FeedStoreAssertions}: blocking helpers with a completion timeout</li>
 *   <li>{@link com.ryuqq.feedstore.testkit.contract.FeedStoreFixtures}: test data</li>
 * </ul>
 *
 * <p><strong>Test Isolation:</strong> the harness owns setup and teardown through
 * {@code setUpEmptyStoreState()} / {@code undoStoreSideEffects()}, operating on a storage
 * location injected by the backend test, never on process-wide state.</p>
 *
 * @since 1.0.0
 * @author FeedStore Team
 */
package com.ryuqq.feedstore.testkit.contract;
