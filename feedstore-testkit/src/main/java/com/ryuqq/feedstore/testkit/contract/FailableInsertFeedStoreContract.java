package com.ryuqq.feedstore.testkit.contract;

import com.ryuqq.feedstore.core.failure.FailureKind;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;
import com.ryuqq.feedstore.core.spi.FeedStore;
import org.junit.jupiter.api.Test;

import static com.ryuqq.feedstore.testkit.contract.FeedStoreAssertions.*;
import static com.ryuqq.feedstore.testkit.contract.FeedStoreFixtures.anyTimestamp;
import static com.ryuqq.feedstore.testkit.contract.FeedStoreFixtures.uniqueFeed;

/**
 * Contract Test for backends whose insertion can fail on an unwritable destination.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Unwritable destination → insert delivers an INSERTION failure</li>
 *   <li>Failed insert → slot is exactly as before the call (no partial write)</li>
 * </ul>
 *
 * <p>Implementations should seed a prior value before making the destination unwritable
 * where the backend allows it, so the no-side-effect check covers an occupied slot.</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public interface FailableInsertFeedStoreContract {

    /**
     * Creates a store whose next insert cannot be persisted.
     *
     * @return the store under test
     * @throws Exception if the unwritable state cannot be prepared
     */
    FeedStore makeSutWithUnwritableDestination() throws Exception;

    @Test
    default void insert_UnwritableDestination_DeliversError() throws Exception {
        FeedStore sut = makeSutWithUnwritableDestination();

        assertError(insert(sut, uniqueFeed(), anyTimestamp()), FailureKind.INSERTION);
    }

    @Test
    default void insert_UnwritableDestination_HasNoSideEffects() throws Exception {
        // Given
        FeedStore sut = makeSutWithUnwritableDestination();
        RetrievalResult before = retrieve(sut);

        // When
        insert(sut, uniqueFeed(), anyTimestamp());

        // Then
        assertSameSlotState(before, retrieve(sut));
    }
}
