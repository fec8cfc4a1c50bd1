package com.ryuqq.feedstore.testkit.contract;

import com.ryuqq.feedstore.core.failure.FailureKind;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;
import com.ryuqq.feedstore.core.spi.FeedStore;
import org.junit.jupiter.api.Test;

import static com.ryuqq.feedstore.testkit.contract.FeedStoreAssertions.*;

/**
 * Contract Test for backends whose deletion can fail on non-modifiable storage.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Non-deletable storage → delete delivers a DELETION failure</li>
 *   <li>Failed delete → slot is exactly as before the call</li>
 * </ul>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public interface FailableDeleteFeedStoreContract {

    /**
     * Creates a store whose next delete cannot modify the storage.
     *
     * @return the store under test
     * @throws Exception if the non-deletable state cannot be prepared
     */
    FeedStore makeSutWithUndeletableDestination() throws Exception;

    @Test
    default void delete_UndeletableDestination_DeliversError() throws Exception {
        FeedStore sut = makeSutWithUndeletableDestination();

        assertError(deleteCache(sut), FailureKind.DELETION);
    }

    @Test
    default void delete_UndeletableDestination_HasNoSideEffects() throws Exception {
        // Given
        FeedStore sut = makeSutWithUndeletableDestination();
        RetrievalResult before = retrieve(sut);

        // When
        deleteCache(sut);

        // Then
        assertSameSlotState(before, retrieve(sut));
    }
}
