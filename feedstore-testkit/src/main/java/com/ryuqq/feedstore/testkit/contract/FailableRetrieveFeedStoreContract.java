package com.ryuqq.feedstore.testkit.contract;

import com.ryuqq.feedstore.core.failure.FailureKind;
import com.ryuqq.feedstore.core.spi.FeedStore;
import org.junit.jupiter.api.Test;

import static com.ryuqq.feedstore.testkit.contract.FeedStoreAssertions.expectFailure;

/**
 * Contract Test for backends whose retrieval can fail on corrupted storage.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Corrupted storage → retrieve delivers a RETRIEVAL failure</li>
 *   <li>Corruption is stable → a second retrieve fails again and the content is untouched</li>
 * </ul>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public interface FailableRetrieveFeedStoreContract {

    /**
     * Creates a store whose storage location exists but holds undecodable content.
     *
     * @return the store under test
     * @throws Exception if the corrupted state cannot be prepared
     */
    FeedStore makeSutWithCorruptedStorage() throws Exception;

    /**
     * Verifies the corrupted content is still in place after the failing reads.
     *
     * <p>Default: no-op, for backends whose corruption is not observable from outside.</p>
     *
     * @throws Exception if the check cannot be performed
     */
    default void assertCorruptedStorageUnchanged() throws Exception {
    }

    @Test
    default void retrieve_CorruptedStorage_DeliversFailure() throws Exception {
        FeedStore sut = makeSutWithCorruptedStorage();

        expectFailure(sut, FailureKind.RETRIEVAL);
    }

    @Test
    default void retrieve_CorruptedStorage_HasNoSideEffectsOnFailure() throws Exception {
        // Given
        FeedStore sut = makeSutWithCorruptedStorage();

        // When & Then
        expectFailure(sut, FailureKind.RETRIEVAL);
        expectFailure(sut, FailureKind.RETRIEVAL);
        assertCorruptedStorageUnchanged();
    }
}
