package com.ryuqq.feedstore.testkit.contract;

import com.ryuqq.feedstore.core.failure.FailureKind;
import com.ryuqq.feedstore.core.failure.StoreFailure;
import com.ryuqq.feedstore.core.model.FeedImage;
import com.ryuqq.feedstore.core.retrieval.Failure;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;
import com.ryuqq.feedstore.core.spi.FeedStore;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Blocking helpers and assertions shared by the contract test oracle.
 *
 * <p>Each helper waits at most {@link #COMPLETION_TIMEOUT_SECONDS} seconds for the store to
 * complete. A store that never completes fails the test instead of hanging it.</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public final class FeedStoreAssertions {

    /**
     * Maximum wait for a single store operation.
     */
    public static final long COMPLETION_TIMEOUT_SECONDS = 5;

    private FeedStoreAssertions() {
    }

    /**
     * Runs {@code retrieve()} and waits for its result.
     *
     * @param sut the store under test
     * @return the retrieval result
     */
    public static RetrievalResult retrieve(FeedStore sut) {
        return await(sut.retrieve(), "retrieve");
    }

    /**
     * Runs {@code insert()} and waits for its result.
     *
     * @param sut the store under test
     * @param feed the feed to insert
     * @param timestamp the insertion instant
     * @return the insertion failure, if any
     */
    public static Optional<StoreFailure> insert(FeedStore sut, List<FeedImage> feed, Instant timestamp) {
        return await(sut.insert(feed, timestamp), "insert");
    }

    /**
     * Runs {@code deleteCachedFeed()} and waits for its result.
     *
     * @param sut the store under test
     * @return the deletion failure, if any
     */
    public static Optional<StoreFailure> deleteCache(FeedStore sut) {
        return await(sut.deleteCachedFeed(), "deleteCachedFeed");
    }

    /**
     * Asserts that retrieval delivers exactly the expected result.
     *
     * @param sut the store under test
     * @param expected the expected result (Empty or Found)
     */
    public static void expect(FeedStore sut, RetrievalResult expected) {
        RetrievalResult actual = retrieve(sut);
        assertEquals(expected, actual,
                String.format("Expected retrieval %s but got %s", expected, actual));
    }

    /**
     * Asserts that two consecutive retrievals both deliver the expected result.
     *
     * @param sut the store under test
     * @param expected the expected result (Empty or Found)
     */
    public static void expectTwice(FeedStore sut, RetrievalResult expected) {
        expect(sut, expected);
        expect(sut, expected);
    }

    /**
     * Asserts that retrieval delivers a failure of the given kind.
     *
     * @param sut the store under test
     * @param kind the expected failure kind
     * @return the reported failure
     */
    public static StoreFailure expectFailure(FeedStore sut, FailureKind kind) {
        RetrievalResult actual = retrieve(sut);
        assertTrue(actual instanceof Failure,
                String.format("Expected retrieval failure but got %s", actual));
        StoreFailure failure = ((Failure) actual).failure();
        assertEquals(kind, failure.kind(),
                String.format("Expected failure kind %s but got %s", kind, failure));
        return failure;
    }

    /**
     * Asserts that two retrieval results describe the same slot state.
     *
     * <p>Failures are compared by kind only, because each read reports its own cause.</p>
     *
     * @param expected the result observed first
     * @param actual the result observed later
     */
    public static void assertSameSlotState(RetrievalResult expected, RetrievalResult actual) {
        if (expected instanceof Failure expectedFailure) {
            assertTrue(actual instanceof Failure,
                    String.format("Expected retrieval failure %s but got %s", expected, actual));
            assertEquals(expectedFailure.failure().kind(), ((Failure) actual).failure().kind());
            return;
        }
        assertEquals(expected, actual,
                String.format("Expected slot state %s to be unchanged but got %s", expected, actual));
    }

    /**
     * Asserts that a write operation completed without error.
     *
     * @param result the operation result
     * @param operation the operation name used in the failure message
     */
    public static void assertNoError(Optional<StoreFailure> result, String operation) {
        assertTrue(result.isEmpty(),
                String.format("Expected %s to succeed but got %s", operation, result.orElse(null)));
    }

    /**
     * Asserts that a write operation completed with an error of the given kind.
     *
     * @param result the operation result
     * @param kind the expected failure kind
     */
    public static void assertError(Optional<StoreFailure> result, FailureKind kind) {
        assertTrue(result.isPresent(),
                String.format("Expected %s failure but the operation succeeded", kind));
        assertEquals(kind, result.get().kind(),
                String.format("Expected failure kind %s but got %s", kind, result.get()));
    }

    /**
     * Waits for a store future, failing the test on timeout or exceptional completion.
     *
     * @param future the future to wait for
     * @param operation the operation name used in the failure message
     * @param <T> the result type
     * @return the completed value
     */
    public static <T> T await(CompletableFuture<T> future, String operation) {
        assertNotNull(future, operation + " returned no future");
        try {
            return future.get(COMPLETION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            return fail(operation + " did not complete within " + COMPLETION_TIMEOUT_SECONDS + "s");
        } catch (ExecutionException e) {
            return fail(operation + " completed exceptionally instead of delivering a result", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Await interrupted", e);
        }
    }
}
