package com.ryuqq.feedstore.testkit.contract;

import com.ryuqq.feedstore.core.model.FeedImage;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Test data factory for contract tests.
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public final class FeedStoreFixtures {

    private FeedStoreFixtures() {
    }

    /**
     * Creates an image with a random id and every optional field set.
     *
     * @return a new image
     */
    public static FeedImage uniqueImage() {
        return FeedImage.of(UUID.randomUUID().toString(), "any description", "any location", "https://any-url.com/image.png");
    }

    /**
     * Creates an image with a random id and no optional fields.
     *
     * @return a new image with null description and location
     */
    public static FeedImage uniqueImageWithoutDetails() {
        return FeedImage.of(UUID.randomUUID().toString(), null, null, "https://any-url.com/bare.png");
    }

    /**
     * Creates a two-image feed mixing populated and empty optional fields.
     *
     * @return an ordered, immutable feed
     */
    public static List<FeedImage> uniqueFeed() {
        return List.of(uniqueImage(), uniqueImageWithoutDetails());
    }

    /**
     * Returns the current instant, keeping sub-millisecond precision where the clock has it.
     *
     * @return a timestamp
     */
    public static Instant anyTimestamp() {
        return Instant.now();
    }
}
