package com.ryuqq.feedstore.core.retrieval;

import com.ryuqq.feedstore.core.model.CachedFeed;
import com.ryuqq.feedstore.core.model.FeedImage;

import java.time.Instant;
import java.util.List;

/**
 * 조회 성공 결과.
 *
 * <p>마지막으로 성공한 insert의 피드와 시각을 그대로 담습니다.</p>
 *
 * @param cachedFeed 저장된 스냅샷
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public record Found(CachedFeed cachedFeed) implements RetrievalResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cachedFeed가 null인 경우
     */
    public Found {
        if (cachedFeed == null) {
            throw new IllegalArgumentException("cachedFeed cannot be null");
        }
    }

    /**
     * 저장된 이미지 목록.
     *
     * @return 삽입 순서를 유지한 불변 리스트
     */
    public List<FeedImage> feed() {
        return cachedFeed.feed();
    }

    /**
     * 저장된 삽입 시각.
     *
     * @return timestamp
     */
    public Instant timestamp() {
        return cachedFeed.timestamp();
    }
}
