package com.ryuqq.feedstore.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 캐시 슬롯에 저장되는 피드 스냅샷.
 *
 * <p>삽입된 순서 그대로의 이미지 목록과 삽입 시각으로 구성됩니다.
 * 빈 목록도 유효한 스냅샷이며, "캐시 없음"과는 구분됩니다.</p>
 *
 * <p><strong>불변성:</strong> feed는 방어적으로 복사된 불변 리스트입니다.</p>
 *
 * @param feed 이미지 목록 (순서 유지, 빈 목록 허용)
 * @param timestamp 삽입 시각
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public record CachedFeed(
    List<FeedImage> feed,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException feed, feed 원소 또는 timestamp가 null인 경우
     */
    public CachedFeed {
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        if (feed.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("feed cannot contain null images");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        feed = List.copyOf(feed);
    }

    /**
     * CachedFeed 생성.
     *
     * @param feed 이미지 목록
     * @param timestamp 삽입 시각
     * @return CachedFeed 인스턴스
     */
    public static CachedFeed of(List<FeedImage> feed, Instant timestamp) {
        return new CachedFeed(feed, timestamp);
    }

    /**
     * 빈 피드 여부.
     *
     * @return 이미지가 하나도 없으면 true
     */
    public boolean isEmptyFeed() {
        return feed.isEmpty();
    }
}
