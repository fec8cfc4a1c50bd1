package com.ryuqq.feedstore.core.retrieval;

/**
 * 빈 슬롯.
 *
 * <p>저장 위치가 아직 생성되지 않은 경우도 실패가 아닌 Empty로 보고됩니다.</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public record Empty() implements RetrievalResult {

    static final Empty INSTANCE = new Empty();
}
