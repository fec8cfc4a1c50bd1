package com.ryuqq.feedstore.core.retrieval;

import com.ryuqq.feedstore.core.failure.StoreFailure;

/**
 * 조회 실패 결과.
 *
 * <p>저장 데이터가 존재하지만 해석할 수 없는 경우입니다. 손상은 조회로 복구되지 않으며,
 * 외부 조치나 이후의 insert/delete 전까지 동일한 Failure가 반복됩니다.</p>
 *
 * @param failure 실패 정보
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public record Failure(StoreFailure failure) implements RetrievalResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException failure가 null인 경우
     */
    public Failure {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
    }
}
