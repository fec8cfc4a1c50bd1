package com.ryuqq.feedstore.core.retrieval;

import com.ryuqq.feedstore.core.failure.StoreFailure;
import com.ryuqq.feedstore.core.model.CachedFeed;

/**
 * 캐시 조회 결과.
 *
 * <p>RetrievalResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Empty}: 슬롯이 비어 있음 (한 번도 기록되지 않은 경우 포함)</li>
 *   <li>{@link Found}: 마지막으로 삽입된 피드와 시각</li>
 *   <li>{@link Failure}: 저장 데이터가 존재하지만 해석할 수 없음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 알려져 있습니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (result instanceof Found found) {
 *     render(found.feed());
 * } else if (result instanceof Failure failure) {
 *     log(failure.failure().message());
 * }
 * </pre>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public sealed interface RetrievalResult permits Empty, Found, Failure {

    /**
     * 빈 슬롯 결과.
     *
     * @return Empty 인스턴스
     */
    static RetrievalResult empty() {
        return Empty.INSTANCE;
    }

    /**
     * 조회 성공 결과.
     *
     * @param cachedFeed 저장된 스냅샷
     * @return Found 인스턴스
     */
    static RetrievalResult found(CachedFeed cachedFeed) {
        return new Found(cachedFeed);
    }

    /**
     * 조회 실패 결과.
     *
     * @param failure 실패 정보
     * @return Failure 인스턴스
     */
    static RetrievalResult failure(StoreFailure failure) {
        return new Failure(failure);
    }

    /**
     * 슬롯이 비어 있는지 확인.
     *
     * @return Empty 여부
     */
    default boolean isEmpty() {
        return this instanceof Empty;
    }

    /**
     * 캐시가 조회되었는지 확인.
     *
     * @return Found 여부
     */
    default boolean isFound() {
        return this instanceof Found;
    }

    /**
     * 조회가 실패했는지 확인.
     *
     * @return Failure 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }
}
