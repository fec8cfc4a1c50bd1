package com.ryuqq.feedstore.core.failure;

/**
 * 저장소 실패 분류.
 *
 * <p>저장 위치가 한 번도 기록되지 않은 "부재" 상태는 실패가 아니므로
 * 여기에 포함되지 않습니다 (retrieve 결과 {@code Empty}).</p>
 *
 * <ul>
 *   <li>{@link #RETRIEVAL}: 저장 데이터가 존재하지만 해석할 수 없음 (손상)</li>
 *   <li>{@link #INSERTION}: 저장 위치가 유효하지 않거나 쓸 수 없음</li>
 *   <li>{@link #DELETION}: 저장 위치를 수정할 수 없음 (권한 등)</li>
 * </ul>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public enum FailureKind {
    RETRIEVAL,
    INSERTION,
    DELETION
}
