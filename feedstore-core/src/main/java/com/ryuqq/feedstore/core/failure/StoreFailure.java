package com.ryuqq.feedstore.core.failure;

/**
 * 저장소 작업 실패.
 *
 * <p>모든 저장소 실패는 예외로 던져지지 않고 작업의 결과 값으로 전달됩니다.
 * 재시도나 사용자 노출 여부는 호출자가 결정합니다.</p>
 *
 * <p>실패한 작업은 슬롯을 호출 이전 상태 그대로 남깁니다 (all-or-nothing).</p>
 *
 * @param kind 실패 분류
 * @param message 실패 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public record StoreFailure(
    FailureKind kind,
    String message,
    Throwable cause
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public StoreFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * StoreFailure 생성 (cause 포함).
     *
     * @param kind 실패 분류
     * @param message 실패 메시지
     * @param cause 원인
     * @return StoreFailure 인스턴스
     */
    public static StoreFailure of(FailureKind kind, String message, Throwable cause) {
        return new StoreFailure(kind, message, cause);
    }

    /**
     * cause 없이 StoreFailure 생성.
     *
     * @param kind 실패 분류
     * @param message 실패 메시지
     * @return StoreFailure 인스턴스
     */
    public static StoreFailure of(FailureKind kind, String message) {
        return new StoreFailure(kind, message, null);
    }

    /**
     * 손상된 저장 데이터로 인한 조회 실패.
     *
     * @param message 실패 메시지
     * @param cause 원인
     * @return RETRIEVAL 실패
     */
    public static StoreFailure retrieval(String message, Throwable cause) {
        return new StoreFailure(FailureKind.RETRIEVAL, message, cause);
    }

    /**
     * 쓰기 불가능한 저장 위치로 인한 삽입 실패.
     *
     * @param message 실패 메시지
     * @param cause 원인
     * @return INSERTION 실패
     */
    public static StoreFailure insertion(String message, Throwable cause) {
        return new StoreFailure(FailureKind.INSERTION, message, cause);
    }

    /**
     * 수정 불가능한 저장 위치로 인한 삭제 실패.
     *
     * @param message 실패 메시지
     * @param cause 원인
     * @return DELETION 실패
     */
    public static StoreFailure deletion(String message, Throwable cause) {
        return new StoreFailure(FailureKind.DELETION, message, cause);
    }

    @Override
    public String toString() {
        return "StoreFailure{kind=" + kind + ", message=" + message
            + (cause != null ? ", cause=" + cause.getClass().getSimpleName() : "") + '}';
    }
}
