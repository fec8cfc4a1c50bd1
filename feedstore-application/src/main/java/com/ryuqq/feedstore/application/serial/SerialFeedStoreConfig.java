package com.ryuqq.feedstore.application.serial;

/**
 * SerialFeedStore 설정 (불변 record).
 *
 * <p>이 record는 SerialFeedStore 작업 큐의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerName: 작업 스레드 이름 (기본 "feed-store-serial")</li>
 *   <li>shutdownTimeoutMs: close() 시 남은 작업 처리 대기 시간 (기본 10000ms = 10초)</li>
 * </ul>
 *
 * <p>백엔드 작업 한 건에는 시간 제한이 없습니다. 작업은 delegate가 완료할 때까지 기다린 뒤에만
 * 완료되며, 그 전에 다음 작업이 시작되지 않습니다.</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 * @param workerName 작업 스레드 이름 (null 또는 빈 문자열 불가)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record SerialFeedStoreConfig(
    String workerName,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerName="feed-store-serial", shutdownTimeoutMs=10000ms</p>
     */
    public SerialFeedStoreConfig() {
        this("feed-store-serial", 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SerialFeedStoreConfig {
        if (workerName == null || workerName.isBlank()) {
            throw new IllegalArgumentException("workerName cannot be null or blank");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * workerName만 변경한 새 인스턴스 생성.
     *
     * @param workerName 새로운 스레드 이름
     * @return 새 SerialFeedStoreConfig 인스턴스
     */
    public SerialFeedStoreConfig withWorkerName(String workerName) {
        return new SerialFeedStoreConfig(workerName, this.shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param shutdownTimeoutMs 새로운 종료 대기 시간 (밀리초)
     * @return 새 SerialFeedStoreConfig 인스턴스
     */
    public SerialFeedStoreConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new SerialFeedStoreConfig(this.workerName, shutdownTimeoutMs);
    }
}
