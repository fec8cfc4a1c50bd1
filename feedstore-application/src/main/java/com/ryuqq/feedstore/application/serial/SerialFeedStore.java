package com.ryuqq.feedstore.application.serial;

import com.ryuqq.feedstore.core.failure.FailureKind;
import com.ryuqq.feedstore.core.failure.StoreFailure;
import com.ryuqq.feedstore.core.model.FeedImage;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;
import com.ryuqq.feedstore.core.spi.FeedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 작업 직렬화 FeedStore 래퍼.
 *
 * <p>임의의 FeedStore 백엔드를 감싸, 하나의 인스턴스에 제출된 모든 작업이
 * 제출 순서대로 하나씩 실행되고 완료되도록 보장합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * retrieve() / insert() / deleteCachedFeed() 호출
 *   ↓
 * 단일 작업 스레드 큐에 등록 (FIFO)
 *   ↓
 * 작업 스레드:
 *   1. delegate 작업 시작
 *   2. delegate future 완료 대기 (시간 제한 없음, 인터럽트에도 계속 대기)
 *   3. 호출자 future 완료 (동기 콜백은 이 시점에 작업 스레드에서 실행)
 *   4. 다음 작업으로 진행
 * </pre>
 *
 * <p><strong>순서 보장:</strong></p>
 * <ul>
 *   <li>어떤 작업도 이전 작업의 부수효과가 확정되고 완료가 전달되기 전에 시작되지 않음</li>
 *   <li>여러 호출자 스레드가 동시에 제출해도 외부 잠금 불필요</li>
 *   <li>delegate 예외, 예외 완료, null future는 해당 작업 종류의 실패 값으로 변환</li>
 *   <li>느린 delegate 작업도 끝날 때까지 기다림 (실패로 보고한 작업이 나중에 반영되는 일 없음)</li>
 * </ul>
 *
 * <p>완료되지 않는 delegate future는 FeedStore 계약 위반이며, 이 경우 큐는 더 진행하지 않습니다.</p>
 *
 * <p><strong>주의:</strong> 완료 콜백은 작업 스레드에서 실행되므로, 콜백 안에서 같은 인스턴스의
 * 다른 작업 결과를 블로킹 대기(join/get)하면 교착 상태가 됩니다.</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public final class SerialFeedStore implements FeedStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SerialFeedStore.class);

    private final FeedStore delegate;
    private final SerialFeedStoreConfig config;
    private final ExecutorService worker;
    private final AtomicLong sequence;
    private final AtomicBoolean closed;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param delegate 실제 저장소 백엔드
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public SerialFeedStore(FeedStore delegate) {
        this(delegate, new SerialFeedStoreConfig());
    }

    /**
     * 생성자 (커스텀 설정 주입).
     *
     * @param delegate 실제 저장소 백엔드
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SerialFeedStore(FeedStore delegate, SerialFeedStoreConfig config) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.delegate = delegate;
        this.config = config;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, config.workerName());
            thread.setDaemon(true);
            return thread;
        });
        this.sequence = new AtomicLong();
        this.closed = new AtomicBoolean(false);
    }

    @Override
    public CompletableFuture<RetrievalResult> retrieve() {
        return submit("retrieve", FailureKind.RETRIEVAL, delegate::retrieve, RetrievalResult::failure);
    }

    @Override
    public CompletableFuture<Optional<StoreFailure>> insert(List<FeedImage> feed, Instant timestamp) {
        if (feed == null) {
            throw new IllegalArgumentException("feed cannot be null");
        }
        if (feed.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("feed cannot contain null images");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }

        // 제출 시점의 스냅샷을 실행한다
        List<FeedImage> snapshot = List.copyOf(feed);
        return submit("insert", FailureKind.INSERTION, () -> delegate.insert(snapshot, timestamp), Optional::of);
    }

    @Override
    public CompletableFuture<Optional<StoreFailure>> deleteCachedFeed() {
        return submit("delete", FailureKind.DELETION, delegate::deleteCachedFeed, Optional::of);
    }

    /**
     * 작업 큐 종료.
     *
     * <p>새 작업 제출을 막고, 이미 제출된 작업이 shutdownTimeoutMs 안에 끝나기를 기다립니다.
     * 시간 안에 시작하지 못한 작업은 실패 값으로 완료됩니다. 실행 중인 작업은 중단하지 않고
     * delegate 결과 그대로 완료됩니다. 여러 번 호출해도 안전합니다.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        worker.shutdown();
        try {
            if (!worker.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                abandon(worker.shutdownNow());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(worker.shutdownNow());
        }
        log.debug("SerialFeedStore closed after {} submitted operations", sequence.get());
    }

    /**
     * 종료 여부 확인.
     *
     * @return close()가 호출되었으면 true
     */
    public boolean isClosed() {
        return closed.get();
    }

    private <T> CompletableFuture<T> submit(String operation,
                                            FailureKind kind,
                                            Supplier<CompletableFuture<T>> call,
                                            Function<StoreFailure, T> toResult) {
        QueuedOperation<T> queued = new QueuedOperation<>(sequence.incrementAndGet(), operation, kind, call, toResult);

        try {
            worker.execute(queued);
        } catch (RejectedExecutionException e) {
            log.warn("Rejected {} #{}: store is closed", operation, queued.seq);
            queued.fail(StoreFailure.of(kind, "store is closed", e));
        }
        return queued.completion;
    }

    private void abandon(List<Runnable> pending) {
        for (Runnable runnable : pending) {
            if (runnable instanceof QueuedOperation<?> queued) {
                log.warn("Abandoning {} #{}: store closed before it ran", queued.operation, queued.seq);
                queued.fail(StoreFailure.of(queued.kind, "store closed before operation ran"));
            }
        }
    }

    /**
     * 큐에 등록된 작업 한 건.
     *
     * @param <T> 작업 결과 타입
     */
    private final class QueuedOperation<T> implements Runnable {

        private final long seq;
        private final String operation;
        private final FailureKind kind;
        private final Supplier<CompletableFuture<T>> call;
        private final Function<StoreFailure, T> toResult;
        private final CompletableFuture<T> completion;

        QueuedOperation(long seq,
                        String operation,
                        FailureKind kind,
                        Supplier<CompletableFuture<T>> call,
                        Function<StoreFailure, T> toResult) {
            this.seq = seq;
            this.operation = operation;
            this.kind = kind;
            this.call = call;
            this.toResult = toResult;
            this.completion = new CompletableFuture<>();
        }

        @Override
        public void run() {
            log.debug("Executing {} #{}", operation, seq);
            T result;
            try {
                result = execute();
            } catch (Error e) {
                fail(StoreFailure.of(kind, operation + " aborted: " + e, e));
                throw e;
            }
            completion.complete(result);
            log.debug("Completed {} #{}: {}", operation, seq, result);
        }

        void fail(StoreFailure failure) {
            completion.complete(toResult.apply(failure));
        }

        private T execute() {
            try {
                CompletableFuture<T> pending = call.get();
                if (pending == null) {
                    log.error("Backend returned no future for {} #{}", operation, seq);
                    return toResult.apply(StoreFailure.of(kind, operation + " returned no future"));
                }

                // join은 인터럽트(shutdownNow)에도 delegate 완료까지 기다린다
                T result = pending.join();
                if (result == null) {
                    log.error("Backend completed {} #{} without a result", operation, seq);
                    return toResult.apply(StoreFailure.of(kind, operation + " completed without a result"));
                }
                return result;

            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Backend failed {} #{}", operation, seq, cause);
                return toResult.apply(StoreFailure.of(kind, operation + " failed: " + cause.getMessage(), cause));

            } catch (CancellationException e) {
                log.warn("Backend cancelled {} #{}", operation, seq);
                return toResult.apply(StoreFailure.of(kind, operation + " was cancelled", e));

            } catch (RuntimeException e) {
                log.error("Backend threw during {} #{}", operation, seq, e);
                return toResult.apply(StoreFailure.of(kind, operation + " failed: " + e.getMessage(), e));
            }
        }
    }
}
