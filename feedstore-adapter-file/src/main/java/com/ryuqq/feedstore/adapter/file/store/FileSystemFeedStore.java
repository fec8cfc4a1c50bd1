package com.ryuqq.feedstore.adapter.file.store;

import com.ryuqq.feedstore.adapter.file.codec.FeedJsonCodec;
import com.ryuqq.feedstore.core.failure.FailureKind;
import com.ryuqq.feedstore.core.failure.StoreFailure;
import com.ryuqq.feedstore.core.model.CachedFeed;
import com.ryuqq.feedstore.core.model.FeedImage;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;
import com.ryuqq.feedstore.core.spi.FeedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * File-based implementation of {@link FeedStore} SPI.
 *
 * <p>The slot is a single JSON document (see {@link FeedJsonCodec}) at
 * {@link FileFeedStoreConfig#storePath()}.</p>
 *
 * <p><strong>Storage Semantics:</strong></p>
 * <ul>
 *   <li><strong>retrieve:</strong> missing file is an empty slot; unreadable or undecodable
 *       content is a RETRIEVAL failure and the file is left as it is</li>
 *   <li><strong>insert:</strong> the document is written to a staging file of its own in the
 *       store's directory and moved over the store file, so readers only ever see a whole
 *       document and a failed insert leaves the slot as it was</li>
 *   <li><strong>delete:</strong> removes the store file; a missing file is not an error</li>
 * </ul>
 *
 * <p><strong>Threading:</strong> operations run on a private I/O pool. Unwrapped concurrent calls
 * may complete in any order; concurrent inserts never share a staging file, so the slot always
 * holds one of the inserted documents. Use {@code SerialFeedStore} for submission-order semantics.</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public class FileSystemFeedStore implements FeedStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileSystemFeedStore.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final FileFeedStoreConfig config;
    private final FeedJsonCodec codec;
    private final ExecutorService ioExecutor;

    /**
     * Creates a store at the given path with default settings.
     *
     * @param storePath file holding the slot
     */
    public FileSystemFeedStore(Path storePath) {
        this(new FileFeedStoreConfig(storePath));
    }

    /**
     * Creates a store with the given configuration.
     *
     * @param config store configuration
     */
    public FileSystemFeedStore(FileFeedStoreConfig config) {
        this(config, new FeedJsonCodec());
    }

    /**
     * Creates a store with the given configuration and codec.
     *
     * @param config store configuration
     * @param codec JSON codec
     * @throws IllegalArgumentException if any argument is null
     */
    public FileSystemFeedStore(FileFeedStoreConfig config, FeedJsonCodec codec) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.config = config;
        this.codec = codec;

        AtomicInteger threadNumber = new AtomicInteger();
        this.ioExecutor = Executors.newFixedThreadPool(config.ioThreads(), runnable -> {
            Thread thread = new Thread(runnable, "feed-store-io-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public CompletableFuture<RetrievalResult> retrieve() {
        return runAsync("retrieve", FailureKind.RETRIEVAL, this::readSlot, RetrievalResult::failure);
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

        CachedFeed cachedFeed = CachedFeed.of(feed, timestamp);
        return runAsync("insert", FailureKind.INSERTION, () -> writeSlot(cachedFeed), Optional::of);
    }

    @Override
    public CompletableFuture<Optional<StoreFailure>> deleteCachedFeed() {
        return runAsync("delete", FailureKind.DELETION, this::deleteSlot, Optional::of);
    }

    /**
     * Stops the I/O pool after running operations already handed to it.
     */
    @Override
    public void close() {
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("I/O pool for {} did not stop within {}s", config.storePath(), SHUTDOWN_TIMEOUT_SECONDS);
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ioExecutor.shutdownNow();
        }
    }

    /**
     * Returns the configuration this store was created with.
     *
     * @return store configuration
     */
    public FileFeedStoreConfig getConfig() {
        return config;
    }

    private <T> CompletableFuture<T> runAsync(String operation,
                                              FailureKind kind,
                                              Supplier<T> body,
                                              Function<StoreFailure, T> toResult) {
        try {
            return CompletableFuture.supplyAsync(body, ioExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Rejected {} on {}: store is closed", operation, config.storePath());
            return CompletableFuture.completedFuture(toResult.apply(StoreFailure.of(kind, "store is closed", e)));
        }
    }

    private RetrievalResult readSlot() {
        Path storePath = config.storePath();
        byte[] content;
        try {
            content = Files.readAllBytes(storePath);
        } catch (NoSuchFileException e) {
            log.debug("No cached feed at {}", storePath);
            return RetrievalResult.empty();
        } catch (IOException e) {
            log.warn("Cannot read cached feed at {}: {}", storePath, e.toString());
            return RetrievalResult.failure(StoreFailure.retrieval("cannot read " + storePath + ": " + e, e));
        }

        try {
            CachedFeed cachedFeed = codec.decode(content);
            log.debug("Read cached feed at {} ({} images)", storePath, cachedFeed.feed().size());
            return RetrievalResult.found(cachedFeed);
        } catch (IOException e) {
            log.warn("Corrupted cached feed at {}: {}", storePath, e.getMessage());
            return RetrievalResult.failure(StoreFailure.retrieval("corrupted cached feed at " + storePath, e));
        }
    }

    private Optional<StoreFailure> writeSlot(CachedFeed cachedFeed) {
        Path storePath = config.storePath();
        Path stagingPath = null;
        try {
            byte[] content = codec.encode(cachedFeed);
            stagingPath = Files.createTempFile(config.stagingDirectory(), config.stagingPrefix(), ".tmp");
            Files.write(stagingPath, content);
            replace(stagingPath, storePath);
            log.debug("Wrote cached feed to {} ({} images)", storePath, cachedFeed.feed().size());
            return Optional.empty();
        } catch (IOException e) {
            if (stagingPath != null) {
                discardStaging(stagingPath, e);
            }
            log.warn("Cannot write cached feed to {}: {}", storePath, e.toString());
            return Optional.of(StoreFailure.insertion("cannot write " + storePath + ": " + e, e));
        }
    }

    private Optional<StoreFailure> deleteSlot() {
        Path storePath = config.storePath();
        try {
            boolean deleted = Files.deleteIfExists(storePath);
            log.debug("Deleted cached feed at {} (existed: {})", storePath, deleted);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cannot delete cached feed at {}: {}", storePath, e.toString());
            return Optional.of(StoreFailure.deletion("cannot delete " + storePath + ": " + e, e));
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardStaging(Path stagingPath, IOException failure) {
        try {
            Files.deleteIfExists(stagingPath);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
