package com.ryuqq.feedstore.adapter.file.store;

import java.nio.file.Path;

/**
 * FileSystemFeedStore configuration.
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li><strong>storePath:</strong> file holding the slot; its parent directory must already exist</li>
 *   <li><strong>ioThreads:</strong> threads running file I/O (default: 2)</li>
 * </ul>
 *
 * @param storePath file holding the slot
 * @param ioThreads number of I/O threads
 * @author FeedStore Team
 * @since 1.0.0
 */
public record FileFeedStoreConfig(
    Path storePath,
    int ioThreads
) {

    private static final int DEFAULT_IO_THREADS = 2;

    /**
     * Creates a configuration with the default thread count.
     *
     * @param storePath file holding the slot
     */
    public FileFeedStoreConfig(Path storePath) {
        this(storePath, DEFAULT_IO_THREADS);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if storePath is null or names no file, or ioThreads is not positive
     */
    public FileFeedStoreConfig {
        if (storePath == null) {
            throw new IllegalArgumentException("storePath cannot be null");
        }
        if (storePath.getFileName() == null) {
            throw new IllegalArgumentException("storePath must name a file (current: " + storePath + ")");
        }
        if (ioThreads <= 0) {
            throw new IllegalArgumentException("ioThreads must be positive (current: " + ioThreads + ")");
        }
    }

    /**
     * Directory inserts are staged in, the directory holding {@link #storePath()}.
     *
     * @return absolute staging directory
     */
    public Path stagingDirectory() {
        return storePath.toAbsolutePath().getParent();
    }

    /**
     * Name prefix of staging files; each insert adds a unique suffix and {@code .tmp}.
     *
     * @return the staging file prefix
     */
    public String stagingPrefix() {
        return storePath.getFileName() + ".";
    }

    /**
     * Creates a copy with a different store path.
     *
     * @param newStorePath file holding the slot
     * @return new FileFeedStoreConfig instance
     */
    public FileFeedStoreConfig withStorePath(Path newStorePath) {
        return new FileFeedStoreConfig(newStorePath, ioThreads);
    }

    /**
     * Creates a copy with a different I/O thread count.
     *
     * @param newIoThreads number of I/O threads
     * @return new FileFeedStoreConfig instance
     */
    public FileFeedStoreConfig withIoThreads(int newIoThreads) {
        return new FileFeedStoreConfig(storePath, newIoThreads);
    }
}
