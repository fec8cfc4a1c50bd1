package com.ryuqq.feedstore.adapter.file.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.feedstore.core.failure.FailureKind;
import com.ryuqq.feedstore.core.failure.StoreFailure;
import com.ryuqq.feedstore.core.model.CachedFeed;
import com.ryuqq.feedstore.core.model.FeedImage;
import com.ryuqq.feedstore.core.retrieval.Failure;
import com.ryuqq.feedstore.core.retrieval.Found;
import com.ryuqq.feedstore.core.retrieval.RetrievalResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FileSystemFeedStore used without the serialization wrapper.
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
class FileSystemFeedStoreTest {

    private static final Instant TIMESTAMP = Instant.parse("2024-03-01T12:00:00.123456789Z");
    private static final FeedImage IMAGE = FeedImage.of(
        "6c1a0e1e-3a0f-4a57-9d7e-0f5c7e2c9b11", "a description", null, "https://example.com/image.png");

    @TempDir
    Path directory;

    private Path storePath;
    private FileSystemFeedStore store;

    @BeforeEach
    void setUp() {
        storePath = directory.resolve("feed.json");
        store = new FileSystemFeedStore(storePath);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    // ============================================================
    // Retrieve
    // ============================================================

    @Test
    void retrieve_MissingFile_DeliversEmpty() throws Exception {
        RetrievalResult result = store.retrieve().get(5, TimeUnit.SECONDS);

        assertThat(result.isEmpty()).isTrue();
        assertThat(storePath).doesNotExist();
    }

    @Test
    void retrieve_InvalidRecord_DeliversFailureAndKeepsFile() throws Exception {
        // Given
        String content = "{\"timestamp\":\"2024-03-01T12:00:00Z\",\"feed\":"
            + "[{\"id\":\"not-a-uuid\",\"description\":null,\"location\":null,\"url\":\"https://example.com\"}]}";
        Files.writeString(storePath, content);

        // When
        RetrievalResult result = store.retrieve().get(5, TimeUnit.SECONDS);

        // Then
        assertThat(result).isInstanceOf(Failure.class);
        assertThat(((Failure) result).failure().kind()).isEqualTo(FailureKind.RETRIEVAL);
        assertThat(Files.readString(storePath)).isEqualTo(content);
    }

    // ============================================================
    // Insert
    // ============================================================

    @Test
    void insert_WritesJsonDocumentAndRemovesStagingFile() throws Exception {
        // When
        Optional<StoreFailure> error = store.insert(List.of(IMAGE), TIMESTAMP).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(error).isEmpty();
        assertThat(stagingFiles()).isEmpty();

        JsonNode document = new ObjectMapper().readTree(Files.readAllBytes(storePath));
        assertThat(document.get("timestamp").asText()).isEqualTo("2024-03-01T12:00:00.123456789Z");
        assertThat(document.get("feed").size()).isEqualTo(1);
        assertThat(document.get("feed").get(0).get("id").asText()).isEqualTo(IMAGE.id().toString());
        assertThat(document.get("feed").get(0).get("location").isNull()).isTrue();
        assertThat(document.get("feed").get(0).get("url").asText()).isEqualTo("https://example.com/image.png");
    }

    @Test
    void insert_ThenRetrieve_DeliversSameFeedWithNanosecondTimestamp() throws Exception {
        store.insert(List.of(IMAGE), TIMESTAMP).get(5, TimeUnit.SECONDS);

        RetrievalResult result = store.retrieve().get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo(RetrievalResult.found(CachedFeed.of(List.of(IMAGE), TIMESTAMP)));
    }

    @Test
    void insert_MissingParentDirectory_DeliversErrorWithoutCreatingIt() throws Exception {
        // Given
        Path missingParent = directory.resolve("missing");
        try (FileSystemFeedStore nested = new FileSystemFeedStore(missingParent.resolve("feed.json"))) {

            // When
            Optional<StoreFailure> error = nested.insert(List.of(IMAGE), TIMESTAMP).get(5, TimeUnit.SECONDS);

            // Then
            assertThat(error).hasValueSatisfying(failure -> assertThat(failure.kind()).isEqualTo(FailureKind.INSERTION));
            assertThat(missingParent).doesNotExist();
        }
    }

    @Test
    void insert_ParentIsRegularFile_DeliversError() throws Exception {
        Path file = Files.writeString(directory.resolve("file.txt"), "x");
        try (FileSystemFeedStore nested = new FileSystemFeedStore(file.resolve("feed.json"))) {

            Optional<StoreFailure> error = nested.insert(List.of(IMAGE), TIMESTAMP).get(5, TimeUnit.SECONDS);

            assertThat(error).hasValueSatisfying(failure -> assertThat(failure.kind()).isEqualTo(FailureKind.INSERTION));
            assertThat(Files.readString(file)).isEqualTo("x");
        }
    }

    @Test
    void insert_TargetIsNonEmptyDirectory_DeliversErrorAndRemovesStagingFile() throws Exception {
        // Given
        Files.createDirectory(storePath);
        Files.writeString(storePath.resolve("occupied"), "x");

        // When
        Optional<StoreFailure> error = store.insert(List.of(IMAGE), TIMESTAMP).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(error).hasValueSatisfying(failure -> assertThat(failure.kind()).isEqualTo(FailureKind.INSERTION));
        assertThat(stagingFiles()).isEmpty();
        assertThat(storePath.resolve("occupied")).exists();
    }

    @Test
    void insert_ConcurrentUnwrappedCalls_LeaveOneWholeDocument() throws Exception {
        try (FileSystemFeedStore concurrentStore = new FileSystemFeedStore(new FileFeedStoreConfig(storePath, 4))) {
            for (int round = 0; round < 50; round++) {
                // Given: documents of different sizes
                List<CachedFeed> candidates = new ArrayList<>();
                for (int writer = 0; writer < 4; writer++) {
                    candidates.add(CachedFeed.of(images(writer * 20 + 1), TIMESTAMP.plusSeconds(round * 4L + writer)));
                }

                // When: inserted concurrently without the serialization wrapper
                List<CompletableFuture<Optional<StoreFailure>>> inserts = new ArrayList<>();
                for (CachedFeed candidate : candidates) {
                    inserts.add(concurrentStore.insert(candidate.feed(), candidate.timestamp()));
                }

                // Then: every insert succeeds and the slot holds exactly one of the documents
                for (CompletableFuture<Optional<StoreFailure>> insert : inserts) {
                    assertThat(insert.get(5, TimeUnit.SECONDS)).isEmpty();
                }
                RetrievalResult result = concurrentStore.retrieve().get(5, TimeUnit.SECONDS);
                assertThat(result).isInstanceOf(Found.class);
                assertThat(candidates).contains(((Found) result).cachedFeed());
            }
        }
        assertThat(stagingFiles()).isEmpty();
    }

    @Test
    void insert_ReplacesCorruptedContent() throws Exception {
        Files.write(storePath, "invalidData".getBytes(StandardCharsets.UTF_8));

        store.insert(List.of(), TIMESTAMP).get(5, TimeUnit.SECONDS);

        assertThat(store.retrieve().get(5, TimeUnit.SECONDS))
            .isEqualTo(RetrievalResult.found(CachedFeed.of(List.of(), TIMESTAMP)));
    }

    @Test
    void insert_NullArguments_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> store.insert(null, TIMESTAMP))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("feed cannot be null");
        assertThatThrownBy(() -> store.insert(Arrays.asList(IMAGE, null), TIMESTAMP))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("feed cannot contain null images");
        assertThatThrownBy(() -> store.insert(List.of(IMAGE), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("timestamp cannot be null");
    }

    // ============================================================
    // Delete
    // ============================================================

    @Test
    void delete_RemovesStoreFile() throws Exception {
        store.insert(List.of(IMAGE), TIMESTAMP).get(5, TimeUnit.SECONDS);

        Optional<StoreFailure> error = store.deleteCachedFeed().get(5, TimeUnit.SECONDS);

        assertThat(error).isEmpty();
        assertThat(storePath).doesNotExist();
    }

    @Test
    void delete_ClearsCorruptedContent() throws Exception {
        Files.write(storePath, "invalidData".getBytes(StandardCharsets.UTF_8));

        store.deleteCachedFeed().get(5, TimeUnit.SECONDS);

        assertThat(store.retrieve().get(5, TimeUnit.SECONDS).isEmpty()).isTrue();
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Test
    void operationsAfterClose_DeliverFailureValues() throws Exception {
        // Given
        store.close();

        // When
        RetrievalResult retrieved = store.retrieve().get(5, TimeUnit.SECONDS);
        Optional<StoreFailure> inserted = store.insert(List.of(IMAGE), TIMESTAMP).get(5, TimeUnit.SECONDS);
        Optional<StoreFailure> deleted = store.deleteCachedFeed().get(5, TimeUnit.SECONDS);

        // Then
        assertThat(((Failure) retrieved).failure().message()).isEqualTo("store is closed");
        assertThat(inserted).hasValueSatisfying(failure -> assertThat(failure.kind()).isEqualTo(FailureKind.INSERTION));
        assertThat(deleted).hasValueSatisfying(failure -> assertThat(failure.kind()).isEqualTo(FailureKind.DELETION));
        assertThat(storePath).doesNotExist();
    }

    @Test
    void constructor_StorePathOnly_UsesDefaultConfig() {
        assertThat(store.getConfig()).isEqualTo(new FileFeedStoreConfig(storePath, 2));
    }

    @Test
    void constructor_NullArguments_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> new FileSystemFeedStore((FileFeedStoreConfig) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> new FileSystemFeedStore(new FileFeedStoreConfig(storePath), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("codec cannot be null");
    }

    private List<Path> stagingFiles() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(file -> file.getFileName().toString().endsWith(".tmp"))
                .collect(Collectors.toList());
        }
    }

    private static List<FeedImage> images(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> FeedImage.of(UUID.randomUUID().toString(), "description " + i, "location " + i,
                "https://example.com/image-" + i + ".png"))
            .collect(Collectors.toList());
    }
}
