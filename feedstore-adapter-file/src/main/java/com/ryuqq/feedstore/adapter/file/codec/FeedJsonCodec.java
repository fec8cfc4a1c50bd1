package com.ryuqq.feedstore.adapter.file.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.feedstore.core.model.CachedFeed;
import com.ryuqq.feedstore.core.model.FeedImage;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for the persisted slot.
 *
 * <p><strong>Layout:</strong></p>
 * <pre>
 * {
 *   "timestamp": "2024-01-01T10:15:30.123456789Z",
 *   "feed": [
 *     {"id": "&lt;uuid&gt;", "description": "...", "location": null, "url": "https://..."}
 *   ]
 * }
 * </pre>
 *
 * <p>The timestamp is written as an ISO-8601 instant, so nanosecond precision survives.
 * Decoding is strict: every record must carry a valid id and url, and anything the encoder
 * would not have produced is rejected as a whole.</p>
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public final class FeedJsonCodec {

    private final ObjectMapper objectMapper;

    /**
     * Creates a codec with its own ObjectMapper.
     */
    public FeedJsonCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    /**
     * Creates a codec on a caller-supplied ObjectMapper.
     *
     * @param objectMapper the mapper
     * @throws IllegalArgumentException if objectMapper is null
     */
    public FeedJsonCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Encodes a cached feed as UTF-8 JSON.
     *
     * @param cachedFeed the slot value
     * @return JSON bytes
     * @throws FeedCodecException if serialization fails
     */
    public byte[] encode(CachedFeed cachedFeed) throws FeedCodecException {
        if (cachedFeed == null) {
            throw new IllegalArgumentException("cachedFeed cannot be null");
        }

        List<ImageDocument> images = new ArrayList<>(cachedFeed.feed().size());
        for (FeedImage image : cachedFeed.feed()) {
            images.add(new ImageDocument(
                image.id().toString(),
                image.description(),
                image.location(),
                image.url().toString()
            ));
        }

        try {
            return objectMapper.writeValueAsBytes(new FeedDocument(cachedFeed.timestamp().toString(), images));
        } catch (JsonProcessingException e) {
            throw new FeedCodecException("cannot encode cached feed: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes UTF-8 JSON into a cached feed.
     *
     * @param content JSON bytes
     * @return the slot value
     * @throws FeedCodecException if the content is not a valid cached feed
     */
    public CachedFeed decode(byte[] content) throws FeedCodecException {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }

        FeedDocument document;
        try {
            document = objectMapper.readValue(content, FeedDocument.class);
        } catch (IOException e) {
            throw new FeedCodecException("malformed cached feed: " + e.getMessage(), e);
        }

        if (document == null) {
            throw new FeedCodecException("cached feed document is null");
        }
        if (document.timestamp() == null) {
            throw new FeedCodecException("cached feed has no timestamp");
        }
        if (document.feed() == null) {
            throw new FeedCodecException("cached feed has no feed");
        }

        Instant timestamp;
        try {
            timestamp = Instant.parse(document.timestamp());
        } catch (DateTimeParseException e) {
            throw new FeedCodecException("invalid timestamp: " + document.timestamp(), e);
        }

        List<FeedImage> feed = new ArrayList<>(document.feed().size());
        for (int i = 0; i < document.feed().size(); i++) {
            ImageDocument image = document.feed().get(i);
            if (image == null) {
                throw new FeedCodecException("feed[" + i + "] is null");
            }
            try {
                feed.add(FeedImage.of(image.id(), image.description(), image.location(), image.url()));
            } catch (IllegalArgumentException e) {
                throw new FeedCodecException("feed[" + i + "] is invalid: " + e.getMessage(), e);
            }
        }
        return CachedFeed.of(feed, timestamp);
    }

    record FeedDocument(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("feed")      List<ImageDocument> feed
    ) {}

    record ImageDocument(
        @JsonProperty("id")          String id,
        @JsonProperty("description") String description,
        @JsonProperty("location")    String location,
        @JsonProperty("url")         String url
    ) {}
}
