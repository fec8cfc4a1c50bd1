package com.ryuqq.feedstore.adapter.file.codec;

import java.io.IOException;

/**
 * Raised when a cached feed cannot be converted to or from its JSON form.
 *
 * @author FeedStore Team
 * @since 1.0.0
 */
public class FeedCodecException extends IOException {

    public FeedCodecException(String message) {
        super(message);
    }

    public FeedCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
