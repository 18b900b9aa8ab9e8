package com.delta.feedscout.feed.source;

public class FeedSourceException extends RuntimeException {
    public FeedSourceException(String message) {
        super(message);
    }

    public FeedSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
