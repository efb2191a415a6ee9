package com.example.summaryscheduler.exception;

import lombok.Getter;

/**
 * Exception raised by a content source that cannot read the requested source
 */
@Getter
public class ContentAccessException extends RuntimeException {

    public enum Reason {
        ACCESS_DENIED,
        NOT_FOUND,
        UNAVAILABLE
    }

    private final String sourceRef;
    private final Reason reason;

    public ContentAccessException(String sourceRef, Reason reason, String message) {
        super(String.format("[%s] %s: %s", sourceRef, reason, message));
        this.sourceRef = sourceRef;
        this.reason = reason;
    }

    public ContentAccessException(String sourceRef, Reason reason, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", sourceRef, reason, message), cause);
        this.sourceRef = sourceRef;
        this.reason = reason;
    }
}
