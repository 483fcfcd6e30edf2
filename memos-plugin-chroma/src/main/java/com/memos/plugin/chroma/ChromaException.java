package com.memos.plugin.chroma;

/**
 * Failure reported by Chroma or by the transport to it. {@link #getStatusCode()} is the HTTP status
 * for server responses and -1 for transport or local failures.
 */
public class ChromaException extends RuntimeException {

    private final int statusCode;

    public ChromaException(String message) {
        this(message, -1, null);
    }

    public ChromaException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ChromaException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    private ChromaException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
