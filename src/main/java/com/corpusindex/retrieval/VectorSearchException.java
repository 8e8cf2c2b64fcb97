package com.corpusindex.retrieval;

import java.io.IOException;

public class VectorSearchException extends IOException {
    private final boolean retryable;

    public VectorSearchException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public VectorSearchException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
