package com.corpusindex.retrieval;

import java.io.IOException;

public class RetrievalException extends IOException {
    public RetrievalException(String message) {
        super(message);
    }

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
