package com.corpusindex.index;

import java.io.IOException;

public class IndexPublishException extends IOException {
    public IndexPublishException(String message) {
        super(message);
    }

    public IndexPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
