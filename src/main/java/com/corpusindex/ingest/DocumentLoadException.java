package com.corpusindex.ingest;

import java.io.IOException;

public class DocumentLoadException extends IOException {
    private final String documentName;

    public DocumentLoadException(String documentName, String message) {
        super(message);
        this.documentName = documentName;
    }

    public DocumentLoadException(String documentName, String message, Throwable cause) {
        super(message, cause);
        this.documentName = documentName;
    }

    public String documentName() {
        return documentName;
    }
}
