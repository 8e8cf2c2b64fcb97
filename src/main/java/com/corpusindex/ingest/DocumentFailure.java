package com.corpusindex.ingest;

public record DocumentFailure(String documentName, Stage stage, String reason) {

    public enum Stage {
        LOAD,
        CHUNK,
        EMBED
    }
}
