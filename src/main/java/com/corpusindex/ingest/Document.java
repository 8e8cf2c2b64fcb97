package com.corpusindex.ingest;

public record Document(String name, String text, String sourceLocation) {
}
