package com.corpusindex.retrieval;

public record Neighbor(String id, float score) {
}
