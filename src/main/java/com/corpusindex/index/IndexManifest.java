package com.corpusindex.index;

import java.time.Instant;

public record IndexManifest(IndexVersion current, IndexVersion previous, Instant updatedAt) {
}
