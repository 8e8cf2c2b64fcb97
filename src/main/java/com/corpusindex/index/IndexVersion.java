package com.corpusindex.index;

import java.time.Instant;
import java.util.List;

/**
 * A complete, immutable index build. Locations are relative to the index root.
 */
public record IndexVersion(
        String versionId,
        Instant createdAt,
        List<String> shardLocations,
        String chunkDetailLocation,
        int recordCount,
        BuildInfo build) {
}
