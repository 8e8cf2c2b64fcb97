package com.corpusindex.index;

import java.nio.file.Path;
import java.util.List;

/**
 * A version whose files are fully written but which no reader can see yet.
 */
public record StagedIndex(IndexVersion version, Path versionDir, List<Path> shardPaths, Path chunkDetailPath) {
}
