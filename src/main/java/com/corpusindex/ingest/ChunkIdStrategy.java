package com.corpusindex.ingest;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * How chunk identifiers are assigned. Ids are corpus-wide: the document name is always part of the
 * identity so equal text in two documents never shares an id.
 */
public enum ChunkIdStrategy {
    /**
     * Same document name, position and text give the same id on every run.
     */
    CONTENT_DERIVED {
        @Override
        public String idFor(String documentName, int indexInDocument, int startOffset, String text) {
            String identity = documentName + '\u0000' + indexInDocument + '\u0000' + startOffset + '\u0000' + text;
            ByteBuffer hash = ByteBuffer.wrap(Fingerprints.digest(identity.getBytes(StandardCharsets.UTF_8)));
            return new UUID(hash.getLong(), hash.getLong()).toString();
        }
    },
    /**
     * A fresh random id per chunk per run.
     */
    RANDOM {
        @Override
        public String idFor(String documentName, int indexInDocument, int startOffset, String text) {
            return UUID.randomUUID().toString();
        }
    };

    public abstract String idFor(String documentName, int indexInDocument, int startOffset, String text);
}
