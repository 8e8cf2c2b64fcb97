package com.corpusindex.index;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Owns {@code manifest.json}, the single pointer that decides which index version readers see.
 * The manifest is only ever replaced by an atomic rename.
 */
public class IndexManifestStore {
    private static final Logger log = LoggerFactory.getLogger(IndexManifestStore.class);
    static final String MANIFEST_FILE = "manifest.json";

    private final Path root;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public IndexManifestStore(Path root) {
        this(root, Clock.systemUTC());
    }

    public IndexManifestStore(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    public Optional<IndexManifest> load() throws IOException {
        Path manifestPath = root.resolve(MANIFEST_FILE);
        if (!Files.exists(manifestPath) || Files.size(manifestPath) == 0L) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(manifestPath.toFile(), IndexManifest.class));
    }

    public Optional<IndexVersion> findVersion(String versionId) throws IOException {
        Optional<IndexManifest> manifest = load();
        if (manifest.isEmpty()) {
            return Optional.empty();
        }
        IndexVersion current = manifest.get().current();
        IndexVersion previous = manifest.get().previous();
        if (current != null && current.versionId().equals(versionId)) {
            return Optional.of(current);
        }
        if (previous != null && previous.versionId().equals(versionId)) {
            return Optional.of(previous);
        }
        return Optional.empty();
    }

    public IndexManifest publish(IndexVersion version) throws IndexPublishException {
        try {
            IndexVersion replaced = load().map(IndexManifest::current).orElse(null);
            IndexManifest updated = new IndexManifest(version, replaced, clock.instant());
            write(updated);
            log.info("index.publish version={} previous={} records={}",
                    version.versionId(),
                    replaced == null ? "none" : replaced.versionId(),
                    version.recordCount());
            return updated;
        } catch (IndexPublishException e) {
            throw e;
        } catch (IOException e) {
            throw new IndexPublishException("Unable to publish index version " + version.versionId(), e);
        }
    }

    /**
     * Makes the previous version current again. The version being replaced becomes the new previous,
     * so a second rollback restores it. Takes the {@link PublicationLock}, so it fails while an
     * indexing run holds the root.
     */
    public IndexManifest rollback() throws IOException {
        try (PublicationLock lock = PublicationLock.acquire(root)) {
            IndexManifest manifest = load().orElseThrow(() -> new IndexPublishException("No index has been published under " + root));
            IndexVersion previous = manifest.previous();
            if (previous == null) {
                throw new IndexPublishException("No previous index version to roll back to");
            }
            if (!Files.exists(resolve(previous.chunkDetailLocation()))) {
                throw new IndexPublishException("Files of version " + previous.versionId() + " are missing under " + root);
            }
            IndexManifest rolledBack = new IndexManifest(previous, manifest.current(), clock.instant());
            write(rolledBack);
            log.info("index.rollback version={} replaced={}", previous.versionId(), manifest.current().versionId());
            return rolledBack;
        }
    }

    public Path resolve(String location) {
        return root.resolve(location);
    }

    public String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    public Path root() {
        return root;
    }

    private void write(IndexManifest manifest) throws IOException {
        Files.createDirectories(root);
        Path target = root.resolve(MANIFEST_FILE);
        Path temp = root.resolve(MANIFEST_FILE + ".tmp-" + UUID.randomUUID());
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), manifest);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("index.manifest.non-atomic-move root={} reason={}", root, e.getMessage());
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
