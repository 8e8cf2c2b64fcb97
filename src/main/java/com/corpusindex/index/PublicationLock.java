package com.corpusindex.index;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive lock on an index root held for a whole indexing run. Only one run may stage and publish
 * versions under a root at a time.
 */
public final class PublicationLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PublicationLock.class);
    static final String LOCK_FILE = ".publish.lock";

    private final FileChannel channel;
    private final FileLock lock;
    private final Path lockPath;

    private PublicationLock(FileChannel channel, FileLock lock, Path lockPath) {
        this.channel = channel;
        this.lock = lock;
        this.lockPath = lockPath;
    }

    public static PublicationLock acquire(Path indexRoot) throws IndexPublishException {
        Path lockPath = indexRoot.resolve(LOCK_FILE);
        FileChannel channel = null;
        try {
            Files.createDirectories(indexRoot);
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                throw new IndexPublishException("Another indexing run holds " + lockPath);
            }
            log.debug("index.lock.acquired path={}", lockPath);
            return new PublicationLock(channel, lock, lockPath);
        } catch (OverlappingFileLockException e) {
            closeChannel(channel);
            throw new IndexPublishException("Another indexing run in this process holds " + lockPath, e);
        } catch (IndexPublishException e) {
            closeChannel(channel);
            throw e;
        } catch (IOException e) {
            closeChannel(channel);
            throw new IndexPublishException("Unable to lock " + lockPath, e);
        }
    }

    @Override
    public void close() throws IOException {
        try {
            lock.release();
        } finally {
            channel.close();
            log.debug("index.lock.released path={}", lockPath);
        }
    }

    private static void closeChannel(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("index.lock.close-failed reason={}", e.getMessage());
        }
    }
}
