package com.entity.pipeline.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Process-level single-writer lock on a database file, held through a sibling
 * {@code <database>.lock} file for the duration of a pipeline run.
 */
public final class WriterLock implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WriterLock.class);

    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock fileLock;

    private WriterLock(Path lockFile, FileChannel channel, FileLock fileLock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.fileLock = fileLock;
    }

    /**
     * Acquires the writer lock for a database without waiting.
     *
     * @throws LockAcquisitionException if another process (or another run in this JVM) holds it
     */
    public static WriterLock acquire(Path databaseFile) {
        Path lockFile = databaseFile.resolveSibling(databaseFile.getFileName() + ".lock");
        FileChannel channel = null;
        try {
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw new LockAcquisitionException("Another pipeline run holds the writer lock " + lockFile);
            }
            log.debug("Writer lock acquired: {}", lockFile);
            return new WriterLock(lockFile, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new LockAcquisitionException("This process already holds the writer lock " + lockFile, e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new LockAcquisitionException("Cannot open writer lock " + lockFile + ": " + e.getMessage(), e);
        }
    }

    public Path getLockFile() {
        return lockFile;
    }

    @Override
    public void close() {
        try {
            fileLock.release();
            channel.close();
            log.debug("Writer lock released: {}", lockFile);
        } catch (IOException e) {
            log.warn("Error releasing writer lock {}: {}", lockFile, e.getMessage());
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Error closing lock channel: {}", e.getMessage());
        }
    }
}
