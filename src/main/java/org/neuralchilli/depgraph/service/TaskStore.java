package org.neuralchilli.depgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.depgraph.config.DependencyGraphConfig;
import org.neuralchilli.depgraph.config.TaskCollectionCodec;
import org.neuralchilli.depgraph.domain.TaskCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Loads and saves task collection files.
 *
 * Saves write a sibling temp file and move it over the target, so readers
 * never see a half-written collection. {@link #update} serializes
 * load-mutate-save cycles on the same file through an exclusive lock on a
 * sibling {@code .lock} file.
 */
@ApplicationScoped
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private static final long LOCK_RETRY_MILLIS = 50;

    @Inject
    TaskCollectionCodec codec;

    @Inject
    DependencyGraphConfig config;

    /**
     * Read and parse a collection file
     *
     * @throws StoreException if the file is missing, unreadable or malformed
     */
    public TaskCollection load(Path path) {
        try {
            log.debug("Loading task collection from: {}", path);
            TaskCollection collection = codec.parse(Files.readString(path));
            log.info("Loaded {} tasks from {}", collection.tasks().size(), path);
            return collection;
        } catch (NoSuchFileException e) {
            throw new StoreException("Task collection not found", path, e);
        } catch (IOException e) {
            log.error("Failed to read task collection: {}", path, e);
            throw new StoreException("Failed to read task collection", path, e);
        } catch (IllegalArgumentException e) {
            log.error("Malformed task collection: {}", path, e);
            throw new StoreException("Malformed task collection", path, e);
        }
    }

    /**
     * Write the collection atomically, creating parent directories as needed
     */
    public void save(Path path, TaskCollection collection) {
        Path target = path.toAbsolutePath();
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName() + ".", ".tmp");
            Files.writeString(temp, codec.write(collection));
            move(temp, target);
            log.info("Saved {} tasks to {}", collection.tasks().size(), path);
        } catch (IOException e) {
            log.error("Failed to write task collection: {}", path, e);
            deleteQuietly(temp);
            throw new StoreException("Failed to write task collection", path, e);
        }
    }

    /**
     * Run load, mutate and save while holding the file's lock. The collection
     * is written back only when {@code shouldSave} accepts the result.
     *
     * @throws StoreException if the lock is not acquired within the configured
     *                        timeout, or the file cannot be read or written
     */
    public <T> T update(Path path, Function<TaskCollection, T> mutation, Predicate<? super T> shouldSave) {
        Path lockFile = path.toAbsolutePath().resolveSibling(path.getFileName() + ".lock");

        try {
            Files.createDirectories(lockFile.getParent());
        } catch (IOException e) {
            throw new StoreException("Failed to create directory for lock", lockFile, e);
        }

        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock lock = acquire(channel, lockFile)) {

            log.debug("Acquired lock {}", lockFile);
            TaskCollection collection = load(path);
            T result = mutation.apply(collection);

            if (shouldSave.test(result)) {
                save(path, collection);
            } else {
                log.debug("No changes to save for {}", path);
            }
            return result;
        } catch (IOException e) {
            throw new StoreException("Failed to lock task collection", lockFile, e);
        }
    }

    private FileLock acquire(FileChannel channel, Path lockFile) throws IOException {
        Duration timeout = config.store().lockTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            try {
                FileLock lock = channel.tryLock();
                if (lock != null) {
                    return lock;
                }
            } catch (OverlappingFileLockException e) {
                // held by another thread of this process
                log.debug("Lock {} held within this process, waiting", lockFile);
            }

            if (System.nanoTime() >= deadline) {
                throw new StoreException("Timed out after " + timeout.toMillis() + "ms waiting for lock", lockFile);
            }

            try {
                Thread.sleep(LOCK_RETRY_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StoreException("Interrupted while waiting for lock", lockFile, e);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}", temp, e);
        }
    }
}
