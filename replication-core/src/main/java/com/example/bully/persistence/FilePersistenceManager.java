package com.example.bully.persistence;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the durable state of one replica in a single JSON file.
 *
 * <pre>
 * baseDir/
 *   replica-3/
 *     state.json       last committed state
 *     state.json.tmp   only present while a save is in flight (or after a crash during one)
 * </pre>
 *
 * A save writes and fsyncs the temp file, then renames it over state.json.
 */
@Slf4j
public class FilePersistenceManager implements PersistenceManager {
    private static final String STATE_FILE = "state.json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path replicaDir;
    private final Path stateFile;
    private final Path tempFile;
    private final ObjectMapper objectMapper;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FilePersistenceManager(String baseDir, int replicaId) {
        this(baseDir, replicaId, new ObjectMapper());
    }

    public FilePersistenceManager(String baseDir, int replicaId, ObjectMapper objectMapper) {
        this.replicaDir = Paths.get(baseDir, "replica-" + replicaId);
        this.stateFile = replicaDir.resolve(STATE_FILE);
        this.tempFile = replicaDir.resolve(STATE_FILE + TEMP_SUFFIX);
        this.objectMapper = objectMapper;
    }

    @Override
    public void initialize() throws IOException {
        Files.createDirectories(replicaDir);
        // leftover of a save interrupted by a crash; state.json is still the last good state
        if (Files.deleteIfExists(tempFile)) {
            log.warn("Discarded incomplete state file {}", tempFile);
        }
    }

    @Override
    public DurableState load() throws IOException {
        lock.readLock().lock();
        try {
            if (!Files.exists(stateFile)) {
                return DurableState.empty();
            }
            DurableState state = objectMapper.readValue(stateFile.toFile(), DurableState.class);
            log.info("Loaded {} commits from {}", state.getCommits().size(), stateFile);
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void save(DurableState state) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(state);
        lock.writeLock().lock();
        try {
            try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tempFile, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() throws IOException {
        // Nothing to do
    }

    public Path getStateFile() {
        return stateFile;
    }
}
