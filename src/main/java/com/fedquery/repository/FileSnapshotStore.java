package com.fedquery.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedquery.config.JacksonConfig;
import com.fedquery.query.Field;
import com.fedquery.query.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于 JSON 文件的快照存储
 * 每个快照一个文件，文件名为 fetchedAt 的纳秒时间戳，最新快照即文件名最大者
 */
public class FileSnapshotStore implements SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(FileSnapshotStore.class);
    private static final Pattern SNAPSHOT_FILE = Pattern.compile("\\d{20}\\.json");

    private final PathManager pathManager;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxHistory;
    private final Clock clock;

    public FileSnapshotStore(PathManager pathManager) {
        this(pathManager, 5, Clock.systemUTC());
    }

    public FileSnapshotStore(PathManager pathManager, int maxHistory, Clock clock) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be at least 1");
        }
        this.pathManager = pathManager;
        this.maxHistory = maxHistory;
        this.clock = clock;
        this.objectMapper = JacksonConfig.configure(new ObjectMapper());
    }

    @Override
    public CollectionSnapshot getLatest(String sourceId, String collection) throws IOException {
        lock.readLock().lock();
        try {
            List<Path> files = snapshotFiles(sourceId, collection);
            if (files.isEmpty()) {
                return null;
            }
            return read(files.get(files.size() - 1));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CollectionSnapshot put(String sourceId, String collection, List<Row> rows, List<Field> schema) throws IOException {
        lock.writeLock().lock();
        try {
            List<Path> files = snapshotFiles(sourceId, collection);
            Instant previous = files.isEmpty() ? null
                : PathManager.fetchedAtOf(files.get(files.size() - 1).getFileName().toString());
            CollectionSnapshot snapshot = new CollectionSnapshot(sourceId, collection, schema, rows,
                InMemorySnapshotStore.nextFetchedAt(clock, previous));

            Files.createDirectories(Paths.get(pathManager.getSnapshotDir(sourceId, collection)));
            File file = new File(pathManager.getSnapshotPath(sourceId, collection, snapshot.getFetchedAt()));
            objectMapper.writeValue(file, snapshot);

            // 超出保留数量的旧快照
            List<Path> all = snapshotFiles(sourceId, collection);
            for (int i = 0; i < all.size() - maxHistory; i++) {
                Files.deleteIfExists(all.get(i));
            }
            return snapshot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<CollectionSnapshot> history(String sourceId, String collection) throws IOException {
        lock.readLock().lock();
        try {
            List<CollectionSnapshot> result = new ArrayList<>();
            for (Path file : snapshotFiles(sourceId, collection)) {
                result.add(read(file));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void evict(String sourceId) throws IOException {
        lock.writeLock().lock();
        try {
            Path dir = Paths.get(pathManager.getSourceSnapshotDir(sourceId));
            if (!Files.exists(dir)) {
                return;
            }
            List<Path> paths;
            try (Stream<Path> walk = Files.walk(dir)) {
                paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            }
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
            logger.info("Evicted snapshots of data source {}", sourceId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<Path> snapshotFiles(String sourceId, String collection) throws IOException {
        Path dir = Paths.get(pathManager.getSnapshotDir(sourceId, collection));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(p -> SNAPSHOT_FILE.matcher(p.getFileName().toString()).matches())
                .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()))
                .collect(Collectors.toList());
        }
    }

    private CollectionSnapshot read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), CollectionSnapshot.class);
    }
}
