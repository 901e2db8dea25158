package com.fedquery.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fedquery.config.JacksonConfig;
import com.fedquery.federation.FederatedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于 JSON 文件的查询结果存储，每个查询键一个文件
 */
public class FileQueryResultStore implements QueryResultStore {
    private static final Logger logger = LoggerFactory.getLogger(FileQueryResultStore.class);

    private final PathManager pathManager;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FileQueryResultStore(PathManager pathManager) {
        this.pathManager = pathManager;
        this.objectMapper = JacksonConfig.configure(new ObjectMapper());
    }

    @Override
    public void saveQueryResult(String queryKey, FederatedResult result) throws IOException {
        lock.writeLock().lock();
        try {
            Files.createDirectories(Paths.get(pathManager.getQueryResultDir()));
            objectMapper.writeValue(new File(pathManager.getQueryResultPath(queryKey)), result);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public FederatedResult getLatest(String queryKey) throws IOException {
        lock.readLock().lock();
        try {
            File file = new File(pathManager.getQueryResultPath(queryKey));
            if (!file.exists()) {
                return null;
            }
            FederatedResult result = objectMapper.readValue(file, FederatedResult.class);
            if (!queryKey.equals(result.getQueryKey())) {
                logger.warn("Stored result {} belongs to query key {}, ignoring", file.getName(), result.getQueryKey());
                return null;
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void delete(String queryKey) throws IOException {
        lock.writeLock().lock();
        try {
            Files.deleteIfExists(Paths.get(pathManager.getQueryResultPath(queryKey)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 文件名是查询键的哈希，需读取文件内容中的 query_key 判断前缀
     */
    @Override
    public int deleteByPrefix(String prefix) throws IOException {
        lock.writeLock().lock();
        try {
            Path dir = Paths.get(pathManager.getQueryResultDir());
            if (!Files.isDirectory(dir)) {
                return 0;
            }
            List<Path> files;
            try (Stream<Path> listing = Files.list(dir)) {
                files = listing.filter(p -> p.getFileName().toString().endsWith(".json")).collect(Collectors.toList());
            }
            int deleted = 0;
            for (Path file : files) {
                FederatedResult result;
                try {
                    result = objectMapper.readValue(file.toFile(), FederatedResult.class);
                } catch (IOException e) {
                    logger.warn("Skipping unreadable stored result {}: {}", file.getFileName(), e.getMessage());
                    continue;
                }
                if (result.getQueryKey() != null && result.getQueryKey().startsWith(prefix)) {
                    Files.deleteIfExists(file);
                    deleted++;
                }
            }
            return deleted;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
