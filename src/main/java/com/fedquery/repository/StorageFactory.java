package com.fedquery.repository;

import com.fedquery.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 存储工厂
 * 根据 storage.type 选择内存存储或文件存储
 */
@Configuration
public class StorageFactory {
    private static final Logger logger = LoggerFactory.getLogger(StorageFactory.class);
    public static final String TYPE_FILE = "file";

    @Autowired
    private Config config;

    @Bean
    public SnapshotStore snapshotStore(PathManager pathManager, Clock clock) {
        String storageType = config.getStorageType();
        logger.info("Initializing snapshot store with type: {}", storageType);
        if (TYPE_FILE.equalsIgnoreCase(storageType)) {
            logger.info("Using file snapshot store under {}", config.getDataRootPath());
            return new FileSnapshotStore(pathManager, config.getSnapshotHistory(), clock);
        }
        logger.info("Using in-memory snapshot store");
        return new InMemorySnapshotStore(config.getSnapshotHistory(), clock);
    }

    @Bean
    public QueryResultStore queryResultStore(PathManager pathManager) {
        String storageType = config.getStorageType();
        logger.info("Initializing query result store with type: {}", storageType);
        if (TYPE_FILE.equalsIgnoreCase(storageType)) {
            return new FileQueryResultStore(pathManager);
        }
        return new InMemoryQueryResultStore();
    }
}
