package com.fedquery.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import jakarta.annotation.PostConstruct;

@Configuration
@ConfigurationProperties
@DependsOn("envConfig")
public class Config {

    @Value("${catalog.file.path:./config/catalog.yaml}")
    private String catalogFilePath;

    @Value("${data.root.path:./data}")
    private String dataRootPath;

    @Value("${storage.type:memory}")
    private String storageType;

    @Value("${federation.refresh.interval.ms:900000}")
    private long refreshIntervalMs;

    @Value("${federation.connect.timeout.ms:10000}")
    private long connectTimeoutMs;

    @Value("${federation.fetch.timeout.ms:10000}")
    private long fetchTimeoutMs;

    @Value("${federation.refresh.pool.size:4}")
    private int refreshPoolSize;

    @Value("${federation.snapshot.history:5}")
    private int snapshotHistory;

    @PostConstruct
    public void init() {
        // .env 或环境变量覆盖 application.properties
        this.catalogFilePath = EnvConfig.get("CATALOG_PATH", catalogFilePath);
        this.dataRootPath = EnvConfig.get("DATA_ROOT", dataRootPath);
        this.storageType = EnvConfig.get("STORAGE_TYPE", storageType);
        this.refreshIntervalMs = EnvConfig.getLong("REFRESH_INTERVAL_MS", refreshIntervalMs);
        this.connectTimeoutMs = EnvConfig.getLong("CONNECT_TIMEOUT_MS", connectTimeoutMs);
        this.fetchTimeoutMs = EnvConfig.getLong("FETCH_TIMEOUT_MS", fetchTimeoutMs);

        if (refreshIntervalMs <= 0 || connectTimeoutMs <= 0 || fetchTimeoutMs <= 0) {
            throw new IllegalStateException("federation intervals and timeouts must be positive");
        }
        if (refreshPoolSize < 1) {
            throw new IllegalStateException("federation.refresh.pool.size must be at least 1");
        }
    }

    public String getCatalogFilePath() {
        return catalogFilePath;
    }

    public String getDataRootPath() {
        return dataRootPath;
    }

    public String getStorageType() {
        return storageType;
    }

    public long getRefreshIntervalMs() {
        return refreshIntervalMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public long getFetchTimeoutMs() {
        return fetchTimeoutMs;
    }

    public int getRefreshPoolSize() {
        return refreshPoolSize;
    }

    public int getSnapshotHistory() {
        return snapshotHistory;
    }
}
