package com.fedquery.repository;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * 文件存储路径
 * <pre>
 * {dataRoot}/{namespace}/snapshots/{source}/{collection}/{fetchedAt 纳秒}.json
 * {dataRoot}/{namespace}/query-results/{queryKey 哈希}.json
 * </pre>
 */
public class PathManager {
    private final String dataRoot;
    private final String namespace;
    private static final Pattern NON_ASCII_PATTERN = Pattern.compile("[^\\x00-\\x7F]");

    public PathManager(String dataRoot, String namespace) {
        this.dataRoot = dataRoot;
        this.namespace = normalizeNamespace(namespace);
    }

    public String getSourceSnapshotDir(String sourceId) {
        return String.format("%s/%s/snapshots/%s", dataRoot, namespace, normalizeName(sourceId));
    }

    public String getSnapshotDir(String sourceId, String collection) {
        return String.format("%s/%s", getSourceSnapshotDir(sourceId), normalizeName(collection));
    }

    public String getSnapshotPath(String sourceId, String collection, Instant fetchedAt) {
        return String.format("%s/%s.json", getSnapshotDir(sourceId, collection), snapshotFileStem(fetchedAt));
    }

    /**
     * 零填充的纳秒时间戳，文件名的字典序即时间顺序
     */
    static String snapshotFileStem(Instant fetchedAt) {
        long nanos = Math.addExact(Math.multiplyExact(fetchedAt.getEpochSecond(), 1_000_000_000L), fetchedAt.getNano());
        return String.format("%020d", nanos);
    }

    /**
     * 从快照文件名还原 fetchedAt
     */
    static Instant fetchedAtOf(String fileName) {
        String stem = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - ".json".length()) : fileName;
        long nanos = Long.parseLong(stem);
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }

    public String getQueryResultDir() {
        return String.format("%s/%s/query-results", dataRoot, namespace);
    }

    public String getQueryResultPath(String queryKey) {
        return String.format("%s/%s.json", getQueryResultDir(), md5(queryKey));
    }

    private String normalizeNamespace(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            return "default";
        }
        return namespace.toLowerCase()
            .replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private String normalizeName(String name) {
        if (name == null || name.isEmpty()) {
            return "unknown";
        }

        // 包含中文等非 ASCII 字符的名称使用 MD5
        if (NON_ASCII_PATTERN.matcher(name).find()) {
            return md5(name);
        }

        // 保留大小写，其它特殊字符替换为下划线
        return name.replaceAll("[^a-zA-Z0-9_\\-]", "_");
    }

    private static String md5(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }
}
