package com.fedquery.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 数据源配置
 * type 决定使用哪个适配器（memory / jdbc / h2 / mysql / postgresql），config 为适配器专有的连接参数
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataSourceConfig {
    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_INACTIVE = "inactive";

    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::([^}]*))?}");

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("config")
    private Map<String, Object> config;

    /**
     * 已知集合名称；为空时以适配器 listCollections 的结果为准
     */
    @JsonProperty("collections")
    private List<String> collections;

    @JsonProperty("status")
    private String status;

    public DataSourceConfig() {
    }

    public DataSourceConfig(String id, String type, Map<String, Object> config) {
        this.id = id;
        this.type = type;
        this.config = config;
    }

    public DataSourceConfig(DataSourceConfig other) {
        this.id = other.id;
        this.name = other.name;
        this.type = other.type;
        this.config = other.config != null ? new LinkedHashMap<>(other.config) : null;
        this.collections = other.collections != null ? new ArrayList<>(other.collections) : null;
        this.status = other.status;
    }

    @JsonIgnore
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @JsonIgnore
    public String getName() {
        return name != null ? name : id;
    }

    public void setName(String name) {
        this.name = name;
    }

    @JsonIgnore
    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    @JsonIgnore
    public Map<String, Object> getConfig() {
        return config != null ? config : Map.of();
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }

    @JsonIgnore
    public List<String> getCollections() {
        return collections != null ? collections : List.of();
    }

    public void setCollections(List<String> collections) {
        this.collections = collections;
    }

    @JsonIgnore
    public String getStatus() {
        return status != null ? status : STATUS_ACTIVE;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @JsonIgnore
    public boolean isActive() {
        return !STATUS_INACTIVE.equalsIgnoreCase(getStatus());
    }

    /**
     * 读取字符串配置项，支持 ${VAR} 与 ${VAR:default} 环境变量占位符
     */
    public String getConfigString(String key) {
        Object value = getConfig().get(key);
        if (value == null) {
            return null;
        }
        return resolvePlaceholders(String.valueOf(value));
    }

    public int getConfigInt(String key, int defaultValue) {
        String value = getConfigString(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config '" + key + "' of data source '" + id + "' is not an integer: " + value);
        }
    }

    static String resolvePlaceholders(String text) {
        Matcher matcher = ENV_PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String resolved = System.getenv(matcher.group(1));
            if (resolved == null) {
                resolved = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * 构建 JDBC URL（如果未提供 jdbc_url）
     */
    public String buildJdbcUrl() {
        String jdbcUrl = getConfigString("jdbc_url");
        if (jdbcUrl != null && !jdbcUrl.isEmpty()) {
            return jdbcUrl;
        }

        String host = getConfigString("host");
        String database = getConfigString("database");
        switch (type != null ? type.toLowerCase() : "") {
            case "postgresql":
            case "postgres":
                return String.format("jdbc:postgresql://%s:%d/%s", host, getConfigInt("port", 5432), database);
            case "mysql":
                return String.format("jdbc:mysql://%s:%d/%s", host, getConfigInt("port", 3306), database);
            case "h2":
                // H2 支持 file / mem / tcp 三种模式
                if ("mem".equalsIgnoreCase(host)) {
                    return String.format("jdbc:h2:mem:%s", database);
                } else if (host == null || host.isEmpty() || "file".equalsIgnoreCase(host)) {
                    return String.format("jdbc:h2:file:./data/h2/%s", database);
                } else {
                    return String.format("jdbc:h2:tcp://%s:%d/%s", host, getConfigInt("port", 9092), database);
                }
            default:
                throw new IllegalArgumentException("Data source '" + id + "' of type '" + type
                    + "' needs config.jdbc_url");
        }
    }

    /**
     * 连接相关配置是否一致；不一致时引擎需要断开并重新连接
     */
    public boolean sameConnection(DataSourceConfig other) {
        return other != null
            && Objects.equals(type, other.type)
            && Objects.equals(getConfig(), other.getConfig());
    }
}
