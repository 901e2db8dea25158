package com.fedquery.adapter;

import com.fedquery.exception.SourceConnectionException;
import com.fedquery.meta.DataSourceConfig;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 根据数据源类型创建适配器
 */
public class SourceAdapterFactory {
    private final Map<String, Supplier<SourceAdapter>> suppliers = new ConcurrentHashMap<>();

    public SourceAdapterFactory() {
        register(InMemorySourceAdapter.TYPE, InMemorySourceAdapter::new);
        register("jdbc", JdbcSourceAdapter::new);
        register("h2", JdbcSourceAdapter::new);
        register("mysql", JdbcSourceAdapter::new);
        register("postgresql", JdbcSourceAdapter::new);
        register("postgres", JdbcSourceAdapter::new);
    }

    public void register(String type, Supplier<SourceAdapter> supplier) {
        suppliers.put(type.toLowerCase(Locale.ROOT), supplier);
    }

    public Set<String> supportedTypes() {
        return Set.copyOf(suppliers.keySet());
    }

    public SourceAdapter create(DataSourceConfig config) throws SourceConnectionException {
        String type = config.getType() != null ? config.getType().toLowerCase(Locale.ROOT) : "";
        Supplier<SourceAdapter> supplier = suppliers.get(type);
        if (supplier == null) {
            throw new SourceConnectionException(config.getId(),
                "Unsupported data source type '" + config.getType() + "' for data source '" + config.getId() + "'");
        }
        return supplier.get();
    }
}
