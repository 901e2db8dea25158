package com.fedquery.meta;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 联邦目录加载器
 * 从 YAML 文件加载目录，并支持在内存中新增、更新和删除条目；每次修改都生成新的目录副本并重新校验
 */
public class Loader implements ConfigurationStore {
    private static final Logger logger = LoggerFactory.getLogger(Loader.class);

    private final Parser parser;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private FederationCatalog catalog = FederationCatalog.empty();

    public Loader(String filePath) {
        this.parser = new Parser(filePath);
    }

    public void load() throws IOException, Validator.ValidationException {
        lock.writeLock().lock();
        try {
            if (!parser.exists()) {
                logger.warn("Catalog file not found, starting with an empty catalog");
                this.catalog = FederationCatalog.empty();
                return;
            }
            FederationCatalog parsed = parser.parse();
            new Validator(parsed).validate();
            this.catalog = parsed;
            logger.info("Loaded catalog: {} data sources, {} schema mappings, {} queries",
                parsed.getDataSources().size(), parsed.getSchemaMappings().size(), parsed.getQueries().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reload() throws IOException, Validator.ValidationException {
        load();
    }

    public FederationCatalog getCatalog() {
        lock.readLock().lock();
        try {
            return catalog;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DataSourceConfig> listDataSources() {
        return List.copyOf(getCatalog().getDataSources());
    }

    @Override
    public DataSourceConfig getDataSourceById(String id) throws NotFoundException {
        DataSourceConfig dataSource = getCatalog().getDataSourceById(id);
        if (dataSource == null) {
            throw new NotFoundException("data source '" + id + "' not found");
        }
        return dataSource;
    }

    public List<SchemaMapping> listMappings() {
        return List.copyOf(getCatalog().getSchemaMappings());
    }

    @Override
    public List<SchemaMapping> listActiveMappings() {
        return getCatalog().getSchemaMappings().stream()
            .filter(SchemaMapping::isActive)
            .collect(Collectors.toList());
    }

    public SchemaMapping getMappingById(String id) throws NotFoundException {
        SchemaMapping mapping = getCatalog().getMappingById(id);
        if (mapping == null) {
            throw new NotFoundException("schema mapping '" + id + "' not found");
        }
        return mapping;
    }

    public List<SavedQuery> listQueries() {
        return List.copyOf(getCatalog().getQueries());
    }

    @Override
    public SavedQuery getQueryById(String id) throws NotFoundException {
        SavedQuery query = getCatalog().getQueryById(id);
        if (query == null) {
            throw new NotFoundException("query '" + id + "' not found");
        }
        return query;
    }

    /**
     * 新增或替换数据源，返回替换前的配置（新增时为 null）
     */
    public DataSourceConfig upsertDataSource(DataSourceConfig dataSource) throws Validator.ValidationException {
        lock.writeLock().lock();
        try {
            FederationCatalog updated = new FederationCatalog(catalog);
            DataSourceConfig previous = replace(updated.getDataSources(), dataSource, ds -> Objects.equals(ds.getId(), dataSource.getId()));
            commit(updated);
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 删除数据源；仍被映射或已保存查询引用时校验失败
     */
    public DataSourceConfig removeDataSource(String id) throws NotFoundException, Validator.ValidationException {
        lock.writeLock().lock();
        try {
            FederationCatalog updated = new FederationCatalog(catalog);
            DataSourceConfig removed = remove(updated.getDataSources(), ds -> Objects.equals(ds.getId(), id));
            if (removed == null) {
                throw new NotFoundException("data source '" + id + "' not found");
            }
            commit(updated);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SchemaMapping upsertMapping(SchemaMapping mapping) throws Validator.ValidationException {
        lock.writeLock().lock();
        try {
            FederationCatalog updated = new FederationCatalog(catalog);
            SchemaMapping previous = replace(updated.getSchemaMappings(), mapping, m -> Objects.equals(m.getId(), mapping.getId()));
            commit(updated);
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SchemaMapping removeMapping(String id) throws NotFoundException, Validator.ValidationException {
        lock.writeLock().lock();
        try {
            FederationCatalog updated = new FederationCatalog(catalog);
            SchemaMapping removed = remove(updated.getSchemaMappings(), m -> Objects.equals(m.getId(), id));
            if (removed == null) {
                throw new NotFoundException("schema mapping '" + id + "' not found");
            }
            commit(updated);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SavedQuery upsertQuery(SavedQuery query) throws Validator.ValidationException {
        lock.writeLock().lock();
        try {
            FederationCatalog updated = new FederationCatalog(catalog);
            SavedQuery previous = replace(updated.getQueries(), query, q -> Objects.equals(q.getId(), query.getId()));
            commit(updated);
            return previous;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SavedQuery removeQuery(String id) throws NotFoundException, Validator.ValidationException {
        lock.writeLock().lock();
        try {
            FederationCatalog updated = new FederationCatalog(catalog);
            SavedQuery removed = remove(updated.getQueries(), q -> Objects.equals(q.getId(), id));
            if (removed == null) {
                throw new NotFoundException("query '" + id + "' not found");
            }
            commit(updated);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // 调用方持有写锁
    private void commit(FederationCatalog updated) throws Validator.ValidationException {
        new Validator(updated).validate();
        this.catalog = updated;
    }

    private static <T> T replace(List<T> items, T item, Predicate<T> sameId) throws Validator.ValidationException {
        if (item == null) {
            throw new Validator.ValidationException("entry is required");
        }
        for (int i = 0; i < items.size(); i++) {
            if (sameId.test(items.get(i))) {
                return items.set(i, item);
            }
        }
        items.add(item);
        return null;
    }

    private static <T> T remove(List<T> items, Predicate<T> sameId) {
        for (int i = 0; i < items.size(); i++) {
            if (sameId.test(items.get(i))) {
                return items.remove(i);
            }
        }
        return null;
    }

    public static class NotFoundException extends Exception {
        public NotFoundException(String message) {
            super(message);
        }
    }
}
