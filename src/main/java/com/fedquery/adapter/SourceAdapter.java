package com.fedquery.adapter;

import com.fedquery.exception.SourceConnectionException;
import com.fedquery.meta.DataSourceConfig;
import com.fedquery.query.Field;
import com.fedquery.query.Row;

import java.time.Duration;
import java.util.List;

/**
 * 数据源适配器
 * 每个已连接的数据源持有一个实例；引擎只通过此接口访问外部数据源
 */
public interface SourceAdapter {

    /**
     * 建立连接
     *
     * @param timeout 连接超时
     * @return 连接可用时返回 true
     * @throws SourceConnectionException 配置错误或连接失败
     */
    boolean connect(DataSourceConfig config, Duration timeout) throws SourceConnectionException;

    boolean isConnected();

    List<String> listCollections() throws SourceConnectionException;

    /**
     * 集合结构；集合不存在时返回空列表
     */
    List<Field> getCollectionSchema(String collection) throws SourceConnectionException;

    List<Row> executeQuery(String collection, FilterSpec filterSpec) throws SourceConnectionException;

    void disconnect();
}
