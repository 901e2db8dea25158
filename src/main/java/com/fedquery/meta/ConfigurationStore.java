package com.fedquery.meta;

import java.util.List;

/**
 * 联邦引擎读取的配置存储
 */
public interface ConfigurationStore {

    List<DataSourceConfig> listDataSources();

    /**
     * 仅返回 status 为 active 的映射
     */
    List<SchemaMapping> listActiveMappings();

    SavedQuery getQueryById(String id) throws Loader.NotFoundException;

    DataSourceConfig getDataSourceById(String id) throws Loader.NotFoundException;
}
