package com.fedquery.repository;

import com.fedquery.federation.FederatedResult;

import java.io.IOException;

/**
 * 物化 / 混合策略下每个查询最近一次结果的持久化
 */
public interface QueryResultStore {

    void saveQueryResult(String queryKey, FederatedResult result) throws IOException;

    /**
     * 不存在时返回 null
     */
    FederatedResult getLatest(String queryKey) throws IOException;

    void delete(String queryKey) throws IOException;

    /**
     * 删除查询键以 prefix 开头的全部结果，返回删除数量
     */
    int deleteByPrefix(String prefix) throws IOException;
}
