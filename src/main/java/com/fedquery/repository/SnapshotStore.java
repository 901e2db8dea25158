package com.fedquery.repository;

import com.fedquery.query.Field;
import com.fedquery.query.Row;

import java.io.IOException;
import java.util.List;

/**
 * 集合快照存储，按 (sourceId, collection) 保存历次拉取结果
 */
public interface SnapshotStore {

    /**
     * fetchedAt 最大的快照，不存在时返回 null
     */
    CollectionSnapshot getLatest(String sourceId, String collection) throws IOException;

    /**
     * 保存新快照；fetchedAt 由存储分配，并保证严格大于同一集合已有的快照
     */
    CollectionSnapshot put(String sourceId, String collection, List<Row> rows, List<Field> schema) throws IOException;

    /**
     * 按 fetchedAt 升序返回保留的快照
     */
    List<CollectionSnapshot> history(String sourceId, String collection) throws IOException;

    /**
     * 删除某个数据源的全部快照
     */
    void evict(String sourceId) throws IOException;
}
