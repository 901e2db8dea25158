package com.fedquery.repository;

import com.fedquery.federation.FederatedResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryQueryResultStore implements QueryResultStore {
    private final Map<String, FederatedResult> results = new ConcurrentHashMap<>();

    @Override
    public void saveQueryResult(String queryKey, FederatedResult result) {
        results.put(queryKey, result);
    }

    @Override
    public FederatedResult getLatest(String queryKey) {
        return results.get(queryKey);
    }

    @Override
    public void delete(String queryKey) {
        results.remove(queryKey);
    }

    @Override
    public int deleteByPrefix(String prefix) {
        int before = results.size();
        results.keySet().removeIf(key -> key.startsWith(prefix));
        return before - results.size();
    }
}
