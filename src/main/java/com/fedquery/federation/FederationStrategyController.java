package com.fedquery.federation;

import com.fedquery.exception.FederationException;
import com.fedquery.repository.QueryResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 联邦策略控制器
 * <ul>
 *   <li>virtual：每次执行流水线，cacheHit 恒为 false，不读写缓存</li>
 *   <li>materialized：nextUpdate 之前返回缓存结果，到期后同步重新执行并推进刷新窗口</li>
 *   <li>hybrid：有缓存时立即返回缓存结果，同时提交一次后台刷新；无缓存时同步执行</li>
 * </ul>
 * 每个查询键一个缓存槽，新结果在流水线完整执行后整体替换旧结果，不做原地修改；
 * 槽位按执行开始顺序更新，较早开始的执行不会覆盖较晚开始的执行
 */
public class FederationStrategyController {
    private static final Logger logger = LoggerFactory.getLogger(FederationStrategyController.class);

    private final QueryResultStore resultStore;
    private final Executor refreshExecutor;
    private final Clock clock;
    private final Duration refreshInterval;
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final Map<String, QueryPipeline> pendingRefreshes = new ConcurrentHashMap<>();
    private final Set<String> refreshing = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> invalidatedBefore = new ConcurrentHashMap<>();
    private final AtomicLong runSequence = new AtomicLong();

    public FederationStrategyController(QueryResultStore resultStore, Executor refreshExecutor, Clock clock,
                                        Duration refreshInterval) {
        this.resultStore = resultStore;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.refreshInterval = refreshInterval;
    }

    public FederatedResult execute(String queryKey, FederationStrategy strategy, QueryPipeline pipeline)
            throws FederationException {
        switch (strategy) {
            case MATERIALIZED:
                return executeMaterialized(queryKey, pipeline);
            case HYBRID:
                return executeHybrid(queryKey, pipeline);
            default:
                return run(queryKey, FederationStrategy.VIRTUAL, pipeline).result;
        }
    }

    private FederatedResult executeMaterialized(String queryKey, QueryPipeline pipeline) throws FederationException {
        FederatedResult cached = cached(queryKey);
        Instant now = clock.instant();
        if (cached != null && cached.getNextUpdate() != null && now.isBefore(cached.getNextUpdate())) {
            logger.debug("Materialized cache hit for {} (next update at {})", queryKey, cached.getNextUpdate());
            return cached.asCacheHit();
        }
        Run fresh = run(queryKey, FederationStrategy.MATERIALIZED, pipeline);
        store(queryKey, fresh);
        return fresh.result;
    }

    private FederatedResult executeHybrid(String queryKey, QueryPipeline pipeline) throws FederationException {
        FederatedResult cached = cached(queryKey);
        if (cached == null) {
            Run fresh = run(queryKey, FederationStrategy.HYBRID, pipeline);
            store(queryKey, fresh);
            return fresh.result;
        }
        scheduleRefresh(queryKey, pipeline);
        return cached.asCacheHit();
    }

    /**
     * 每个查询键最多一个后台刷新；刷新期间到达的请求只记录最新的流水线，当前刷新结束后再执行一次
     */
    private void scheduleRefresh(String queryKey, QueryPipeline pipeline) {
        pendingRefreshes.put(queryKey, pipeline);
        if (!refreshing.add(queryKey)) {
            logger.debug("Background refresh of {} already in flight, coalesced", queryKey);
            return;
        }
        submitRefresh(queryKey);
    }

    private void submitRefresh(String queryKey) {
        try {
            refreshExecutor.execute(() -> refresh(queryKey));
        } catch (RejectedExecutionException e) {
            pendingRefreshes.remove(queryKey);
            refreshing.remove(queryKey);
            logger.warn("Background refresh of {} rejected: {}", queryKey, e.getMessage());
        }
    }

    private void refresh(String queryKey) {
        QueryPipeline pipeline;
        while ((pipeline = pendingRefreshes.remove(queryKey)) != null) {
            try {
                store(queryKey, run(queryKey, FederationStrategy.HYBRID, pipeline));
                logger.debug("Background refresh of {} completed", queryKey);
            } catch (FederationException | RuntimeException e) {
                logger.warn("Background refresh of {} failed, keeping previous result: {}", queryKey, e.getMessage());
            }
        }
        refreshing.remove(queryKey);
        // 在最后一次 remove 与释放标记之间到达的请求
        if (pendingRefreshes.containsKey(queryKey) && refreshing.add(queryKey)) {
            submitRefresh(queryKey);
        }
    }

    private Run run(String queryKey, FederationStrategy strategy, QueryPipeline pipeline) throws FederationException {
        long sequence = runSequence.incrementAndGet();
        long start = System.nanoTime();
        PipelineOutcome outcome = pipeline.run();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        Instant now = clock.instant();
        Instant nextUpdate = strategy == FederationStrategy.MATERIALIZED ? now.plus(refreshInterval) : null;
        return new Run(sequence, new FederatedResult(queryKey, strategy, outcome.getRows(), elapsedMs, false, now,
            nextUpdate, outcome.getWarnings()));
    }

    /**
     * 当前缓存结果；内存中没有时尝试从结果存储恢复
     */
    FederatedResult cached(String queryKey) {
        Slot slot = slots.get(queryKey);
        if (slot != null) {
            return slot.result;
        }
        try {
            FederatedResult persisted = resultStore.getLatest(queryKey);
            if (persisted != null) {
                Slot existing = slots.putIfAbsent(queryKey, new Slot(0, persisted));
                return existing != null ? existing.result : persisted;
            }
        } catch (IOException e) {
            logger.warn("Failed to read stored result of {}: {}", queryKey, e.getMessage());
        }
        return null;
    }

    /**
     * 只接受比当前槽位更晚开始的执行结果，先开始后结束的执行被丢弃
     */
    private void store(String queryKey, Run run) {
        boolean[] accepted = new boolean[1];
        slots.compute(queryKey, (key, current) -> {
            Long floor = invalidatedBefore.get(key);
            if ((current != null && current.sequence > run.sequence) || (floor != null && run.sequence <= floor)) {
                return current;
            }
            accepted[0] = true;
            return new Slot(run.sequence, run.result);
        });
        if (!accepted[0]) {
            logger.debug("Discarding result of {} from superseded run #{}", queryKey, run.sequence);
            return;
        }
        try {
            resultStore.saveQueryResult(queryKey, run.result);
            // 较晚的结果可能先于本次写入存储
            Slot latest = slots.get(queryKey);
            if (latest != null && latest.sequence > run.sequence) {
                resultStore.saveQueryResult(queryKey, latest.result);
            }
        } catch (IOException e) {
            logger.warn("Failed to persist result of {}: {}", queryKey, e.getMessage());
        }
    }

    /**
     * 清除缓存槽位；此前已开始的执行结果不再写回
     */
    public void invalidate(String queryKey) {
        pendingRefreshes.remove(queryKey);
        slots.compute(queryKey, (key, current) -> {
            invalidatedBefore.put(key, runSequence.get());
            return null;
        });
        try {
            resultStore.delete(queryKey);
        } catch (IOException e) {
            logger.warn("Failed to delete stored result of {}: {}", queryKey, e.getMessage());
        }
    }

    /**
     * 清除键以给定前缀开头的全部缓存槽位，包括只存在于结果存储中的
     */
    public void invalidatePrefix(String prefix) {
        for (String key : new ArrayList<>(slots.keySet())) {
            if (key.startsWith(prefix)) {
                invalidate(key);
            }
        }
        try {
            int deleted = resultStore.deleteByPrefix(prefix);
            logger.debug("Invalidated cached results with prefix {} ({} stored)", prefix, deleted);
        } catch (IOException e) {
            logger.warn("Failed to delete stored results with prefix {}: {}", prefix, e.getMessage());
        }
    }

    private static class Slot {
        private final long sequence;
        private final FederatedResult result;

        Slot(long sequence, FederatedResult result) {
            this.sequence = sequence;
            this.result = result;
        }
    }

    private static class Run {
        private final long sequence;
        private final FederatedResult result;

        Run(long sequence, FederatedResult result) {
            this.sequence = sequence;
            this.result = result;
        }
    }
}
