package com.fedquery.federation;

import com.fedquery.exception.FederationException;

/**
 * 可重复执行的查询流水线，由策略控制器决定何时执行
 */
@FunctionalInterface
public interface QueryPipeline {
    PipelineOutcome run() throws FederationException;
}
