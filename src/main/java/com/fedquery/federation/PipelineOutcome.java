package com.fedquery.federation;

import com.fedquery.query.Row;

import java.util.List;

/**
 * 一次完整执行（取数 → 合成 → 执行）的产出
 */
public class PipelineOutcome {
    private final List<Row> rows;
    private final List<String> warnings;

    public PipelineOutcome(List<Row> rows, List<String> warnings) {
        this.rows = rows != null ? List.copyOf(rows) : List.of();
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public List<Row> getRows() {
        return rows;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
