package com.fedquery.federation;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fedquery.exception.UnknownStrategyException;

import java.util.Locale;

/**
 * 联邦策略：决定查询何时重新访问数据源
 */
public enum FederationStrategy {
    /**
     * 每次都重新执行，不使用缓存
     */
    VIRTUAL("virtual"),
    /**
     * 刷新间隔内返回缓存结果，到期后同步重新执行
     */
    MATERIALIZED("materialized"),
    /**
     * 立即返回缓存结果，同时在后台刷新
     */
    HYBRID("hybrid");

    private final String token;

    FederationStrategy(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    /**
     * 解析策略名；null 或空串视为 virtual
     */
    public static FederationStrategy fromToken(String token) throws UnknownStrategyException {
        if (token == null || token.trim().isEmpty()) {
            return VIRTUAL;
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (FederationStrategy strategy : values()) {
            if (strategy.token.equals(normalized)) {
                return strategy;
            }
        }
        throw new UnknownStrategyException(token);
    }
}
