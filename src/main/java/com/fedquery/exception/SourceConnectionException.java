package com.fedquery.exception;

/**
 * 数据源连接或拉取失败
 * 执行过程中就地降级为空集合或最近快照，仅当整个查询没有任何可用数据时才抛给调用方
 */
public class SourceConnectionException extends FederationException {
    private final String sourceId;

    public SourceConnectionException(String sourceId, String message) {
        super(ErrorKind.SOURCE_CONNECTION, message);
        this.sourceId = sourceId;
    }

    public SourceConnectionException(String sourceId, String message, Throwable cause) {
        super(ErrorKind.SOURCE_CONNECTION, message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
