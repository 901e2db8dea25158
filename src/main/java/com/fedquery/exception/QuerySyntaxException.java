package com.fedquery.exception;

/**
 * 查询文本不合法，查询不会被执行
 */
public class QuerySyntaxException extends FederationException {
    private final int position;

    public QuerySyntaxException(String message) {
        this(message, -1);
    }

    public QuerySyntaxException(String message, int position) {
        super(ErrorKind.SYNTAX_ERROR, position >= 0 ? message + " (at position " + position + ")" : message);
        this.position = position;
    }

    /**
     * 出错位置（字符偏移），未知时为 -1
     */
    public int getPosition() {
        return position;
    }
}
