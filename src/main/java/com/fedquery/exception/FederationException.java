package com.fedquery.exception;

/**
 * 联邦查询异常基类，携带错误类别与可读消息
 */
public class FederationException extends Exception {
    private final ErrorKind kind;

    public FederationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FederationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
