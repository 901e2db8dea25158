package com.fedquery.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fedquery.exception.ErrorKind;
import com.fedquery.exception.FederationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * 统一响应包装
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    @JsonProperty("code")
    private final int code;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("data")
    private final T data;

    @JsonProperty("error_kind")
    private final String errorKind;

    private ApiResponse(int code, String message, T data, String errorKind) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.errorKind = errorKind;
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data, null);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null, null);
    }

    public static <T> ApiResponse<T> error(int code, String message, ErrorKind kind) {
        return new ApiResponse<>(code, message, null, kind != null ? kind.name() : null);
    }

    /**
     * 调用方错误 400，未找到 404，数据源完全不可用 502
     */
    public static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case SOURCE_CONNECTION:
                return HttpStatus.BAD_GATEWAY;
            case SYNTAX_ERROR:
            case UNKNOWN_PARAMETER:
            case UNKNOWN_STRATEGY:
            case JOIN_CONDITION:
            case MAPPING_SYNTHESIS:
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    public static <T> ResponseEntity<ApiResponse<T>> failure(FederationException e) {
        HttpStatus status = statusOf(e.getKind());
        return ResponseEntity.status(status).body(error(status.value(), e.getMessage(), e.getKind()));
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public T getData() {
        return data;
    }

    public String getErrorKind() {
        return errorKind;
    }
}
