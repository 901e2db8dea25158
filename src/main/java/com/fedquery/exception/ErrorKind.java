package com.fedquery.exception;

/**
 * 联邦查询错误类别
 */
public enum ErrorKind {
    SYNTAX_ERROR,
    UNKNOWN_PARAMETER,
    UNKNOWN_STRATEGY,
    SOURCE_CONNECTION,
    JOIN_CONDITION,
    MAPPING_SYNTHESIS,
    NOT_FOUND
}
