package com.fedquery.exception;

/**
 * 映射规则转换失败（未知转换名或值无法转换），原值原样保留
 */
public class MappingSynthesisException extends FederationException {

    public MappingSynthesisException(String message) {
        super(ErrorKind.MAPPING_SYNTHESIS, message);
    }

    public MappingSynthesisException(String message, Throwable cause) {
        super(ErrorKind.MAPPING_SYNTHESIS, message, cause);
    }
}
