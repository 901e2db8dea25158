package com.fedquery.exception;

import java.util.Collections;
import java.util.List;

/**
 * 查询引用的 :name 参数没有绑定值
 */
public class UnknownParameterException extends FederationException {
    private final List<String> parameterNames;

    public UnknownParameterException(List<String> parameterNames) {
        super(ErrorKind.UNKNOWN_PARAMETER, "No value bound for parameter(s): :" + String.join(", :", parameterNames));
        this.parameterNames = Collections.unmodifiableList(parameterNames);
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }
}
