package com.fedquery.exception;

/**
 * JOIN 的 ON 条件无法对应到连接两侧，执行器跳过该 JOIN
 */
public class JoinConditionException extends FederationException {

    public JoinConditionException(String message) {
        super(ErrorKind.JOIN_CONDITION, message);
    }
}
