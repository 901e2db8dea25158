package com.fedquery.exception;

public class UnknownStrategyException extends FederationException {

    public UnknownStrategyException(String token) {
        super(ErrorKind.UNKNOWN_STRATEGY,
            "Unknown federation strategy '" + token + "', expected one of virtual, materialized, hybrid");
    }
}
