package com.comanda.orderengine.domain.exception;

/**
 * Base class for every rejection raised by the order engine. The message always names the specific
 * reason (e.g. "cannot remove items once preparing has started").
 */
public abstract class OrderEngineException extends RuntimeException {

    private final ErrorCode code;

    protected OrderEngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected OrderEngineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
