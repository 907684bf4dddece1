package com.comanda.orderengine.domain.exception;

/**
 * The command is not legal in the aggregate's current state, or a required reason is missing.
 */
public class InvalidOrderStateException extends OrderEngineException {

    public InvalidOrderStateException(String message) {
        super(ErrorCode.STATE_CONFLICT, message);
    }
}
