package com.comanda.orderengine.domain.exception;

/** Applying the event would leave derived state inconsistent (e.g. a subtotal that does not add up). */
public class IntegrityException extends OrderEngineException {

    public IntegrityException(String message) {
        super(ErrorCode.INTEGRITY, message);
    }
}
