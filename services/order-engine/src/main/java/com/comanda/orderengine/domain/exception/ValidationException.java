package com.comanda.orderengine.domain.exception;

/** Malformed command input: missing fields, non-positive quantities, unknown line items. */
public class ValidationException extends OrderEngineException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
