package com.comanda.orderengine.domain.exception;

/** Stable category of a rejected command, for callers that map errors to responses. */
public enum ErrorCode {
    VALIDATION,
    STATE_CONFLICT,
    NOT_FOUND,
    DEPENDENCY,
    INSUFFICIENT_STOCK,
    INTEGRITY
}
