package com.comanda.orderengine.domain.exception;

import java.util.UUID;

public class SessionNotFoundException extends OrderEngineException {

    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId) {
        super(ErrorCode.NOT_FOUND, "Order session %s not found".formatted(sessionId));
        this.sessionId = sessionId;
    }

    public UUID sessionId() {
        return sessionId;
    }
}
