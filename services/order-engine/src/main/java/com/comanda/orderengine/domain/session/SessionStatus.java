package com.comanda.orderengine.domain.session;

public enum SessionStatus {
    UNINITIALIZED,
    ACTIVE,
    CONVERTED,
    ABANDONED
}
