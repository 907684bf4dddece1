package com.comanda.orderengine.config;

/** What a session conversion does with a cart line the catalog no longer knows. */
public enum MissingItemPolicy {
    SKIP,
    FAIL
}
