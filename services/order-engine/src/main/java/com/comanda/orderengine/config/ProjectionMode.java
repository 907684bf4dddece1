package com.comanda.orderengine.config;

/** How committed events reach the read models. */
public enum ProjectionMode {
    /** On the writing thread, before the command returns. */
    SYNCHRONOUS,
    /** On a single background thread, in append order. */
    QUEUED
}
