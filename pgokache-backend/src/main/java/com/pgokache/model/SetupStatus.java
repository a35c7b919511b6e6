package com.pgokache.model;

/**
 * Readiness classification returned by the setup checker.
 */
public enum SetupStatus {
    READY,
    PRELOAD_MISSING,
    EXTENSION_MISSING,
    CONNECTION_FAILED,
    PERMISSION_DENIED
}
