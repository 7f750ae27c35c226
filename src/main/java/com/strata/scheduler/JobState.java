package com.strata.scheduler;

/**
 * IDLE -> DUE -> RUNNING -> (SUCCEEDED | FAILED) -> IDLE
 */
public enum JobState {
    IDLE,
    DUE,
    RUNNING,
    SUCCEEDED,
    FAILED
}
