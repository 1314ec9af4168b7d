package com.picframe.cache.model;

/**
 * Lifecycle states of the cache writer loop.
 */
public enum SchedulerState {
    RUNNING,
    PAUSED,
    STOPPED
}
