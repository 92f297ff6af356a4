package com.rostra.eventbus;

/** Lifecycle of an {@link EventDispatcher}: CREATED, then RUNNING, then STOPPED, never back. */
public enum DispatcherState {
    CREATED,
    RUNNING,
    STOPPED
}
