package com.wscrape.capture;

/**
 * Lifecycle of a {@link WScrape}.
 *
 * IDLE -> RUNNING -> STOPPED, and DISPOSED from any state. There is no way back from STOPPED or DISPOSED.
 */
public enum CaptureState {
    IDLE,
    RUNNING,
    STOPPED,
    DISPOSED
}
