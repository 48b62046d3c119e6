package com.example.textengine.application.service;

/**
 * Life cycle of a {@link StreamingTextExtractor}.
 * <p>
 * {@code IDLE -> EMITTING -> DONE}; {@code reset()} returns an open stream to {@code IDLE}.
 */
public enum StreamState {
    IDLE,
    EMITTING,
    DONE
}
