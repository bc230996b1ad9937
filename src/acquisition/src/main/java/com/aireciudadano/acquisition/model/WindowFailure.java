package com.aireciudadano.acquisition.model;

/**
 * A window that was skipped, with enough context to act on it without re-running.
 *
 * @param window window bounds
 * @param kind failure category
 * @param attempts HTTP attempts made for the window
 * @param message cause description
 */
public record WindowFailure(TimeWindow window, FailureKind kind, int attempts, String message) {}
