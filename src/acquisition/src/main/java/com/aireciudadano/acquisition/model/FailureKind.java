package com.aireciudadano.acquisition.model;

/** Skippable per-window failure categories. */
public enum FailureKind {
  WINDOW_FETCH_FAILED,
  MALFORMED_RESPONSE
}
