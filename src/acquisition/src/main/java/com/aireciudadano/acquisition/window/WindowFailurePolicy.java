package com.aireciudadano.acquisition.window;

/** What an acquisition does when one window exhausts its retries or returns a malformed body. */
public enum WindowFailurePolicy {
  /** Record the window as failed and continue with the others. */
  SKIP,
  /** Stop the acquisition and rethrow the window's failure. */
  ABORT
}
