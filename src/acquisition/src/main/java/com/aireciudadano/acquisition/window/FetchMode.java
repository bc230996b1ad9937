package com.aireciudadano.acquisition.window;

/** How the windows of one acquisition are scheduled. */
public enum FetchMode {
  /** One window after another on the calling thread. */
  SEQUENTIAL,
  /** Windows fetched concurrently on a fixed-size pool, merged afterwards. */
  PARALLEL
}
