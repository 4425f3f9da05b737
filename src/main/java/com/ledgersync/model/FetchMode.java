package com.ledgersync.model;

public enum FetchMode {
  /** Fixed trailing date window, one call, no cursor. */
  SNAPSHOT,
  /** Cursor-based deltas, paginated. */
  INCREMENTAL
}
