package com.ledgersync.model;

/**
 * Upstream environment a connection was linked in. Sandbox items are fetched as snapshots, every
 * other environment supports cursor-based incremental sync.
 */
public enum AggregatorEnvironment {
  SANDBOX(FetchMode.SNAPSHOT),
  DEVELOPMENT(FetchMode.INCREMENTAL),
  PRODUCTION(FetchMode.INCREMENTAL);

  private final FetchMode fetchMode;

  AggregatorEnvironment(FetchMode fetchMode) {
    this.fetchMode = fetchMode;
  }

  public FetchMode fetchMode() {
    return fetchMode;
  }
}
