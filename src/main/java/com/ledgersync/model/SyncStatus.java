package com.ledgersync.model;

public enum SyncStatus {
  IDLE,
  SYNCING,
  ERROR
}
