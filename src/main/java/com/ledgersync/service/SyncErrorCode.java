package com.ledgersync.service;

public enum SyncErrorCode {
  NOT_FOUND,
  CONNECTION_INACTIVE,
  ALREADY_SYNCING,
  UPSTREAM_ERROR,
  SYNC_LIMIT_EXCEEDED,
  STORAGE_ERROR,
  INTERNAL_ERROR
}
