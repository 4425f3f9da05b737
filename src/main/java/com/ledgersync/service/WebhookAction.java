package com.ledgersync.service;

/** What a webhook led to, reported for logging and tests. */
public enum WebhookAction {
  REJECTED,
  SYNC_TRIGGERED,
  TRANSACTIONS_REMOVED,
  CONNECTION_UPDATED,
  ACCOUNTS_REFRESHED,
  IGNORED
}
