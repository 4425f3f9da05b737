package com.ledgersync.model;

public enum ConnectionStatus {
  ACTIVE,
  ERROR,
  PENDING_EXPIRATION,
  REVOKED,
  DISABLED;

  public boolean isSyncable() {
    return this == ACTIVE || this == ERROR || this == PENDING_EXPIRATION;
  }
}
