package com.ledgersync.provider.plaid;

public class PlaidRateLimitedException extends PlaidApiException {
  public PlaidRateLimitedException(String path, int httpStatus, String errorCode, String message) {
    super(path, httpStatus, PlaidClient.RATE_LIMIT_ERROR_TYPE, errorCode, message);
  }
}
