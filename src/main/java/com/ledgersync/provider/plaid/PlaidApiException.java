package com.ledgersync.provider.plaid;

/**
 * Failed call to the aggregator. {@code httpStatus} is 0 when no response was received.
 */
public class PlaidApiException extends RuntimeException {
  private final String path;
  private final int httpStatus;
  private final String errorType;
  private final String errorCode;

  public PlaidApiException(String path, int httpStatus, String errorType, String errorCode, String message) {
    this(path, httpStatus, errorType, errorCode, message, null);
  }

  public PlaidApiException(String path,
                           int httpStatus,
                           String errorType,
                           String errorCode,
                           String message,
                           Throwable cause) {
    super("Plaid " + path + " failed (" + httpStatus + " " + errorCode + "): " + message, cause);
    this.path = path;
    this.httpStatus = httpStatus;
    this.errorType = errorType;
    this.errorCode = errorCode;
  }

  public String getPath() {
    return path;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public String getErrorType() {
    return errorType;
  }

  public String getErrorCode() {
    return errorCode;
  }
}
