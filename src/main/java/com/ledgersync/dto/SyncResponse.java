package com.ledgersync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ledgersync.service.SyncErrorCode;
import com.ledgersync.service.SyncOutcome;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Wire form of a sync run; failed runs carry only the error fields. */
@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncResponse {
  @JsonProperty("connection_id")
  private UUID connectionId;

  private Boolean success;

  @JsonProperty("transactions_synced")
  private Integer transactionsSynced;

  @JsonProperty("pending_transactions_updated")
  private Integer pendingTransactionsUpdated;

  @JsonProperty("transactions_removed")
  private Integer transactionsRemoved;

  @JsonProperty("accounts_updated")
  private Integer accountsUpdated;

  private String cursor;

  private String error;

  private SyncErrorCode code;

  public static SyncResponse from(SyncOutcome outcome) {
    if (!outcome.success()) {
      return new SyncResponse(outcome.connectionId(), false, null, null, null, null, null,
          outcome.error(), outcome.code());
    }
    return new SyncResponse(outcome.connectionId(), true, outcome.transactionsSynced(),
        outcome.pendingTransactionsUpdated(), outcome.transactionsRemoved(), outcome.accountsUpdated(),
        outcome.cursor(), null, null);
  }
}
