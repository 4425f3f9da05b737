package com.ledgersync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncAllResponse {
  @JsonProperty("connections_synced")
  private int connectionsSynced;

  @JsonProperty("connections_failed")
  private int connectionsFailed;

  private List<SyncResponse> results;
}
