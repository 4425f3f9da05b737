package com.ledgersync.dto;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SyncRequest {
  @NotNull
  private UUID connectionId;

  @NotNull
  private UUID userId;

  private Boolean forceSync;

  public boolean isForced() {
    return Boolean.TRUE.equals(forceSync);
  }
}
