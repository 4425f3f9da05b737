package com.ledgersync.controller;

import com.ledgersync.dto.SyncAllResponse;
import com.ledgersync.dto.SyncRequest;
import com.ledgersync.dto.SyncResponse;
import com.ledgersync.service.CurrentUserService;
import com.ledgersync.service.SyncErrorCode;
import com.ledgersync.service.SyncOutcome;
import com.ledgersync.service.SyncService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
public class SyncController {
  private final SyncService syncService;
  private final CurrentUserService currentUserService;

  public SyncController(SyncService syncService, CurrentUserService currentUserService) {
    this.syncService = syncService;
    this.currentUserService = currentUserService;
  }

  @PostMapping("/transactions")
  public ResponseEntity<SyncResponse> syncTransactions(@Valid @RequestBody SyncRequest request) {
    UUID userId = currentUserService.requireSameUser(request.getUserId());
    SyncOutcome outcome = syncService.sync(request.getConnectionId(), userId, request.isForced());
    return toResponse(outcome);
  }

  @PostMapping("/all")
  public SyncAllResponse syncAll() {
    UUID userId = currentUserService.requireUserId();
    List<SyncResponse> results = syncService.syncAllForUser(userId).stream()
        .map(SyncResponse::from)
        .toList();
    int failed = (int) results.stream().filter(result -> !result.getSuccess()).count();
    return new SyncAllResponse(results.size() - failed, failed, results);
  }

  static ResponseEntity<SyncResponse> toResponse(SyncOutcome outcome) {
    return ResponseEntity.status(statusFor(outcome.code())).body(SyncResponse.from(outcome));
  }

  static HttpStatus statusFor(SyncErrorCode code) {
    if (code == null) {
      return HttpStatus.OK;
    }
    return switch (code) {
      case NOT_FOUND -> HttpStatus.NOT_FOUND;
      case ALREADY_SYNCING, CONNECTION_INACTIVE -> HttpStatus.CONFLICT;
      case UPSTREAM_ERROR -> HttpStatus.BAD_GATEWAY;
      default -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }
}
