package com.ledgersync.controller;

import com.ledgersync.dto.ConnectionResponse;
import com.ledgersync.dto.SyncResponse;
import com.ledgersync.service.ConnectionService;
import com.ledgersync.service.CurrentUserService;
import com.ledgersync.service.SyncService;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ConnectionController {
  private final ConnectionService connectionService;
  private final SyncService syncService;
  private final CurrentUserService currentUserService;

  public ConnectionController(ConnectionService connectionService,
                              SyncService syncService,
                              CurrentUserService currentUserService) {
    this.connectionService = connectionService;
    this.syncService = syncService;
    this.currentUserService = currentUserService;
  }

  @GetMapping("/connections")
  public List<ConnectionResponse> list() {
    UUID userId = currentUserService.requireUserId();
    return connectionService.listConnections(userId);
  }

  @PostMapping("/connections/{connectionId}/reset-cursor")
  public ResponseEntity<SyncResponse> resetCursor(@PathVariable UUID connectionId) {
    UUID userId = currentUserService.requireUserId();
    return SyncController.toResponse(syncService.resetCursor(connectionId, userId));
  }
}
