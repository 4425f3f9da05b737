package com.ledgersync.service;

import com.ledgersync.dto.ConnectionResponse;
import com.ledgersync.model.Connection;
import com.ledgersync.repository.ConnectionRepository;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class ConnectionService {
  private final ConnectionRepository connectionRepository;

  public ConnectionService(ConnectionRepository connectionRepository) {
    this.connectionRepository = connectionRepository;
  }

  public List<ConnectionResponse> listConnections(UUID userId) {
    return connectionRepository.findByUserId(userId).stream()
        .sorted(Comparator.comparing(Connection::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
        .map(this::toResponse)
        .toList();
  }

  private ConnectionResponse toResponse(Connection connection) {
    return new ConnectionResponse(
        connection.getId(),
        connection.getDisplayName(),
        connection.getInstitutionId(),
        connection.getEnvironment(),
        connection.getStatus(),
        connection.isAutoSyncEnabled(),
        connection.getCursor() != null,
        connection.getSyncStatus(),
        connection.getLastSyncedAt(),
        connection.getLastSyncStartedAt(),
        connection.getLastSyncCompletedAt(),
        connection.getLastSyncError(),
        connection.getErrorMessage(),
        connection.getCreatedAt());
  }
}
