package com.ledgersync.repository;

import com.ledgersync.model.FinancialAccount;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FinancialAccountRepository extends JpaRepository<FinancialAccount, UUID> {
  List<FinancialAccount> findByUserId(UUID userId);
  List<FinancialAccount> findByConnectionId(UUID connectionId);
  Optional<FinancialAccount> findByConnectionIdAndExternalId(UUID connectionId, String externalId);
}
