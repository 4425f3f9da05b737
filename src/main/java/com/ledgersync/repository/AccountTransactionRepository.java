package com.ledgersync.repository;

import com.ledgersync.model.AccountTransaction;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AccountTransactionRepository extends JpaRepository<AccountTransaction, UUID> {
  Optional<AccountTransaction> findByAccountIdAndUpstreamTransactionId(UUID accountId, String upstreamTransactionId);

  @Query("select t from AccountTransaction t where t.account.connection.id = :connectionId " +
      "order by t.occurredAt desc, t.createdAt desc")
  List<AccountTransaction> findByConnectionId(@Param("connectionId") UUID connectionId);

  @Query("select t from AccountTransaction t where t.account.connection.id = :connectionId " +
      "and t.upstreamTransactionId = :upstreamId")
  List<AccountTransaction> findByConnectionIdAndUpstreamId(@Param("connectionId") UUID connectionId,
                                                           @Param("upstreamId") String upstreamId);

  @Query("select count(t) from AccountTransaction t where t.account.connection.id = :connectionId")
  long countByConnectionId(@Param("connectionId") UUID connectionId);

  /**
   * Deletes the connection's rows carrying any of the given upstream ids. Ids without a row are
   * ignored, so the same id may be requested more than once.
   */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("delete from AccountTransaction t where t.upstreamTransactionId in :upstreamIds " +
      "and t.account.id in (select a.id from FinancialAccount a where a.connection.id = :connectionId)")
  int deleteByConnectionIdAndUpstreamIds(@Param("connectionId") UUID connectionId,
                                         @Param("upstreamIds") Collection<String> upstreamIds);
}
