package com.ledgersync.provider;

import com.ledgersync.model.AggregatorEnvironment;
import com.ledgersync.model.FetchMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class FetchStrategyRegistry {
  private final Map<FetchMode, TransactionFetchStrategy> strategies = new EnumMap<>(FetchMode.class);

  public FetchStrategyRegistry(List<TransactionFetchStrategy> strategies) {
    for (TransactionFetchStrategy strategy : strategies) {
      if (this.strategies.put(strategy.mode(), strategy) != null) {
        throw new IllegalStateException("Duplicate fetch strategy for mode " + strategy.mode());
      }
    }
  }

  public TransactionFetchStrategy require(FetchMode mode) {
    TransactionFetchStrategy strategy = strategies.get(mode);
    if (strategy == null) {
      throw new IllegalStateException("No fetch strategy registered for mode " + mode);
    }
    return strategy;
  }

  /** Connections without a recorded environment are treated as production items. */
  public TransactionFetchStrategy forEnvironment(AggregatorEnvironment environment) {
    AggregatorEnvironment resolved = environment == null ? AggregatorEnvironment.PRODUCTION : environment;
    return require(resolved.fetchMode());
  }
}
