package com.ledgersync.provider;

import com.ledgersync.model.FetchMode;

public record FetchSummary(FetchMode mode, int rounds, int records, String cursor) {}
