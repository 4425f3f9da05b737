package com.ledgersync.provider.plaid;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VerificationKeyResponse(
    JsonWebKey key,
    @JsonProperty("request_id") String requestId
) {

  /** EC public key in JWK form; {@code expiredAt} is set once the key has been rotated out. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record JsonWebKey(
      String kid,
      String kty,
      String crv,
      String alg,
      String use,
      String x,
      String y,
      @JsonProperty("created_at") Long createdAt,
      @JsonProperty("expired_at") Long expiredAt
  ) {}
}
