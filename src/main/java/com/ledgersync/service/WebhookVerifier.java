package com.ledgersync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgersync.config.AppProperties;
import com.ledgersync.config.PlaidProperties;
import com.ledgersync.config.WebhookProperties;
import com.ledgersync.provider.plaid.PlaidClient;
import com.ledgersync.provider.plaid.VerificationKeyResponse;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

/**
 * Authenticates inbound aggregator webhooks. The {@code Plaid-Verification} header carries an ES256
 * JWT whose {@code request_body_sha256} claim must match the raw body and whose {@code iat} must be
 * recent. Verification keys are fetched by key id and cached.
 */
@Service
public class WebhookVerifier {
  public static final String VERIFICATION_HEADER = "Plaid-Verification";
  static final String EXPECTED_ALGORITHM = "ES256";
  static final String BODY_HASH_CLAIM = "request_body_sha256";
  private static final Logger log = LoggerFactory.getLogger(WebhookVerifier.class);
  private static final long DEFAULT_MAX_AGE_SECONDS = 300;
  static final long MAX_CLOCK_SKEW_SECONDS = 60;
  private static final long DEFAULT_KEY_CACHE_TTL_SECONDS = 3600;

  private final PlaidClient plaidClient;
  private final ObjectMapper objectMapper;
  private final WebhookProperties webhookProperties;
  private final AppProperties appProperties;
  private final PlaidProperties plaidProperties;
  private final Map<String, CachedKey> keyCache = new ConcurrentHashMap<>();

  public WebhookVerifier(PlaidClient plaidClient,
                         ObjectMapper objectMapper,
                         WebhookProperties webhookProperties,
                         AppProperties appProperties,
                         PlaidProperties plaidProperties) {
    this.plaidClient = plaidClient;
    this.objectMapper = objectMapper;
    this.webhookProperties = webhookProperties;
    this.appProperties = appProperties;
    this.plaidProperties = plaidProperties;
  }

  /**
   * Returns normally when the webhook is authentic.
   *
   * @throws WebhookVerificationException when any check fails
   */
  public void verify(HttpHeaders headers, String rawBody) {
    if (isBypassEnabled()) {
      log.warn("Webhook verification skipped (development bypass)");
      return;
    }
    String token = headers == null ? null : headers.getFirst(VERIFICATION_HEADER);
    if (token == null || token.isBlank()) {
      throw reject("missing verification header", null);
    }
    JsonNode header = decodeHeader(token);
    String algorithm = header.path("alg").asText(null);
    if (!EXPECTED_ALGORITHM.equals(algorithm)) {
      throw reject("unexpected algorithm " + algorithm, null);
    }
    String keyId = header.path("kid").asText(null);
    if (keyId == null || keyId.isBlank()) {
      throw reject("missing key id", null);
    }

    Claims claims;
    try {
      claims = Jwts.parserBuilder()
          .setSigningKey(resolveKey(keyId))
          .build()
          .parseClaimsJws(token)
          .getBody();
    } catch (JwtException | IllegalArgumentException ex) {
      throw reject("signature check failed", ex);
    }

    String expectedHash = claims.get(BODY_HASH_CLAIM, String.class);
    String actualHash = sha256Hex(rawBody == null ? "" : rawBody);
    if (expectedHash == null || !MessageDigest.isEqual(
        expectedHash.toLowerCase().getBytes(StandardCharsets.UTF_8),
        actualHash.getBytes(StandardCharsets.UTF_8))) {
      throw reject("body hash mismatch", null);
    }

    Date issuedAt = claims.getIssuedAt();
    if (issuedAt == null) {
      throw reject("missing iat", null);
    }
    long maxAge = webhookProperties.maxAgeSeconds() > 0 ? webhookProperties.maxAgeSeconds() : DEFAULT_MAX_AGE_SECONDS;
    long age = Duration.between(issuedAt.toInstant(), Instant.now()).getSeconds();
    if (age > maxAge) {
      throw reject("token is " + age + "s old", null);
    }
    if (age < -MAX_CLOCK_SKEW_SECONDS) {
      throw reject("token issued " + -age + "s in the future", null);
    }
  }

  /**
   * The bypass needs the development deployment, the explicit flag and a non-production aggregator
   * environment at the same time. Nothing in the request can influence it.
   */
  public boolean isBypassEnabled() {
    return appProperties.isDevelopment()
        && webhookProperties.skipVerification()
        && !"production".equalsIgnoreCase(plaidProperties.environment());
  }

  private JsonNode decodeHeader(String token) {
    String[] parts = token.split("\\.");
    if (parts.length != 3) {
      throw reject("malformed token", null);
    }
    try {
      return objectMapper.readTree(Base64.getUrlDecoder().decode(parts[0]));
    } catch (Exception ex) {
      throw reject("unreadable token header", ex);
    }
  }

  private PublicKey resolveKey(String keyId) {
    Instant now = Instant.now();
    CachedKey cached = keyCache.get(keyId);
    if (cached != null && cached.isUsable(now)) {
      return cached.key();
    }
    VerificationKeyResponse.JsonWebKey jwk;
    try {
      jwk = plaidClient.getWebhookVerificationKey(keyId);
    } catch (RuntimeException ex) {
      throw reject("verification key unavailable", ex);
    }
    Instant expiredAt = jwk.expiredAt() == null ? null : Instant.ofEpochSecond(jwk.expiredAt());
    if (expiredAt != null && !expiredAt.isAfter(now)) {
      throw reject("verification key " + keyId + " has expired", null);
    }
    PublicKey key = toPublicKey(jwk);
    long ttl = webhookProperties.keyCacheTtlSeconds() > 0 ? webhookProperties.keyCacheTtlSeconds() : DEFAULT_KEY_CACHE_TTL_SECONDS;
    keyCache.put(keyId, new CachedKey(key, now.plusSeconds(ttl), expiredAt));
    return key;
  }

  static PublicKey toPublicKey(VerificationKeyResponse.JsonWebKey jwk) {
    if (!"EC".equals(jwk.kty()) || (jwk.crv() != null && !"P-256".equals(jwk.crv()))) {
      throw reject("unsupported key type " + jwk.kty() + "/" + jwk.crv(), null);
    }
    if (jwk.x() == null || jwk.y() == null) {
      throw reject("verification key has no coordinates", null);
    }
    try {
      AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
      parameters.init(new ECGenParameterSpec("secp256r1"));
      ECParameterSpec curve = parameters.getParameterSpec(ECParameterSpec.class);
      ECPoint point = new ECPoint(
          new BigInteger(1, Base64.getUrlDecoder().decode(jwk.x())),
          new BigInteger(1, Base64.getUrlDecoder().decode(jwk.y())));
      return KeyFactory.getInstance("EC").generatePublic(new ECPublicKeySpec(point, curve));
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      throw reject("invalid verification key", ex);
    }
  }

  static String sha256Hex(String body) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  private static WebhookVerificationException reject(String reason, Throwable cause) {
    log.debug("Webhook rejected: {}", reason, cause);
    return cause == null ? new WebhookVerificationException() : new WebhookVerificationException(cause);
  }

  private record CachedKey(PublicKey key, Instant cacheUntil, Instant expiredAt) {
    boolean isUsable(Instant now) {
      return now.isBefore(cacheUntil) && (expiredAt == null || now.isBefore(expiredAt));
    }
  }
}
