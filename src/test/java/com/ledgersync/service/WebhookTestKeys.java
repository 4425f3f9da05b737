package com.ledgersync.service;

import com.ledgersync.provider.plaid.VerificationKeyResponse;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;

/** An EC P-256 key pair plus helpers to sign webhook tokens the way the aggregator does. */
public final class WebhookTestKeys {
  public static final String KEY_ID = "kid-1";

  private final KeyPair keyPair;

  public WebhookTestKeys() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
      generator.initialize(new ECGenParameterSpec("secp256r1"));
      this.keyPair = generator.generateKeyPair();
    } catch (Exception ex) {
      throw new IllegalStateException(ex);
    }
  }

  public VerificationKeyResponse.JsonWebKey jwk(Long expiredAt) {
    ECPublicKey publicKey = (ECPublicKey) keyPair.getPublic();
    return new VerificationKeyResponse.JsonWebKey(KEY_ID, "EC", "P-256", "ES256", "sig",
        coordinate(publicKey.getW().getAffineX()), coordinate(publicKey.getW().getAffineY()),
        Instant.now().minusSeconds(3600).getEpochSecond(), expiredAt);
  }

  public String sign(String body, Instant issuedAt) {
    var builder = Jwts.builder()
        .setHeaderParam("kid", KEY_ID)
        .claim(WebhookVerifier.BODY_HASH_CLAIM, WebhookVerifier.sha256Hex(body));
    if (issuedAt != null) {
      builder.setIssuedAt(Date.from(issuedAt));
    }
    return builder.signWith(keyPair.getPrivate(), SignatureAlgorithm.ES256).compact();
  }

  private static String coordinate(BigInteger value) {
    byte[] bytes = value.toByteArray();
    byte[] fixed = new byte[32];
    if (bytes.length > 32) {
      bytes = Arrays.copyOfRange(bytes, bytes.length - 32, bytes.length);
    }
    System.arraycopy(bytes, 0, fixed, 32 - bytes.length, bytes.length);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(fixed);
  }
}
