package com.ledgersync.service;

import com.ledgersync.config.CryptoProperties;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Service;

/**
 * Encrypts upstream access tokens at rest. The owning connection id is bound as associated data, so
 * a ciphertext copied onto another connection row fails to open.
 */
@Service
public class CredentialVault {
  private static final String VERSION_PREFIX = "v1:";
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128;
  private static final int IV_LENGTH = 12;

  private final SecretKey key;
  private final SecureRandom secureRandom = new SecureRandom();

  public CredentialVault(CryptoProperties properties) {
    if (properties.secret() == null || properties.secret().isBlank()) {
      throw new IllegalStateException("ledgersync.crypto.secret is required");
    }
    byte[] keyBytes = Base64.getDecoder().decode(properties.secret().trim());
    if (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32) {
      throw new IllegalStateException("ledgersync.crypto.secret must decode to a 128, 192 or 256 bit key");
    }
    this.key = new SecretKeySpec(keyBytes, "AES");
  }

  public String seal(UUID connectionId, String accessToken) {
    if (accessToken == null) {
      return null;
    }
    try {
      byte[] iv = new byte[IV_LENGTH];
      secureRandom.nextBytes(iv);
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      cipher.updateAAD(associatedData(connectionId));
      byte[] encrypted = cipher.doFinal(accessToken.getBytes(StandardCharsets.UTF_8));
      return VERSION_PREFIX + Base64.getEncoder().encodeToString(iv) + ":" + Base64.getEncoder().encodeToString(encrypted);
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to encrypt credential", ex);
    }
  }

  public String open(UUID connectionId, String sealed) {
    if (sealed == null || sealed.isBlank()) {
      return null;
    }
    if (!sealed.startsWith(VERSION_PREFIX)) {
      throw new IllegalStateException("Unsupported credential format");
    }
    try {
      String[] parts = sealed.substring(VERSION_PREFIX.length()).split(":", 2);
      byte[] iv = Base64.getDecoder().decode(parts[0]);
      byte[] encrypted = Base64.getDecoder().decode(parts[1]);
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      cipher.updateAAD(associatedData(connectionId));
      return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to decrypt credential", ex);
    }
  }

  private static byte[] associatedData(UUID connectionId) {
    if (connectionId == null) {
      throw new IllegalArgumentException("connectionId is required");
    }
    return connectionId.toString().getBytes(StandardCharsets.UTF_8);
  }
}
