package com.ledgersync.service;

import com.ledgersync.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.stereotype.Service;

/**
 * Reads the bearer tokens that authenticate API callers. Login lives outside this service;
 * {@link #generateToken} is the hook an issuing component (or a test) uses to mint a token that
 * {@link #parseUserId} accepts with the same secret and issuer.
 */
@Service
public class JwtService {
  private final JwtProperties properties;
  private final SecretKey key;

  public JwtService(JwtProperties properties) {
    if (properties.secret() == null || properties.secret().isBlank()) {
      throw new IllegalStateException("ledgersync.jwt.secret is required");
    }
    this.properties = properties;
    this.key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
  }

  public String generateToken(UUID userId) {
    Instant now = Instant.now();
    long ttlMinutes = properties.ttlMinutes() > 0 ? properties.ttlMinutes() : 60;
    Instant expiry = now.plusSeconds(ttlMinutes * 60L);

    return Jwts.builder()
        .setSubject(userId.toString())
        .setIssuer(properties.issuer())
        .setIssuedAt(Date.from(now))
        .setExpiration(Date.from(expiry))
        .signWith(key, SignatureAlgorithm.HS256)
        .compact();
  }

  public UUID parseUserId(String token) {
    JwtParserBuilder parser = Jwts.parserBuilder().setSigningKey(key);
    if (properties.issuer() != null && !properties.issuer().isBlank()) {
      parser.requireIssuer(properties.issuer());
    }
    Claims claims = parser.build()
        .parseClaimsJws(token)
        .getBody();
    return UUID.fromString(claims.getSubject());
  }
}
