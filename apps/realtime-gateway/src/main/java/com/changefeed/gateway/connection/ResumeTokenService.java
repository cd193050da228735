package com.changefeed.gateway.connection;

import com.changefeed.domain.sessions.ResumeToken;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies resume keys: {@code <connectionIdentity>.<hex hmac-sha256(identity:subject)>}.
 * Binding the subject means a key is useless with another user's credential.
 */
public class ResumeTokenService {
  private static final Logger log = LoggerFactory.getLogger(ResumeTokenService.class);
  private static final String ALGORITHM = "HmacSHA256";

  private final byte[] secret;

  public ResumeTokenService(String secret) {
    if (secret == null || secret.isBlank()) {
      byte[] generated = new byte[32];
      new SecureRandom().nextBytes(generated);
      this.secret = generated;
      log.warn(
          "No resume secret configured; generated an ephemeral one, resume keys will not survive a restart");
    } else {
      this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }
  }

  public String issue(String connectionIdentity, String subject) {
    requireIdentity(connectionIdentity);
    return connectionIdentity + "." + sign(connectionIdentity, subject);
  }

  public boolean verify(ResumeToken token, String subject) {
    Objects.requireNonNull(token, "token must not be null");
    String expected = sign(token.connectionIdentity(), subject);
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        token.signature().getBytes(StandardCharsets.US_ASCII));
  }

  private String sign(String connectionIdentity, String subject) {
    String payload = connectionIdentity + ":" + Objects.requireNonNullElse(subject, "");
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret, ALGORITHM));
      byte[] signatureBytes = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(signatureBytes.length * 2);
      for (byte b : signatureBytes) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16));
        hex.append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Failed to sign resume key", ex);
    }
  }

  private static void requireIdentity(String connectionIdentity) {
    if (connectionIdentity == null || connectionIdentity.isBlank() || connectionIdentity.contains(".")) {
      throw new IllegalArgumentException("connectionIdentity must be non-blank and free of '.'");
    }
  }

  static String randomIdentity() {
    byte[] bytes = new byte[16];
    new SecureRandom().nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
