package io.github.sasproject.record;

import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

import static io.github.sasproject.record.RecordLogging.LOG;

/// Application-level check of the `publicKey` member, which the schema only types as a string
///
/// Accepts PEM (`-----BEGIN PUBLIC KEY-----`) or bare base64 DER of a SubjectPublicKeyInfo.
public final class X509PublicKeys {
  static final String PEM_BEGIN = "-----BEGIN PUBLIC KEY-----";
  static final String PEM_END = "-----END PUBLIC KEY-----";

  private static final List<String> ALGORITHMS = List.of("RSA", "EC", "Ed25519");

  private X509PublicKeys() {}

  /// @throws InvalidPublicKeyException if no supported algorithm accepts the key
  public static PublicKey parse(String text) {
    Objects.requireNonNull(text, "text");
    byte[] der = decode(text);
    X509EncodedKeySpec spec = new X509EncodedKeySpec(der);
    for (String algorithm : ALGORITHMS) {
      try {
        PublicKey key = KeyFactory.getInstance(algorithm).generatePublic(spec);
        LOG.finer(() -> "publicKey decoded algorithm=" + algorithm + " bytes=" + der.length);
        return key;
      } catch (InvalidKeySpecException e) {
        LOG.finest(() -> "publicKey not " + algorithm + ": " + e.getMessage());
      } catch (NoSuchAlgorithmException e) {
        LOG.fine(() -> "KeyFactory unavailable: " + algorithm);
      }
    }
    throw new InvalidPublicKeyException("Not an RSA, EC or Ed25519 SubjectPublicKeyInfo");
  }

  public static boolean isWellFormed(String text) {
    if (text == null) {
      return false;
    }
    try {
      parse(text);
      return true;
    } catch (InvalidPublicKeyException e) {
      return false;
    }
  }

  /// PEM text for a key, 64 characters per line
  public static String toPem(PublicKey key) {
    Objects.requireNonNull(key, "key");
    String body = Base64.getMimeEncoder(64, "\n".getBytes(java.nio.charset.StandardCharsets.US_ASCII))
        .encodeToString(key.getEncoded());
    return PEM_BEGIN + "\n" + body + "\n" + PEM_END + "\n";
  }

  private static byte[] decode(String text) {
    String body = text.trim();
    if (body.startsWith(PEM_BEGIN)) {
      int end = body.indexOf(PEM_END);
      if (end < 0) {
        throw new InvalidPublicKeyException("PEM block has no " + PEM_END + " line");
      }
      body = body.substring(PEM_BEGIN.length(), end);
    }
    body = body.replaceAll("\\s", "");
    if (body.isEmpty()) {
      throw new InvalidPublicKeyException("Public key text is empty");
    }
    try {
      return Base64.getDecoder().decode(body);
    } catch (IllegalArgumentException e) {
      throw new InvalidPublicKeyException("Public key is not base64: " + e.getMessage(), e);
    }
  }
}
