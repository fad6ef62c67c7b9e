package io.github.sasproject.record;

/// Raised when text is not an X.509 SubjectPublicKeyInfo this JVM can decode
public final class InvalidPublicKeyException extends IllegalArgumentException {
  public InvalidPublicKeyException(String message) {
    super(message);
  }

  public InvalidPublicKeyException(String message, Throwable cause) {
    super(message, cause);
  }
}
