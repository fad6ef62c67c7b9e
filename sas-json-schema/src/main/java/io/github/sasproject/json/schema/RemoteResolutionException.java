package io.github.sasproject.json.schema;

import java.net.URI;
import java.util.Objects;

/// A `$ref` into another document could not be satisfied
///
/// Raised while compiling, never while validating. [#uri()] is the document or fragment URI
/// that failed.
public final class RemoteResolutionException extends RuntimeException {
  private final URI uri;
  private final Reason reason;

  public RemoteResolutionException(URI uri, Reason reason, String message) {
    this(uri, reason, message, null);
  }

  public RemoteResolutionException(URI uri, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.uri = Objects.requireNonNull(uri, "uri");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public URI uri() {
    return uri;
  }

  public Reason reason() {
    return reason;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + reason + " " + uri + "]: " + getMessage();
  }

  public enum Reason {
    /// Reading the document failed part way
    IO_ERROR,
    /// The document is not JSON
    PARSE_ERROR,
    /// Scheme, location or budget refused by the [FetchPolicy] or the fetcher
    POLICY_DENIED,
    NOT_FOUND,
    /// The document loaded but has nothing at the referenced fragment
    POINTER_MISSING,
    PAYLOAD_TOO_LARGE,
    TIMEOUT
  }
}
