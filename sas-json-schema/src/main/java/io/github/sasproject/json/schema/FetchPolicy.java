package io.github.sasproject.json.schema;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/// Fetch policy settings guarding the loading of referenced schema documents
public record FetchPolicy(
    Set<String> allowedSchemes,
    long maxDocumentBytes,
    long maxTotalBytes,
    Duration timeout,
    int maxDocuments
) {
  public FetchPolicy {
    Objects.requireNonNull(allowedSchemes, "allowedSchemes");
    Objects.requireNonNull(timeout, "timeout");
    if (allowedSchemes.isEmpty()) {
      throw new IllegalArgumentException("allowedSchemes must not be empty");
    }
    allowedSchemes = Set.copyOf(allowedSchemes);
    if (maxDocumentBytes <= 0L) {
      throw new IllegalArgumentException("maxDocumentBytes must be > 0");
    }
    if (maxTotalBytes <= 0L) {
      throw new IllegalArgumentException("maxTotalBytes must be > 0");
    }
    if (maxDocuments <= 0) {
      throw new IllegalArgumentException("maxDocuments must be > 0");
    }
  }

  public static FetchPolicy defaults() {
    return new FetchPolicy(Set.of("http", "https", "file"), 1_048_576L, 8_388_608L, Duration.ofSeconds(5), 64);
  }

  public FetchPolicy withAllowedSchemes(Set<String> schemes) {
    Objects.requireNonNull(schemes, "schemes");
    return new FetchPolicy(schemes, maxDocumentBytes, maxTotalBytes, timeout, maxDocuments);
  }

  public FetchPolicy withMaxDocumentBytes(long bytes) {
    return new FetchPolicy(allowedSchemes, bytes, maxTotalBytes, timeout, maxDocuments);
  }

  public FetchPolicy withMaxDocuments(int documents) {
    return new FetchPolicy(allowedSchemes, maxDocumentBytes, maxTotalBytes, timeout, documents);
  }

  public FetchPolicy withTimeout(Duration newTimeout) {
    Objects.requireNonNull(newTimeout, "newTimeout");
    return new FetchPolicy(allowedSchemes, maxDocumentBytes, maxTotalBytes, newTimeout, maxDocuments);
  }
}
