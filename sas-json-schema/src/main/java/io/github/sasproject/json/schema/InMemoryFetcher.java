package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Serves already-parsed documents keyed by their fragment-free URI
public record InMemoryFetcher(String scheme, Map<URI, JsonNode> documents) implements JsonSchema.RemoteFetcher {
  public InMemoryFetcher {
    Objects.requireNonNull(scheme, "scheme");
    documents = Map.copyOf(Objects.requireNonNull(documents, "documents"));
  }

  @Override
  public FetchResult fetch(URI uri, FetchPolicy policy) {
    Objects.requireNonNull(uri, "uri");
    JsonNode document = documents.get(uri);
    if (document == null) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.NOT_FOUND,
          "No document registered for " + uri);
    }
    return new FetchResult(document, document.toString().getBytes(StandardCharsets.UTF_8).length, Optional.empty());
  }
}
