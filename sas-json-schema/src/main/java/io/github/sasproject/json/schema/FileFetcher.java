package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

import static io.github.sasproject.json.schema.JsonSchema.LOG;

/// Reads schema documents from one directory tree and nothing outside it
///
/// Both `file:///abs/path.json` and the opaque `file:Name.schema.json` form are accepted;
/// an opaque name is taken relative to `jailRoot`.
public record FileFetcher(Path jailRoot) implements JsonSchema.RemoteFetcher {
  public FileFetcher {
    jailRoot = Objects.requireNonNull(jailRoot, "jailRoot").toAbsolutePath().normalize();
    Path root = jailRoot;
    LOG.info(() -> "FileFetcher jailRoot=" + root);
  }

  @Override
  public String scheme() {
    return "file";
  }

  @Override
  public FetchResult fetch(URI uri, FetchPolicy policy) {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(policy, "policy");
    if (!"file".equalsIgnoreCase(uri.getScheme())) {
      LOG.severe(() -> "ERROR: FETCH: FileFetcher given " + uri);
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
          "FileFetcher only handles file: URIs");
    }

    Path target = locate(uri);
    if (!target.startsWith(jailRoot)) {
      LOG.fine(() -> "fetch denied, " + target + " is outside " + jailRoot);
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
          "Outside jail: " + target);
    }
    if (!Files.isRegularFile(target)) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.NOT_FOUND,
          "No such file: " + target);
    }
    requireInsideJail(uri, target);

    // One byte past the limit is enough to tell an oversized file
    long limit = policy.maxDocumentBytes();
    byte[] bytes;
    try (InputStream in = Files.newInputStream(target)) {
      bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, limit + 1));
    } catch (NoSuchFileException e) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.NOT_FOUND,
          "No such file: " + target, e);
    } catch (IOException e) {
      LOG.log(Level.SEVERE, e, () -> "ERROR: FETCH: cannot read " + target);
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.IO_ERROR,
          "IO reading file: " + e.getMessage(), e);
    }
    if (bytes.length > limit) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.PAYLOAD_TOO_LARGE,
          "File exceeds maxDocumentBytes (" + limit + "): " + target);
    }
    LOG.finer(() -> "FileFetcher read " + bytes.length + " bytes from " + target);
    return new FetchResult(parse(uri, bytes), bytes.length, Optional.empty());
  }

  /// Symlinks are followed before comparing, so a link inside the jail cannot point out of it
  private void requireInsideJail(URI uri, Path target) {
    Path real;
    Path realRoot;
    try {
      real = target.toRealPath();
      realRoot = jailRoot.toRealPath();
    } catch (NoSuchFileException e) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.NOT_FOUND,
          "No such file: " + target, e);
    } catch (IOException e) {
      LOG.log(Level.SEVERE, e, () -> "ERROR: FETCH: cannot resolve " + target);
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.IO_ERROR,
          "IO resolving file: " + e.getMessage(), e);
    }
    if (!real.startsWith(realRoot)) {
      LOG.fine(() -> "fetch denied, " + target + " resolves to " + real + " outside " + realRoot);
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
          "Outside jail: " + real);
    }
  }

  private Path locate(URI uri) {
    if (uri.isOpaque()) {
      return jailRoot.resolve(uri.getSchemeSpecificPart()).normalize();
    }
    try {
      return Path.of(uri).normalize();
    } catch (IllegalArgumentException e) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
          "Unsupported file URI: " + uri, e);
    }
  }

  /// Parse fetched bytes, reporting bad JSON as [RemoteResolutionException.Reason#PARSE_ERROR]
  static JsonNode parse(URI uri, byte[] bytes) {
    try {
      return SchemaJson.parse(bytes);
    } catch (IllegalArgumentException e) {
      LOG.severe(() -> "ERROR: FETCH: " + uri + " is not JSON: " + e.getMessage());
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.PARSE_ERROR,
          "Schema document is not valid JSON: " + uri, e);
    }
  }
}
