package io.github.sasproject.json.schema;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

import static io.github.sasproject.json.schema.JsonSchema.LOG;

/// Resolves opaque `file:Name.schema.json` references against a classpath directory
///
/// Lets a jar ship sibling schema documents that refer to each other by bare file name.
public record ClasspathFetcher(ClassLoader classLoader, String resourceRoot) implements JsonSchema.RemoteFetcher {
  public ClasspathFetcher {
    Objects.requireNonNull(classLoader, "classLoader");
    Objects.requireNonNull(resourceRoot, "resourceRoot");
    String root = resourceRoot.startsWith("/") ? resourceRoot.substring(1) : resourceRoot;
    resourceRoot = root.isEmpty() || root.endsWith("/") ? root : root + "/";
  }

  @Override
  public String scheme() {
    return "file";
  }

  @Override
  public FetchResult fetch(URI uri, FetchPolicy policy) {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(policy, "policy");

    if (!"file".equalsIgnoreCase(uri.getScheme()) || !uri.isOpaque()) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
          "ClasspathFetcher only handles opaque file:name URIs");
    }
    String name = uri.getSchemeSpecificPart();
    if (name.isEmpty() || name.contains("..") || name.startsWith("/")) {
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
          "Resource name escapes " + resourceRoot + ": " + name);
    }

    String resource = resourceRoot + name;
    LOG.finer(() -> "ClasspathFetcher resource=" + resource);
    try (InputStream in = classLoader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.NOT_FOUND,
            "No classpath resource: " + resource);
      }
      byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8L, policy.maxDocumentBytes() + 1));
      if (bytes.length > policy.maxDocumentBytes()) {
        throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.PAYLOAD_TOO_LARGE,
            "Resource exceeds maxDocumentBytes: " + resource);
      }
      return new FetchResult(FileFetcher.parse(uri, bytes), bytes.length, Optional.empty());
    } catch (IOException e) {
      LOG.log(Level.SEVERE, e, () -> "ERROR: IO reading classpath resource " + resource);
      throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.IO_ERROR,
          "IO reading classpath resource: " + e.getMessage(), e);
    }
  }
}
