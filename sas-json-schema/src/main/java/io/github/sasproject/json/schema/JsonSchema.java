package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.time.Duration;
import java.util.*;
import java.util.logging.Logger;

/// A compiled draft-04 JSON Schema
///
/// Compile once and share: instances are immutable and [#validate(JsonNode)] keeps all of
/// its state on the calling thread.
///
/// ```java
/// JsonSchema schema = JsonSchema.compile(SchemaJson.parse(schemaText));
/// JsonSchema.ValidationResult result = schema.validate(SchemaJson.parse(candidateText));
/// result.errors().forEach(e -> System.out.println(e.path() + " " + e.keyword() + ": " + e.message()));
/// ```
///
/// References to other documents are loaded through a [RemoteFetcher] named in [CompileOptions];
/// by default every such reference is refused.
public sealed interface JsonSchema
    permits ObjectSchema,
    ArraySchema,
    StringSchema,
    NumberSchema,
    BooleanSchema,
    NullSchema,
    AnySchema,
    RefSchema,
    AllOfSchema,
    AnyOfSchema,
    OneOfSchema,
    NotSchema,
    EnumSchema {

  Logger LOG = SchemaLogging.LOG;

  /// Pointer to a document's root schema
  String SCHEMA_POINTER_ROOT = "#";

  /// Document URI given to schemas compiled from a bare tree
  URI IN_MEMORY_ROOT = URI.create("urn:inmemory:root");

  /// `true` turns on format assertion for [JsonSchemaOptions#fromSystemProperties()]
  String FORMAT_ASSERTION_PROPERTY = "jsonschema.format.assertion";

  /// Vocabulary switches
  ///
  /// @param assertFormats reject strings that fail a known `format`; draft-04 otherwise treats it as an annotation
  record JsonSchemaOptions(boolean assertFormats) {
    public static final JsonSchemaOptions DEFAULT = new JsonSchemaOptions(false);
    public static final JsonSchemaOptions ASSERT_FORMATS = new JsonSchemaOptions(true);

    /// Read at call time so tests can flip the property between compilations
    public static JsonSchemaOptions fromSystemProperties() {
      String value = System.getProperty(FORMAT_ASSERTION_PROPERTY);
      return value != null && Boolean.parseBoolean(value.trim()) ? ASSERT_FORMATS : DEFAULT;
    }
  }

  /// How `$ref`s into other documents are loaded
  record CompileOptions(RemoteFetcher remoteFetcher, FetchPolicy fetchPolicy) {
    public static final CompileOptions DEFAULT = new CompileOptions(RemoteFetcher.disallowed(), FetchPolicy.defaults());

    public CompileOptions {
      Objects.requireNonNull(remoteFetcher, "remoteFetcher");
      Objects.requireNonNull(fetchPolicy, "fetchPolicy");
    }

    public static CompileOptions remoteDefaults(RemoteFetcher fetcher) {
      return new CompileOptions(Objects.requireNonNull(fetcher, "fetcher"), FetchPolicy.defaults());
    }

    public CompileOptions withFetchPolicy(FetchPolicy policy) {
      return new CompileOptions(remoteFetcher, Objects.requireNonNull(policy, "policy"));
    }
  }

  /// Loads the document behind a non-local `$ref`
  ///
  /// Implementations receive fragment-free URIs and report every failure as a
  /// [RemoteResolutionException] with a [RemoteResolutionException.Reason].
  interface RemoteFetcher {
    /// Lower-case URI scheme served, used by [#byScheme(RemoteFetcher...)]
    String scheme();

    FetchResult fetch(URI uri, FetchPolicy policy) throws RemoteResolutionException;

    /// Refuses everything; the default when no fetcher is configured
    static RemoteFetcher disallowed() {
      return new RemoteFetcher() {
        @Override
        public String scheme() {
          return "<disabled>";
        }

        @Override
        public FetchResult fetch(URI uri, FetchPolicy policy) {
          Objects.requireNonNull(uri, "uri");
          LOG.severe(() -> "ERROR: FETCH: remote $ref refused, no fetcher configured: " + uri);
          throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
              "Remote fetching is disabled");
        }
      };
    }

    /// Routes each URI to the fetcher registered for its scheme
    /// @throws IllegalArgumentException for an empty list, a blank scheme or two fetchers on one scheme
    static RemoteFetcher byScheme(RemoteFetcher... fetchers) {
      return new DelegatingRemoteFetcher(fetchers);
    }

    /// @param byteSize encoded size, checked against [FetchPolicy#maxDocumentBytes()]
    /// @param elapsed wall time of the fetch when the fetcher measured it
    record FetchResult(JsonNode document, long byteSize, Optional<Duration> elapsed) {
      public FetchResult {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(elapsed, "elapsed");
        if (byteSize < 0L) {
          throw new IllegalArgumentException("byteSize must be >= 0");
        }
      }
    }
  }

  final class DelegatingRemoteFetcher implements RemoteFetcher {
    private final Map<String, RemoteFetcher> fetchers;

    DelegatingRemoteFetcher(RemoteFetcher... fetchers) {
      Objects.requireNonNull(fetchers, "fetchers");
      if (fetchers.length == 0) {
        throw new IllegalArgumentException("At least one RemoteFetcher required");
      }
      Map<String, RemoteFetcher> registered = new LinkedHashMap<>();
      for (RemoteFetcher fetcher : fetchers) {
        String scheme = Objects.requireNonNull(fetcher, "fetcher").scheme();
        if (scheme == null || scheme.isBlank()) {
          throw new IllegalArgumentException("RemoteFetcher scheme must not be empty");
        }
        RemoteFetcher previous = registered.put(scheme.toLowerCase(Locale.ROOT), fetcher);
        if (previous != null) {
          throw new IllegalArgumentException("Duplicate RemoteFetcher for scheme: " + scheme);
        }
      }
      this.fetchers = Collections.unmodifiableMap(registered);
    }

    @Override
    public String scheme() {
      return "delegating";
    }

    @Override
    public FetchResult fetch(URI uri, FetchPolicy policy) {
      Objects.requireNonNull(uri, "uri");
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      RemoteFetcher target = fetchers.get(scheme);
      if (target == null) {
        LOG.severe(() -> "ERROR: FETCH: no fetcher for scheme '" + scheme + "' among " + fetchers.keySet() + ": " + uri);
        throw new RemoteResolutionException(uri, RemoteResolutionException.Reason.POLICY_DENIED,
            "No RemoteFetcher registered for scheme: " + scheme);
      }
      return target.fetch(uri, policy);
    }
  }

  /// Compile with format assertion taken from `jsonschema.format.assertion` and remote `$ref`s refused
  /// @throws IllegalArgumentException if the document is not a valid schema
  static JsonSchema compile(JsonNode schemaJson) {
    return compile(IN_MEMORY_ROOT, Objects.requireNonNull(schemaJson, "schemaJson"),
        JsonSchemaOptions.fromSystemProperties(), CompileOptions.DEFAULT);
  }

  /// @throws IllegalArgumentException if the document is not a valid schema
  static JsonSchema compile(JsonNode schemaJson, JsonSchemaOptions options) {
    return compile(IN_MEMORY_ROOT, Objects.requireNonNull(schemaJson, "schemaJson"),
        Objects.requireNonNull(options, "options"), CompileOptions.DEFAULT);
  }

  /// Compile a document known by `docUri`, the base against which its relative `$ref`s resolve
  /// @throws IllegalArgumentException if a schema is invalid or a local `$ref` points nowhere
  /// @throws RemoteResolutionException if a referenced document cannot be loaded or lacks the referenced fragment
  static JsonSchema compile(URI docUri, JsonNode schemaJson, JsonSchemaOptions options, CompileOptions compileOptions) {
    Objects.requireNonNull(docUri, "docUri");
    Objects.requireNonNull(schemaJson, "schemaJson");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(compileOptions, "compileOptions");
    LOG.fine(() -> "compile doc=" + docUri + " assertFormats=" + options.assertFormats()
        + " fetcher=" + compileOptions.remoteFetcher().getClass().getSimpleName()
        + " schemes=" + compileOptions.fetchPolicy().allowedSchemes());
    return SchemaCompiler.compile(docUri, schemaJson, options, compileOptions);
  }

  /// `uri` with any fragment removed, normalised
  static URI documentUri(URI uri) {
    String text = Objects.requireNonNull(uri, "uri").toString();
    int hash = text.indexOf('#');
    return (hash < 0 ? uri : URI.create(text.substring(0, hash))).normalize();
  }

  /// Check `json` against this schema, collecting every failure
  default ValidationResult validate(JsonNode json) {
    List<ValidationError> errors = Traversal.root(this, Objects.requireNonNull(json, "json"));
    return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
  }

  /// Check only the keywords of this node; subschemas to apply are pushed onto `stack`
  ValidationResult validateAt(InstancePath path, JsonNode json, Deque<ValidationFrame> stack);

  record ValidationResult(boolean valid, List<ValidationError> errors) {
    public ValidationResult {
      errors = List.copyOf(errors);
    }

    public static ValidationResult success() {
      return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(List<ValidationError> errors) {
      return new ValidationResult(false, errors);
    }
  }

  /// A single failed assertion: where in the instance, the keyword and a message
  record ValidationError(InstancePath location, Keyword keyword, String message) {
    public ValidationError {
      Objects.requireNonNull(location, "location");
      Objects.requireNonNull(keyword, "keyword");
      Objects.requireNonNull(message, "message");
    }

    /// Display form of [#location()], `a.b[0]`, empty at the root
    public String path() {
      return location.toString();
    }
  }

  record ValidationFrame(InstancePath path, JsonSchema schema, JsonNode json) {
  }

  /// Identity of one visit; schema and node compare by reference
  record ValidationKey(JsonSchema schema, JsonNode json, InstancePath path) {
    @Override
    public boolean equals(Object obj) {
      return obj instanceof ValidationKey
          && ((ValidationKey) obj).schema == schema
          && ((ValidationKey) obj).json == json
          && ((ValidationKey) obj).path.equals(path);
    }

    @Override
    public int hashCode() {
      return Objects.hash(System.identityHashCode(schema), System.identityHashCode(json), path);
    }
  }

  /// A compiled document and the schema at each of its pointers
  record CompiledRoot(URI docUri, JsonSchema schema, Map<String, JsonSchema> pointerIndex) {
  }

  /// A parsed `$ref`: a pointer into the same document or a URI into another one
  sealed interface RefToken permits RefToken.LocalRef, RefToken.RemoteRef {

    /// Fragment as `#/a/b`, or `#` for a document root
    String pointer();

    record LocalRef(String pointer) implements RefToken {
    }

    record RemoteRef(URI baseUri, URI targetUri) implements RefToken {
      @Override
      public String pointer() {
        String fragment = targetUri.getFragment();
        return fragment == null || fragment.isEmpty() ? SCHEMA_POINTER_ROOT : SCHEMA_POINTER_ROOT + fragment;
      }
    }
  }

  /// Looks up `$ref` targets once compilation has finished
  ///
  /// `roots` is shared by every document of one compilation. Both maps are only written
  /// while compiling and are read-only afterwards.
  record ResolverContext(URI docUri, Map<URI, CompiledRoot> roots, Map<String, JsonSchema> localPointerIndex) {

    JsonSchema resolve(RefToken token) {
      if (token instanceof RefToken.LocalRef) {
        return lookup(localPointerIndex, token.pointer(), docUri);
      }
      URI targetDoc = documentUri(((RefToken.RemoteRef) token).targetUri());
      CompiledRoot root = roots.get(targetDoc);
      if (root == null) {
        throw new IllegalStateException("Remote document not loaded: " + targetDoc);
      }
      return lookup(root.pointerIndex(), token.pointer(), targetDoc);
    }

    private static JsonSchema lookup(Map<String, JsonSchema> index, String pointer, URI doc) {
      JsonSchema target = index.get(pointer);
      if (target == null) {
        throw new IllegalStateException("Unresolved $ref: " + pointer + " in " + doc);
      }
      return target;
    }

    // The maps reach schemas that hold this context, so equality is by identity
    @Override
    public boolean equals(Object obj) {
      return this == obj;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(this);
    }

    @Override
    public String toString() {
      return "ResolverContext[" + docUri + ", pointers=" + localPointerIndex.size() + "]";
    }
  }
}
