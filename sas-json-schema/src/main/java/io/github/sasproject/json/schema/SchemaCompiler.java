package io.github.sasproject.json.schema;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.sasproject.json.schema.JsonSchema.LOG;

/// Internal schema compiler
///
/// Documents are compiled from a LIFO work stack, each at most once. Fragments of
/// other documents are compiled on demand once every queued document is loaded.
public final class SchemaCompiler {

  private static final Set<String> OBJECT_KEYWORDS = Set.of(
      "properties", "required", "additionalProperties", "patternProperties", "minProperties", "maxProperties");
  private static final Set<String> ARRAY_KEYWORDS = Set.of(
      "items", "additionalItems", "minItems", "maxItems", "uniqueItems");
  private static final Set<String> STRING_KEYWORDS = Set.of(
      "minLength", "maxLength", "pattern", "format");
  private static final Set<String> NUMBER_KEYWORDS = Set.of(
      "minimum", "maximum", "multipleOf", "exclusiveMinimum", "exclusiveMaximum");

  private SchemaCompiler() {
  }

  /// Per-compilation session state (no static mutable fields).
  private static final class Session {
    final JsonSchema.JsonSchemaOptions options;
    final JsonSchema.CompileOptions compileOptions;
    final Map<URI, JsonSchema.CompiledRoot> roots = new ConcurrentHashMap<>();
    final Map<URI, DocumentContext> documents = new LinkedHashMap<>();
    final List<JsonSchema.RefToken.RemoteRef> remoteRefs = new ArrayList<>();
    final Deque<URI> workStack = new ArrayDeque<>();
    final Set<URI> seenUris = new HashSet<>();
    long totalFetchedBytes;
    int fetchedDocs;

    Session(JsonSchema.JsonSchemaOptions options, JsonSchema.CompileOptions compileOptions) {
      this.options = options;
      this.compileOptions = compileOptions;
    }
  }

  /// One loaded document with its pointer index and the local pointers still to compile
  private static final class DocumentContext {
    final URI docUri;
    final JsonNode document;
    final Map<String, JsonSchema> pointerIndex = new ConcurrentHashMap<>();
    final JsonSchema.ResolverContext resolver;
    final Deque<String> pendingPointers = new ArrayDeque<>();

    DocumentContext(URI docUri, JsonNode document, Map<URI, JsonSchema.CompiledRoot> roots) {
      this.docUri = docUri;
      this.document = document;
      this.resolver = new JsonSchema.ResolverContext(docUri, roots, pointerIndex);
    }
  }

  static JsonSchema compile(URI entryUri,
                            JsonNode entryJson,
                            JsonSchema.JsonSchemaOptions options,
                            JsonSchema.CompileOptions compileOptions) {
    Session session = new Session(options, compileOptions);
    URI entry = JsonSchema.documentUri(entryUri);
    session.seenUris.add(entry);
    session.workStack.push(entry);

    int verified = 0;
    while (!session.workStack.isEmpty() || verified < session.remoteRefs.size()) {
      if (!session.workStack.isEmpty()) {
        URI docUri = session.workStack.pop();
        JsonNode document = docUri.equals(entry) ? entryJson : fetch(session, docUri);
        compileDocument(session, docUri, document);
      } else {
        resolveRemoteFragment(session, session.remoteRefs.get(verified++));
      }
    }

    StructuredLog.fine(LOG, "compile.done", "entry", entry,
        "documents", session.roots.size(), "remoteRefs", session.remoteRefs.size(),
        "fetchedBytes", session.totalFetchedBytes);
    return session.roots.get(entry).schema();
  }

  private static void compileDocument(Session session, URI docUri, JsonNode document) {
    LOG.finer(() -> "compileDocument: " + docUri);
    DocumentContext ctx = new DocumentContext(docUri, document, session.roots);
    session.documents.put(docUri, ctx);
    JsonSchema root = compileNode(session, ctx, document, JsonSchema.SCHEMA_POINTER_ROOT);
    drainPendingPointers(session, ctx);
    session.roots.put(docUri, new JsonSchema.CompiledRoot(docUri, root, ctx.pointerIndex));
    StructuredLog.fine(LOG, "compile.document", "doc", docUri, "pointers", ctx.pointerIndex.size());
  }

  private static void resolveRemoteFragment(Session session, JsonSchema.RefToken.RemoteRef ref) {
    URI docUri = JsonSchema.documentUri(ref.targetUri());
    DocumentContext ctx = session.documents.get(docUri);
    if (ctx == null) {
      throw new IllegalStateException("Remote document was never loaded: " + docUri);
    }
    String pointer = ref.pointer();
    if (ctx.pointerIndex.containsKey(pointer)) {
      return;
    }
    JsonNode target = navigate(ctx.document, pointer);
    if (target == null) {
      LOG.severe(() -> "ERROR: POINTER: " + pointer + " missing in " + docUri + " referenced from " + ref.baseUri());
      throw new RemoteResolutionException(ref.targetUri(), RemoteResolutionException.Reason.POINTER_MISSING,
          "Pointer " + pointer + " not found in " + docUri);
    }
    compileNode(session, ctx, target, pointer);
    drainPendingPointers(session, ctx);
  }

  private static void drainPendingPointers(Session session, DocumentContext ctx) {
    while (!ctx.pendingPointers.isEmpty()) {
      String pointer = ctx.pendingPointers.pop();
      if (ctx.pointerIndex.containsKey(pointer)) {
        continue;
      }
      JsonNode target = navigate(ctx.document, pointer);
      if (target == null) {
        LOG.severe(() -> "ERROR: SCHEMA: unresolved $ref " + pointer + " in " + ctx.docUri);
        throw new IllegalArgumentException("Unresolved $ref: " + pointer);
      }
      compileNode(session, ctx, target, pointer);
    }
  }

  /// Load a referenced document, enforcing the fetch policy around the fetcher call
  private static JsonNode fetch(Session session, URI docUri) {
    FetchPolicy policy = session.compileOptions.fetchPolicy();
    String scheme = docUri.getScheme();
    LOG.fine(() -> "fetch: docUri=" + docUri + ", scheme=" + scheme + ", allowedSchemes=" + policy.allowedSchemes());
    if (scheme == null || !policy.allowedSchemes().contains(scheme.toLowerCase(Locale.ROOT))) {
      LOG.severe(() -> "ERROR: FETCH: " + docUri + " - scheme not allowed");
      throw new RemoteResolutionException(docUri, RemoteResolutionException.Reason.POLICY_DENIED,
          "Scheme not allowed by policy: " + scheme);
    }
    if (session.fetchedDocs + 1 > policy.maxDocuments()) {
      throw new RemoteResolutionException(docUri, RemoteResolutionException.Reason.POLICY_DENIED,
          "Maximum document count exceeded for " + docUri);
    }

    JsonSchema.RemoteFetcher.FetchResult result = session.compileOptions.remoteFetcher().fetch(docUri, policy);

    if (result.byteSize() > policy.maxDocumentBytes()) {
      throw new RemoteResolutionException(docUri, RemoteResolutionException.Reason.PAYLOAD_TOO_LARGE,
          "Remote document exceeds max allowed bytes at " + docUri + ": " + result.byteSize());
    }
    if (result.elapsed().isPresent() && result.elapsed().get().compareTo(policy.timeout()) > 0) {
      throw new RemoteResolutionException(docUri, RemoteResolutionException.Reason.TIMEOUT,
          "Remote fetch exceeded timeout at " + docUri + ": " + result.elapsed().get());
    }

    session.fetchedDocs++;
    session.totalFetchedBytes += result.byteSize();
    if (session.totalFetchedBytes > policy.maxTotalBytes()) {
      throw new RemoteResolutionException(docUri, RemoteResolutionException.Reason.POLICY_DENIED,
          "Total fetched bytes exceeded policy across documents at " + docUri + ": " + session.totalFetchedBytes);
    }
    StructuredLog.fine(LOG, "fetch.done", "doc", docUri, "bytes", result.byteSize(), "docs", session.fetchedDocs);
    return result.document();
  }

  /// Compile the schema at `pointer`, reusing the compiled instance when the pointer was seen before
  private static JsonSchema compileNode(Session session, DocumentContext ctx, JsonNode node, String pointer) {
    JsonSchema existing = ctx.pointerIndex.get(pointer);
    if (existing != null) {
      return existing;
    }
    LOG.finest(() -> "compileNode: " + ctx.docUri + pointer);
    JsonSchema compiled = compileFresh(session, ctx, node, pointer);
    JsonSchema raced = ctx.pointerIndex.putIfAbsent(pointer, compiled);
    return raced != null ? raced : compiled;
  }

  private static JsonSchema compileFresh(Session session, DocumentContext ctx, JsonNode node, String pointer) {
    if (node.isBoolean()) {
      return node.booleanValue() ? AnySchema.INSTANCE : new NotSchema(AnySchema.INSTANCE);
    }
    if (!(node instanceof ObjectNode)) {
      throw new IllegalArgumentException("Schema must be an object at " + pointer + " but was " + node.getNodeType());
    }
    ObjectNode obj = (ObjectNode) node;

    // Definitions are reachable by pointer even when nothing else refers to them
    JsonNode definitions = obj.get("definitions");
    if (definitions instanceof ObjectNode) {
      Iterator<Map.Entry<String, JsonNode>> defs = definitions.fields();
      while (defs.hasNext()) {
        Map.Entry<String, JsonNode> def = defs.next();
        compileNode(session, ctx, def.getValue(), child(pointer, "definitions", def.getKey()));
      }
    }

    JsonNode ref = obj.get("$ref");
    if (ref != null) {
      if (!ref.isTextual() || ref.textValue().isEmpty()) {
        throw new IllegalArgumentException("Invalid $ref at " + pointer + ": " + ref);
      }
      return new RefSchema(classifyRef(session, ctx, ref.textValue()), ctx.resolver);
    }

    List<JsonSchema> parts = new ArrayList<>();

    JsonNode type = obj.get("type");
    if (type != null && type.isTextual()) {
      parts.add(compileTyped(session, ctx, obj, pointer, type.textValue(), true));
    } else if (type instanceof ArrayNode) {
      List<JsonSchema> alternatives = new ArrayList<>();
      for (JsonNode t : type) {
        if (!t.isTextual()) {
          throw new IllegalArgumentException("type array must contain strings at " + pointer);
        }
        alternatives.add(compileTyped(session, ctx, obj, pointer, t.textValue(), true));
      }
      if (alternatives.isEmpty()) {
        throw new IllegalArgumentException("type array must not be empty at " + pointer);
      }
      parts.add(alternatives.size() == 1 ? alternatives.get(0) : new AnyOfSchema(alternatives));
    } else if (type != null) {
      throw new IllegalArgumentException("type must be a string or array at " + pointer);
    } else {
      // No type: each keyword group applies only to instances of its own type
      if (hasAny(obj, OBJECT_KEYWORDS)) {
        parts.add(compileObject(session, ctx, obj, pointer, false));
      }
      if (hasAny(obj, ARRAY_KEYWORDS)) {
        parts.add(compileArray(session, ctx, obj, pointer, false));
      }
      if (hasAny(obj, STRING_KEYWORDS)) {
        parts.add(compileString(session, obj, pointer, false));
      }
      if (hasAny(obj, NUMBER_KEYWORDS)) {
        parts.add(compileNumber(obj, pointer, false, false));
      }
    }

    JsonNode enumValue = obj.get("enum");
    if (enumValue != null) {
      if (!(enumValue instanceof ArrayNode) || enumValue.isEmpty()) {
        throw new IllegalArgumentException("enum must be a non-empty array at " + pointer);
      }
      List<JsonNode> allowed = new ArrayList<>();
      enumValue.forEach(allowed::add);
      parts.add(new EnumSchema(allowed));
    }

    List<JsonSchema> allOf = compileList(session, ctx, obj, pointer, "allOf");
    if (allOf != null) {
      parts.addAll(allOf);
    }
    List<JsonSchema> anyOf = compileList(session, ctx, obj, pointer, "anyOf");
    if (anyOf != null) {
      parts.add(new AnyOfSchema(anyOf));
    }
    List<JsonSchema> oneOf = compileList(session, ctx, obj, pointer, "oneOf");
    if (oneOf != null) {
      parts.add(new OneOfSchema(oneOf));
    }
    JsonNode not = obj.get("not");
    if (not != null) {
      parts.add(new NotSchema(compileNode(session, ctx, not, child(pointer, "not"))));
    }

    if (parts.isEmpty()) {
      return AnySchema.INSTANCE;
    }
    return parts.size() == 1 ? parts.get(0) : new AllOfSchema(parts);
  }

  /// Classify a `$ref` value as a pointer into the current document or a reference to another document
  private static JsonSchema.RefToken classifyRef(Session session, DocumentContext ctx, String ref) {
    LOG.fine(() -> "ref.classify ref=" + ref + " base=" + ctx.docUri);
    if (ref.startsWith(JsonSchema.SCHEMA_POINTER_ROOT)) {
      String pointer = fragmentPointer(ref);
      ctx.pendingPointers.push(pointer);
      return new JsonSchema.RefToken.LocalRef(pointer);
    }

    final URI resolved;
    try {
      resolved = ctx.docUri.resolve(new URI(ref));
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid $ref URI: " + ref, e);
    }
    URI targetDoc = JsonSchema.documentUri(resolved);
    if (targetDoc.equals(ctx.docUri)) {
      String pointer = resolved.getFragment() == null
          ? JsonSchema.SCHEMA_POINTER_ROOT
          : JsonSchema.SCHEMA_POINTER_ROOT + resolved.getFragment();
      ctx.pendingPointers.push(pointer);
      return new JsonSchema.RefToken.LocalRef(pointer);
    }

    JsonSchema.RefToken.RemoteRef remote = new JsonSchema.RefToken.RemoteRef(ctx.docUri, resolved);
    session.remoteRefs.add(remote);
    if (session.seenUris.add(targetDoc)) {
      session.workStack.push(targetDoc);
      LOG.finer(() -> "ref.classified kind=remote doc=" + targetDoc + " queued");
    }
    return remote;
  }

  private static JsonSchema compileTyped(Session session, DocumentContext ctx, ObjectNode obj, String pointer,
                                         String type, boolean assertType) {
    switch (type) {
      case "object":
        return compileObject(session, ctx, obj, pointer, assertType);
      case "array":
        return compileArray(session, ctx, obj, pointer, assertType);
      case "string":
        return compileString(session, obj, pointer, assertType);
      case "number":
        return compileNumber(obj, pointer, false, assertType);
      case "integer":
        return compileNumber(obj, pointer, true, assertType);
      case "boolean":
        return new BooleanSchema();
      case "null":
        return new NullSchema();
      default:
        throw new IllegalArgumentException("Unknown type '" + type + "' at " + pointer);
    }
  }

  private static JsonSchema compileObject(Session session, DocumentContext ctx, ObjectNode obj, String pointer,
                                          boolean assertType) {
    Map<String, JsonSchema> properties = new LinkedHashMap<>();
    JsonNode propsValue = obj.get("properties");
    if (propsValue instanceof ObjectNode) {
      Iterator<Map.Entry<String, JsonNode>> props = propsValue.fields();
      while (props.hasNext()) {
        Map.Entry<String, JsonNode> entry = props.next();
        properties.put(entry.getKey(),
            compileNode(session, ctx, entry.getValue(), child(pointer, "properties", entry.getKey())));
      }
    }

    Set<String> required = new LinkedHashSet<>();
    JsonNode reqValue = obj.get("required");
    if (reqValue instanceof ArrayNode) {
      for (JsonNode item : reqValue) {
        if (!item.isTextual()) {
          throw new IllegalArgumentException("required must contain strings at " + pointer);
        }
        required.add(item.textValue());
      }
    } else if (reqValue != null) {
      throw new IllegalArgumentException("required must be an array at " + pointer);
    }

    JsonSchema additionalProperties = null;
    boolean additionalAllowed = true;
    JsonNode addPropsValue = obj.get("additionalProperties");
    if (addPropsValue != null && addPropsValue.isBoolean()) {
      additionalAllowed = addPropsValue.booleanValue();
    } else if (addPropsValue instanceof ObjectNode) {
      additionalProperties = compileNode(session, ctx, addPropsValue, child(pointer, "additionalProperties"));
    }

    Map<Pattern, JsonSchema> patternProperties = new LinkedHashMap<>();
    JsonNode patternPropsValue = obj.get("patternProperties");
    if (patternPropsValue instanceof ObjectNode) {
      Iterator<Map.Entry<String, JsonNode>> patterns = patternPropsValue.fields();
      while (patterns.hasNext()) {
        Map.Entry<String, JsonNode> entry = patterns.next();
        patternProperties.put(compilePattern(entry.getKey(), pointer),
            compileNode(session, ctx, entry.getValue(), child(pointer, "patternProperties", entry.getKey())));
      }
    }

    return new ObjectSchema(properties, required, additionalProperties, additionalAllowed,
        getInteger(obj, "minProperties", pointer), getInteger(obj, "maxProperties", pointer),
        patternProperties, assertType);
  }

  private static JsonSchema compileArray(Session session, DocumentContext ctx, ObjectNode obj, String pointer,
                                         boolean assertType) {
    JsonSchema items = null;
    List<JsonSchema> tupleItems = null;
    JsonNode itemsValue = obj.get("items");
    if (itemsValue instanceof ArrayNode) {
      tupleItems = new ArrayList<>();
      for (int i = 0; i < itemsValue.size(); i++) {
        tupleItems.add(compileNode(session, ctx, itemsValue.get(i), child(pointer, "items", String.valueOf(i))));
      }
    } else if (itemsValue != null) {
      items = compileNode(session, ctx, itemsValue, child(pointer, "items"));
    }

    JsonSchema additionalItems = null;
    boolean additionalAllowed = true;
    JsonNode addItemsValue = obj.get("additionalItems");
    if (addItemsValue != null && addItemsValue.isBoolean()) {
      additionalAllowed = addItemsValue.booleanValue();
    } else if (addItemsValue instanceof ObjectNode) {
      additionalItems = compileNode(session, ctx, addItemsValue, child(pointer, "additionalItems"));
    }

    JsonNode unique = obj.get("uniqueItems");
    return new ArraySchema(items, tupleItems, additionalItems, additionalAllowed,
        getInteger(obj, "minItems", pointer), getInteger(obj, "maxItems", pointer),
        unique != null && unique.booleanValue(), assertType);
  }

  private static JsonSchema compileString(Session session, ObjectNode obj, String pointer, boolean assertType) {
    Pattern pattern = null;
    JsonNode patternValue = obj.get("pattern");
    if (patternValue != null && patternValue.isTextual()) {
      pattern = compilePattern(patternValue.textValue(), pointer);
    }

    FormatValidator formatValidator = null;
    JsonNode formatValue = obj.get("format");
    if (formatValue != null && formatValue.isTextual()) {
      String formatName = formatValue.textValue();
      formatValidator = Format.byName(formatName);
      if (formatValidator == null) {
        LOG.fine(() -> "Unknown format: " + formatName + " at " + pointer);
      }
    }

    return new StringSchema(getInteger(obj, "minLength", pointer), getInteger(obj, "maxLength", pointer),
        pattern, formatValidator, session.options.assertFormats(), assertType);
  }

  private static JsonSchema compileNumber(ObjectNode obj, String pointer, boolean integer, boolean assertType) {
    BigDecimal multipleOf = getBigDecimal(obj, "multipleOf");
    if (multipleOf != null && multipleOf.signum() <= 0) {
      throw new IllegalArgumentException("multipleOf must be greater than 0 at " + pointer);
    }
    return new NumberSchema(getBigDecimal(obj, "minimum"), getBigDecimal(obj, "maximum"), multipleOf,
        getBoolean(obj, "exclusiveMinimum"), getBoolean(obj, "exclusiveMaximum"), integer, assertType);
  }

  private static List<JsonSchema> compileList(Session session, DocumentContext ctx, ObjectNode obj, String pointer,
                                              String keyword) {
    JsonNode value = obj.get(keyword);
    if (value == null) {
      return null;
    }
    if (!(value instanceof ArrayNode) || value.isEmpty()) {
      throw new IllegalArgumentException(keyword + " must be a non-empty array at " + pointer);
    }
    List<JsonSchema> schemas = new ArrayList<>();
    for (int i = 0; i < value.size(); i++) {
      schemas.add(compileNode(session, ctx, value.get(i), child(pointer, keyword, String.valueOf(i))));
    }
    return schemas;
  }

  /// Navigate a `#/a/b` pointer within a document; null when absent
  static JsonNode navigate(JsonNode document, String pointer) {
    if (pointer.isEmpty() || pointer.equals(JsonSchema.SCHEMA_POINTER_ROOT)) {
      return document;
    }
    String path = pointer.startsWith(JsonSchema.SCHEMA_POINTER_ROOT) ? pointer.substring(1) : pointer;
    try {
      JsonNode target = document.at(JsonPointer.compile(path));
      return target.isMissingNode() ? null : target;
    } catch (IllegalArgumentException e) {
      LOG.fine(() -> "pointer.invalid pointer=" + pointer + " reason=" + e.getMessage());
      return null;
    }
  }

  /// Decode the fragment of a local ref so it matches the pointer index keys
  private static String fragmentPointer(String ref) {
    try {
      String fragment = new URI(ref).getFragment();
      return fragment == null ? JsonSchema.SCHEMA_POINTER_ROOT : JsonSchema.SCHEMA_POINTER_ROOT + fragment;
    } catch (URISyntaxException e) {
      return ref;
    }
  }

  private static String child(String pointer, String... segments) {
    StringBuilder sb = new StringBuilder(pointer);
    for (String segment : segments) {
      sb.append('/').append(segment.replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }

  private static boolean hasAny(ObjectNode obj, Set<String> keywords) {
    for (String keyword : keywords) {
      if (obj.has(keyword)) {
        return true;
      }
    }
    return false;
  }

  private static Pattern compilePattern(String regex, String pointer) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid pattern '" + regex + "' at " + pointer, e);
    }
  }

  private static Integer getInteger(ObjectNode obj, String key, String pointer) {
    JsonNode value = obj.get(key);
    if (value == null) {
      return null;
    }
    if (!value.isIntegralNumber() || value.intValue() < 0) {
      throw new IllegalArgumentException(key + " must be a non-negative integer at " + pointer);
    }
    return value.intValue();
  }

  private static boolean getBoolean(ObjectNode obj, String key) {
    JsonNode value = obj.get(key);
    return value != null && value.isBoolean() && value.booleanValue();
  }

  private static BigDecimal getBigDecimal(ObjectNode obj, String key) {
    JsonNode value = obj.get(key);
    return value != null && value.isNumber() ? value.decimalValue() : null;
  }
}
