package io.github.sasproject.record;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.sasproject.json.schema.ClasspathFetcher;
import io.github.sasproject.json.schema.FetchPolicy;
import io.github.sasproject.json.schema.InMemoryFetcher;
import io.github.sasproject.json.schema.JsonSchema;
import io.github.sasproject.json.schema.SchemaJson;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.github.sasproject.record.RecordLogging.LOG;

/// The compiled SAS implementation record schema together with its two sub-schemas
///
/// Instances are immutable and safe to share between threads. The bundled instance is
/// built on first use and lives for the life of the class loader.
///
/// ```java
/// SasRecordSchema schema = SasRecordSchema.builder()
///     .fccInformationDocument(myFccSchema)
///     .build();
/// ```
public final class SasRecordSchema {
  public static final String RECORD_SCHEMA = "SasImplementationRecord.schema.json";
  public static final String CONTACT_INFORMATION_SCHEMA = "ContactInformation.schema.json";
  public static final String FCC_INFORMATION_SCHEMA = "FccInformation.schema.json";

  /// Classpath directory holding the bundled schema documents
  public static final String RESOURCE_ROOT = "schema";

  /// Document URI of the record schema; sibling `file:` references resolve against it
  public static final URI RECORD_URI = URI.create("file:" + RECORD_SCHEMA);
  public static final URI CONTACT_INFORMATION_URI = URI.create("file:" + CONTACT_INFORMATION_SCHEMA);
  public static final URI FCC_INFORMATION_URI = URI.create("file:" + FCC_INFORMATION_SCHEMA);

  private final JsonNode document;
  private final JsonSchema schema;

  private SasRecordSchema(JsonNode document, JsonSchema schema) {
    this.document = document;
    this.schema = schema;
  }

  private static final class Bundled {
    static final SasRecordSchema INSTANCE = builder().build();
  }

  /// The schema assembled from the documents shipped in this jar
  public static SasRecordSchema bundled() {
    return Bundled.INSTANCE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /// A copy of the raw record schema document
  public JsonNode document() {
    return document.deepCopy();
  }

  /// The compiled record schema; validation is thread-safe
  public JsonSchema schema() {
    return schema;
  }

  /// Read one of the bundled schema documents by file name
  public static JsonNode bundledDocument(String fileName) {
    Objects.requireNonNull(fileName, "fileName");
    String resource = RESOURCE_ROOT + "/" + fileName;
    try (InputStream in = SasRecordSchema.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        LOG.severe(() -> "ERROR: bundled schema missing from classpath: " + resource);
        throw new IllegalStateException("Bundled schema not found: " + resource);
      }
      return SchemaJson.parse(in.readAllBytes());
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read bundled schema " + resource, e);
    }
  }

  /// Assembles a [SasRecordSchema]; any document not supplied falls back to the bundled one
  public static final class Builder {
    private JsonNode recordDocument;
    private JsonNode contactInformationDocument;
    private JsonNode fccInformationDocument;
    private JsonSchema.RemoteFetcher subSchemaFetcher;

    private Builder() {}

    public Builder recordDocument(JsonNode document) {
      this.recordDocument = Objects.requireNonNull(document, "document");
      return this;
    }

    public Builder contactInformationDocument(JsonNode document) {
      this.contactInformationDocument = Objects.requireNonNull(document, "document");
      return this;
    }

    public Builder fccInformationDocument(JsonNode document) {
      this.fccInformationDocument = Objects.requireNonNull(document, "document");
      return this;
    }

    /// Resolve every `file:` reference through this fetcher instead of the bundled documents
    public Builder subSchemaFetcher(JsonSchema.RemoteFetcher fetcher) {
      this.subSchemaFetcher = Objects.requireNonNull(fetcher, "fetcher");
      return this;
    }

    /// Compile the schema tree
    /// @throws IllegalArgumentException if a document is not a valid schema
    /// @throws io.github.sasproject.json.schema.RemoteResolutionException if a sub-schema cannot be resolved
    public SasRecordSchema build() {
      if (subSchemaFetcher != null && (contactInformationDocument != null || fccInformationDocument != null)) {
        throw new IllegalStateException("Supply either sub-schema documents or a sub-schema fetcher, not both");
      }
      JsonNode record = recordDocument != null ? recordDocument.deepCopy() : bundledDocument(RECORD_SCHEMA);
      JsonSchema.RemoteFetcher fetcher = resolveFetcher();

      JsonSchema.CompileOptions options = JsonSchema.CompileOptions.remoteDefaults(fetcher)
          .withFetchPolicy(FetchPolicy.defaults().withAllowedSchemes(Set.of("file")));
      JsonSchema compiled = JsonSchema.compile(RECORD_URI, record, JsonSchema.JsonSchemaOptions.ASSERT_FORMATS, options);
      LOG.info(() -> "SasRecordSchema built fetcher=" + fetcher.getClass().getSimpleName()
          + " injectedRecord=" + (recordDocument != null));
      return new SasRecordSchema(record, compiled);
    }

    private JsonSchema.RemoteFetcher resolveFetcher() {
      if (subSchemaFetcher != null) {
        return subSchemaFetcher;
      }
      if (contactInformationDocument == null && fccInformationDocument == null) {
        return new ClasspathFetcher(SasRecordSchema.class.getClassLoader(), RESOURCE_ROOT);
      }
      Map<URI, JsonNode> documents = new LinkedHashMap<>();
      documents.put(CONTACT_INFORMATION_URI, contactInformationDocument != null
          ? contactInformationDocument.deepCopy() : bundledDocument(CONTACT_INFORMATION_SCHEMA));
      documents.put(FCC_INFORMATION_URI, fccInformationDocument != null
          ? fccInformationDocument.deepCopy() : bundledDocument(FCC_INFORMATION_SCHEMA));
      return new InMemoryFetcher("file", documents);
    }
  }
}
