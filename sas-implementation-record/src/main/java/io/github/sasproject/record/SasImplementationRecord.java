package io.github.sasproject.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/// One SAS deployment as published to peer SASs
///
/// Construction does not validate; pass instances through [SasRecordValidator] before sending them.
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "administratorId", "contactInformation", "publicKey", "fccInformation", "url"})
public record SasImplementationRecord(
    String id,
    String name,
    String administratorId,
    List<ContactInformation> contactInformation,
    String publicKey,
    FccInformation fccInformation,
    String url
) {
  /// Names of the record members in schema order
  public static final List<String> FIELDS =
      List.of("id", "name", "administratorId", "contactInformation", "publicKey", "fccInformation", "url");

  public SasImplementationRecord {
    contactInformation = contactInformation == null ? null : List.copyOf(contactInformation);
  }

  public SasImplementationRecord withId(String newId) {
    return new SasImplementationRecord(newId, name, administratorId, contactInformation, publicKey, fccInformation, url);
  }

  public SasImplementationRecord withUrl(String newUrl) {
    return new SasImplementationRecord(id, name, administratorId, contactInformation, publicKey, fccInformation, newUrl);
  }

  public SasImplementationRecord withPublicKey(String newPublicKey) {
    return new SasImplementationRecord(id, name, administratorId, contactInformation, newPublicKey, fccInformation, url);
  }
}
