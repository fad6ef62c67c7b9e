package io.github.sasproject.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// FCC registration and certification details
///
/// `certificationDate` is RFC 3339 text, kept as a string so the wire form round-trips unchanged.
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"fccRegistrationNumber", "fccCertificationId", "certificationDate"})
public record FccInformation(String fccRegistrationNumber, String fccCertificationId, String certificationDate) {
}
