package io.github.sasproject.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// vCard subset: formatted name plus optional organisation, email, telephone and address
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"fn", "org", "email", "tel", "adr"})
public record VCard(String fn, String org, String email, String tel, String adr) {
}
