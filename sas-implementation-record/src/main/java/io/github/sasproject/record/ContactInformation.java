package io.github.sasproject.record;

import com.fasterxml.jackson.annotation.JsonInclude;

/// A contactable party, carried as a small vCard
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContactInformation(VCard vcard) {

  public static ContactInformation of(String formattedName, String email) {
    return new ContactInformation(new VCard(formattedName, null, email, null, null));
  }
}
