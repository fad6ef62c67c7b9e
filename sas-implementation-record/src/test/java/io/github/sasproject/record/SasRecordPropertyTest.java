package io.github.sasproject.record;

import com.fasterxml.jackson.databind.node.ObjectNode;
import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/// Generated records and identifiers against the bundled schema
class SasRecordPropertyTest extends SasRecordLoggingConfig {

    static final SasRecordValidator VALIDATOR = SasRecordValidator.bundled();
    static final SasRecordCodec CODEC = new SasRecordCodec(VALIDATOR);

    @Provide
    Arbitrary<String> segments() {
        return Arbitraries.strings().alpha().numeric().withChars('-', '_').ofMinLength(1).ofMaxLength(12);
    }

    @Provide
    Arbitrary<SasImplementationRecord> records() {
        Arbitrary<String> text = Arbitraries.strings().alpha().numeric().withChars(' ', '-', '.').ofMaxLength(30);
        Arbitrary<String> ids = Combinators.combine(segments(), segments(), segments())
                .as((a, b, c) -> a + "/" + b + "/" + c);
        Arbitrary<ContactInformation> contacts = Combinators.combine(
                        Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(20),
                        Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(10).injectNull(0.3))
                .as((fn, user) -> ContactInformation.of(fn, user == null ? null : user + "@sas.example.org"));
        Arbitrary<FccInformation> fcc = Combinators.combine(
                        Arbitraries.strings().numeric().ofLength(10),
                        Arbitraries.strings().alpha().ofMaxLength(12).injectNull(0.5))
                .as((frn, cert) -> new FccInformation(frn, cert, null));
        Arbitrary<String> urls = Arbitraries.strings().withCharRange('a', 'z').ofMinLength(1).ofMaxLength(12)
                .map(host -> "https://" + host + ".example.org/sas");

        return Combinators.combine(ids, text, text, contacts.list().ofMaxSize(3), text, fcc, urls)
                .as(SasImplementationRecord::new);
    }

    @Property(tries = 200)
    void threeSegmentIdsMatch(@ForAll("segments") String a, @ForAll("segments") String b, @ForAll("segments") String c) {
        ObjectNode candidate = (ObjectNode) CODEC.toTree(sampleRecord(a + "/" + b + "/" + c));
        assertThat(VALIDATOR.validate(candidate).valid()).isTrue();
    }

    @Property(tries = 200)
    void idsWithoutSlashesNeverMatch(@ForAll @AlphaChars @NumericChars @StringLength(max = 20) String id) {
        var report = VALIDATOR.validate(sampleRecord(id));
        assertThat(report.violations()).extracting(SchemaViolation::type).containsExactly(ViolationType.PATTERN_VIOLATION);
    }

    @Property(tries = 200)
    void serializedRecordsValidateAndReadBack(@ForAll("records") SasImplementationRecord record) {
        String text = CODEC.toJson(record);
        assertThat(VALIDATOR.validate(text).valid()).isTrue();
        assertThat(CODEC.read(text)).isEqualTo(record);
    }

    /// Member names that read like paths into the declared fields
    @Provide
    Arbitrary<String> memberNames() {
        Arbitrary<String> suffixes = Arbitraries.strings().withCharRange('a', 'z').withChars('.', '[', ']', '0', '\'').ofMaxLength(8);
        return Combinators.combine(Arbitraries.of(SasImplementationRecord.FIELDS).injectNull(0.3), suffixes)
                .as((field, suffix) -> field == null ? suffix : field + suffix);
    }

    @Property(tries = 200)
    void extraMembersAreUnexpected(@ForAll("memberNames") String key) {
        Assume.that(!SasImplementationRecord.FIELDS.contains(key));
        ObjectNode candidate = (ObjectNode) CODEC.toTree(sampleRecord("a/b/c"));
        candidate.put(key, 1);
        var report = VALIDATOR.validate(candidate);
        assertThat(report.violations())
                .extracting(SchemaViolation::field, SchemaViolation::type)
                .containsExactly(tuple(key, ViolationType.UNEXPECTED_FIELD));
    }

    private static SasImplementationRecord sampleRecord(String id) {
        return new SasImplementationRecord(id, "Example SAS", "admin-42",
                List.of(ContactInformation.of("Spectrum Operations", null)),
                "-----BEGIN PUBLIC KEY-----...",
                new FccInformation("0012345678", null, null),
                "https://example.org/sas");
    }
}
