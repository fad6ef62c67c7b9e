package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.Chars;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/// Generated instances against small closed schemas
class JsonSchemaPropertyTest extends JsonSchemaLoggingConfig {

    static final JsonSchema CLOSED = JsonSchema.compile(SchemaJson.parse("""
            {"type":"object","properties":{"known":{}},"additionalProperties":false}
            """), JsonSchema.JsonSchemaOptions.DEFAULT);

    static final JsonSchema TEN_DIGITS = JsonSchema.compile(SchemaJson.parse("""
            {"type":"string","pattern":"^[0-9]{10}$"}
            """), JsonSchema.JsonSchemaOptions.DEFAULT);

    @Property(tries = 200)
    void everyUnknownMemberIsReportedOnce(
            @ForAll @Size(max = 6) Set<@AlphaChars @Chars({'.', '[', ']', '0', '\''}) @StringLength(max = 8) String> keys) {
        ObjectNode instance = SchemaJson.mapper().createObjectNode();
        keys.forEach(k -> instance.put(k, 1));

        Set<String> expected = keys.stream().filter(k -> !k.equals("known")).collect(Collectors.toSet());
        var result = CLOSED.validate(instance);

        assertThat(result.valid()).isEqualTo(expected.isEmpty());
        assertThat(result.errors())
                .extracting(e -> e.location().rootMember().orElseThrow())
                .containsExactlyInAnyOrderElementsOf(expected);
        assertThat(result.errors())
                .allMatch(e -> e.keyword() == Keyword.ADDITIONAL_PROPERTIES)
                .allMatch(e -> e.location().depth() == 1);
    }

    @Property(tries = 200)
    void anchoredPatternAcceptsExactlyTenDigits(@ForAll @NumericChars @StringLength(max = 14) String digits) {
        var node = SchemaJson.mapper().getNodeFactory().textNode(digits);
        assertThat(TEN_DIGITS.validate(node).valid()).isEqualTo(digits.length() == 10);
    }

    @Property(tries = 100)
    void validationIsRepeatable(@ForAll @Size(max = 4) Set<@AlphaChars @StringLength(min = 1, max = 4) String> keys) {
        ObjectNode instance = SchemaJson.mapper().createObjectNode();
        keys.forEach(k -> instance.put(k, k));
        assertThat(CLOSED.validate(instance)).isEqualTo(CLOSED.validate(instance));
    }
}
