package io.github.sasproject.json.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class JsonSchemaObjectKeywordsTest extends JsonSchemaTestBase {

    static final String CLOSED = """
            {
                "type": "object",
                "properties": {
                    "a": { "type": "string" },
                    "b": { "type": "integer" }
                },
                "required": ["a", "b"],
                "additionalProperties": false
            }
            """;

    @Test
    void closedObjectAcceptsExactMembers() {
        var result = schema(CLOSED).validate(json("""
                {"a":"x","b":1}
                """));
        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void missingRequiredIsReportedAtTheMemberPath() {
        var result = schema(CLOSED).validate(json("""
                {"a":"x"}
                """));
        assertThat(result.valid()).isFalse();
        assertThat(result.errors())
                .extracting(JsonSchema.ValidationError::path, JsonSchema.ValidationError::keyword, JsonSchema.ValidationError::message)
                .containsExactly(tuple("b", Keyword.REQUIRED, "Missing required property: b"));
    }

    @Test
    void additionalPropertyRejectedWhenClosed() {
        var result = schema(CLOSED).validate(json("""
                {"a":"x","b":1,"c":true}
                """));
        assertThat(result.errors())
                .extracting(JsonSchema.ValidationError::path, JsonSchema.ValidationError::keyword)
                .containsExactly(tuple("c", Keyword.ADDITIONAL_PROPERTIES));
        assertThat(result.errors().get(0).message()).isEqualTo("Additional property not allowed: c");
    }

    @Test
    void everyFailingMemberIsCollected() {
        var result = schema(CLOSED).validate(json("""
                {"a":1,"b":"x","c":null,"d":null}
                """));
        assertThat(result.errors())
                .extracting(JsonSchema.ValidationError::path)
                .containsExactlyInAnyOrder("a", "b", "c", "d");
    }

    @Test
    void nonObjectInstanceFailsTypeAtRoot() {
        var result = schema(CLOSED).validate(json("[]"));
        assertThat(result.errors())
                .extracting(JsonSchema.ValidationError::path, JsonSchema.ValidationError::keyword, JsonSchema.ValidationError::message)
                .containsExactly(tuple("", Keyword.TYPE, "Expected object"));
    }

    @Test
    void additionalPropertiesSchemaAppliesToUnlistedMembers() {
        var s = schema("""
                {"properties":{"id":{"type":"string"}},"additionalProperties":{"type":"number"}}
                """);
        assertThat(s.validate(json("{\"id\":\"a\",\"x\":1.5}")).valid()).isTrue();
        var bad = s.validate(json("{\"id\":\"a\",\"x\":\"s\"}"));
        assertThat(bad.errors())
                .extracting(JsonSchema.ValidationError::path, JsonSchema.ValidationError::keyword)
                .containsExactly(tuple("x", Keyword.TYPE));
        // Object keywords without a type leave other instance types alone
        assertThat(s.validate(json("\"str\"")).valid()).isTrue();
    }

    @Test
    void patternPropertiesTakePrecedenceOverAdditional() {
        var s = schema("""
                {
                    "type": "object",
                    "patternProperties": { "^x-": { "type": "string" } },
                    "additionalProperties": false
                }
                """);
        assertThat(s.validate(json("{\"x-vendor\":\"acme\"}")).valid()).isTrue();
        assertThat(s.validate(json("{\"x-vendor\":7}")).errors())
                .extracting(JsonSchema.ValidationError::keyword)
                .containsExactly(Keyword.TYPE);
        assertThat(s.validate(json("{\"vendor\":\"acme\"}")).errors())
                .extracting(JsonSchema.ValidationError::keyword)
                .containsExactly(Keyword.ADDITIONAL_PROPERTIES);
    }

    @Test
    void propertyCountBounds() {
        var s = schema("""
                {"type":"object","minProperties":1,"maxProperties":2}
                """);
        assertThat(s.validate(json("{}")).errors())
                .extracting(JsonSchema.ValidationError::keyword)
                .containsExactly(Keyword.MIN_PROPERTIES);
        assertThat(s.validate(json("{\"a\":1}")).valid()).isTrue();
        assertThat(s.validate(json("{\"a\":1,\"b\":2,\"c\":3}")).errors())
                .extracting(JsonSchema.ValidationError::keyword)
                .containsExactly(Keyword.MAX_PROPERTIES);
    }

    @Test
    void nestedPathsUseDotNotation() {
        var s = schema("""
                {
                    "type": "object",
                    "properties": {
                        "outer": {
                            "type": "object",
                            "properties": { "inner": { "type": "string" } },
                            "required": ["must"]
                        }
                    }
                }
                """);
        var result = s.validate(json("""
                {"outer":{"inner":5}}
                """));
        assertThat(result.errors())
                .extracting(JsonSchema.ValidationError::path)
                .containsExactlyInAnyOrder("outer.inner", "outer.must");
    }
}
