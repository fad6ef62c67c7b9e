package io.github.sasproject.json.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/// Local `$ref` resolution inside one draft-04 document
class JsonSchemaRefLocalTest extends JsonSchemaTestBase {

    @Test
    void refToDefinitions() {
        var s = schema("""
                {
                    "definitions": { "posInt": { "type": "integer", "minimum": 1 } },
                    "type": "array",
                    "items": { "$ref": "#/definitions/posInt" }
                }
                """);
        assertThat(s.validate(json("[1,2,3]")).valid()).isTrue();
        assertThat(s.validate(json("[1,0]")).errors())
                .extracting(JsonSchema.ValidationError::path, JsonSchema.ValidationError::keyword)
                .containsExactly(tuple("[1]", Keyword.MINIMUM));
    }

    @Test
    void refToAnotherProperty() {
        var s = schema("""
                {
                    "type": "object",
                    "properties": {
                        "user": { "type": "object", "properties": { "id": { "type": "string", "minLength": 2 } } },
                        "refUser": { "$ref": "#/properties/user" }
                    }
                }
                """);
        assertThat(s.validate(json("{\"refUser\":{\"id\":\"aa\"}}")).valid()).isTrue();
        assertThat(s.validate(json("{\"refUser\":{\"id\":\"a\"}}")).errors())
                .extracting(JsonSchema.ValidationError::path)
                .containsExactly("refUser.id");
    }

    @Test
    void recursiveTreeThroughRootRef() {
        var s = schema("""
                {
                    "type": "object",
                    "properties": {
                        "value": { "type": "integer" },
                        "children": { "type": "array", "items": { "$ref": "#" } }
                    }
                }
                """);
        assertThat(s.validate(json("""
                {"value":1,"children":[{"value":2,"children":[{"value":3}]}]}
                """)).valid()).isTrue();
        assertThat(s.validate(json("""
                {"value":1,"children":[{"value":2,"children":[{"value":"three"}]}]}
                """)).errors())
                .extracting(JsonSchema.ValidationError::path)
                .containsExactly("children[0].children[0].value");
    }

    @Test
    void selfReferenceThroughAllOfTerminates() {
        var s = schema("""
                { "allOf": [ { "$ref": "#" } ] }
                """);
        assertThat(s.validate(json("42")).valid()).isTrue();
    }

    @Test
    void mutuallyRecursiveDefinitions() {
        var s = schema("""
                {
                    "definitions": {
                        "a": { "type": "object", "properties": { "b": { "$ref": "#/definitions/b" } } },
                        "b": { "type": "object", "properties": { "a": { "$ref": "#/definitions/a" } } }
                    },
                    "$ref": "#/definitions/a"
                }
                """);
        assertThat(s.validate(json("{\"b\":{\"a\":{\"b\":{}}}}")).valid()).isTrue();
        assertThat(s.validate(json("{\"b\":{\"a\":{\"b\":7}}}")).errors())
                .extracting(JsonSchema.ValidationError::path)
                .containsExactly("b.a.b");
    }

    @Test
    void refSiblingsAreIgnored() {
        var s = schema("""
                {
                    "definitions": { "s": { "type": "string" } },
                    "properties": { "a": { "$ref": "#/definitions/s", "minLength": 10 } }
                }
                """);
        assertThat(s.validate(json("{\"a\":\"x\"}")).valid()).isTrue();
    }

    @Test
    void escapedAndPercentEncodedPointers() {
        var s = schema("""
                {
                    "definitions": {
                        "a/b": { "type": "integer" },
                        "with space": { "type": "string" },
                        "tilde~name": { "type": "boolean" }
                    },
                    "properties": {
                        "slash": { "$ref": "#/definitions/a~1b" },
                        "space": { "$ref": "#/definitions/with%20space" },
                        "tilde": { "$ref": "#/definitions/tilde~0name" }
                    }
                }
                """);
        assertThat(s.validate(json("{\"slash\":1,\"space\":\"s\",\"tilde\":true}")).valid()).isTrue();
        assertThat(s.validate(json("{\"slash\":\"1\",\"space\":1,\"tilde\":0}")).errors())
                .extracting(JsonSchema.ValidationError::path)
                .containsExactlyInAnyOrder("slash", "space", "tilde");
    }

    @Test
    void refIntoANonDefinitionsLocation() {
        var s = schema("""
                {
                    "type": "object",
                    "properties": { "x": { "type": "array", "items": [ { "type": "string" } ] } },
                    "additionalProperties": { "$ref": "#/properties/x/items/0" }
                }
                """);
        assertThat(s.validate(json("{\"other\":\"s\"}")).valid()).isTrue();
        assertThat(s.validate(json("{\"other\":1}")).valid()).isFalse();
    }

    @Test
    void unresolvedLocalRefFailsCompilation() {
        assertThatThrownBy(() -> schema("""
                { "properties": { "a": { "$ref": "#/definitions/missing" } } }
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unresolved $ref: #/definitions/missing");
    }

    @Test
    void nonStringRefFailsCompilation() {
        assertThatThrownBy(() -> schema("{\"$ref\": 5}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid $ref");
    }
}
