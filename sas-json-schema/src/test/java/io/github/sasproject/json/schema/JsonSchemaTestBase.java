package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import static io.github.sasproject.json.schema.SchemaLogging.LOG;

/// Base class for all schema tests.
/// - Emits an INFO banner per test.
/// - Short helpers for compiling and parsing inline JSON.
class JsonSchemaTestBase extends JsonSchemaLoggingConfig {

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static JsonNode json(String text) {
        return SchemaJson.parse(text);
    }

    static JsonSchema schema(String text) {
        return JsonSchema.compile(SchemaJson.parse(text), JsonSchema.JsonSchemaOptions.DEFAULT);
    }

    static JsonSchema assertingSchema(String text) {
        return JsonSchema.compile(SchemaJson.parse(text), JsonSchema.JsonSchemaOptions.ASSERT_FORMATS);
    }
}
