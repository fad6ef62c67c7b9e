package io.github.sasproject.record;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPairGenerator;

import static org.assertj.core.api.Assertions.assertThat;

class SasRecordCliTest extends SasRecordTestBase {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        return SasRecordCli.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tmp.resolve(name), content, StandardCharsets.UTF_8);
    }

    @Test
    void validFileExitsZero() throws IOException {
        Path file = write("good.json", validRecord().toString());
        assertThat(run("validate", file.toString())).isEqualTo(SasRecordCli.OK);
        assertThat(out()).contains("OK " + file);
        assertThat(err()).isEmpty();
    }

    @Test
    void invalidFileListsEachViolation() throws IOException {
        Path good = write("good.json", validRecord().toString());
        ObjectNode record = fixture("missing-scheme-url.json");
        record.remove("name");
        Path bad = write("bad.json", record.toString());

        assertThat(run("validate", good.toString(), bad.toString())).isEqualTo(SasRecordCli.INVALID);
        assertThat(out().lines())
                .containsExactly(
                        "OK " + good,
                        bad + ": MISSING_REQUIRED_FIELD at name: Missing required property: name",
                        bad + ": FORMAT_VIOLATION at url: " + VALIDATOR.validate(record).violations().get(1).message());
    }

    @Test
    void malformedJsonIsInvalid() throws IOException {
        Path file = write("broken.json", "{\"id\": ");
        assertThat(run("validate", file.toString())).isEqualTo(SasRecordCli.INVALID);
        assertThat(out()).startsWith(file + ": Invalid JSON");
    }

    @Test
    void usageErrorsExitTwo() {
        assertThat(run()).isEqualTo(SasRecordCli.ERROR);
        assertThat(run("check", "x.json")).isEqualTo(SasRecordCli.ERROR);
        assertThat(run("validate")).isEqualTo(SasRecordCli.ERROR);
        assertThat(run("validate", "--verbose", "x.json")).isEqualTo(SasRecordCli.ERROR);
        assertThat(run("validate", "--schema-dir")).isEqualTo(SasRecordCli.ERROR);
        assertThat(err()).contains(SasRecordCli.USAGE).contains("Unknown option: --verbose");
        assertThat(out()).isEmpty();
    }

    @Test
    void unreadableFileExitsTwo() {
        Path missing = tmp.resolve("absent.json");
        assertThat(run("validate", missing.toString())).isEqualTo(SasRecordCli.ERROR);
        assertThat(err()).startsWith("ERROR: cannot read " + missing);
    }

    @Test
    void publicKeyCheckIsOptIn() throws Exception {
        Path placeholder = write("placeholder.json", validRecord().toString());
        assertThat(run("validate", placeholder.toString())).isEqualTo(SasRecordCli.OK);
        assertThat(run("validate", "--check-public-key", placeholder.toString())).isEqualTo(SasRecordCli.INVALID);
        assertThat(out()).contains(placeholder + ": publicKey: ");

        ObjectNode record = validRecord();
        record.put("publicKey", X509PublicKeys.toPem(KeyPairGenerator.getInstance("Ed25519").generateKeyPair().getPublic()));
        Path real = write("real.json", record.toString());
        assertThat(run("validate", "--check-public-key", real.toString())).isEqualTo(SasRecordCli.OK);
    }

    @Test
    void schemaDirSuppliesTheSubSchemas() throws IOException {
        Path schemas = Files.createDirectory(tmp.resolve("schemas"));
        Files.writeString(schemas.resolve(SasRecordSchema.CONTACT_INFORMATION_SCHEMA),
                SasRecordSchema.bundledDocument(SasRecordSchema.CONTACT_INFORMATION_SCHEMA).toString());
        Files.writeString(schemas.resolve(SasRecordSchema.FCC_INFORMATION_SCHEMA), "{\"type\":\"object\"}");

        ObjectNode record = validRecord();
        ((ObjectNode) record.get("fccInformation")).put("fccRegistrationNumber", "not ten digits");
        Path file = write("record.json", record.toString());

        assertThat(run("validate", file.toString())).isEqualTo(SasRecordCli.INVALID);
        assertThat(run("validate", "--schema-dir", schemas.toString(), file.toString())).isEqualTo(SasRecordCli.OK);
    }

    @Test
    void schemaDirProblemsExitTwo() throws IOException {
        Path file = write("good.json", validRecord().toString());
        assertThat(run("validate", "--schema-dir", tmp.resolve("nowhere").toString(), file.toString()))
                .isEqualTo(SasRecordCli.ERROR);

        Path empty = Files.createDirectory(tmp.resolve("empty"));
        assertThat(run("validate", "--schema-dir", empty.toString(), file.toString())).isEqualTo(SasRecordCli.ERROR);
        assertThat(err()).contains("ERROR: cannot load schema");
    }
}
