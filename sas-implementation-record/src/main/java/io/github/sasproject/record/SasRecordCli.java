package io.github.sasproject.record;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.sasproject.json.schema.FileFetcher;
import io.github.sasproject.json.schema.RemoteResolutionException;
import io.github.sasproject.json.schema.SchemaJson;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Command line checker for SAS implementation record files.
///
/// Usage:
/// `java -jar sas-implementation-record.jar validate [--schema-dir DIR] [--check-public-key] FILE...`
///
/// Exit status is 0 when every file is valid, 1 when any file is invalid and 2 on usage or IO errors.
public final class SasRecordCli {
  static final int OK = 0;
  static final int INVALID = 1;
  static final int ERROR = 2;

  static final String USAGE =
      "Usage: sas-record validate [--schema-dir DIR] [--check-public-key] FILE...";

  private SasRecordCli() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Objects.requireNonNull(args, "args must not be null");
    if (args.length == 0 || !"validate".equals(args[0])) {
      err.println(USAGE);
      return ERROR;
    }

    Path schemaDir = null;
    boolean checkPublicKey = false;
    List<Path> files = new ArrayList<>();
    for (int i = 1; i < args.length; i++) {
      String arg = args[i];
      if ("--schema-dir".equals(arg)) {
        if (i + 1 >= args.length) {
          err.println("--schema-dir needs a directory");
          err.println(USAGE);
          return ERROR;
        }
        schemaDir = Path.of(args[++i]);
      } else if ("--check-public-key".equals(arg)) {
        checkPublicKey = true;
      } else if (arg.startsWith("--")) {
        err.println("Unknown option: " + arg);
        err.println(USAGE);
        return ERROR;
      } else {
        files.add(Path.of(arg));
      }
    }
    if (files.isEmpty()) {
      err.println(USAGE);
      return ERROR;
    }

    final SasRecordValidator validator;
    try {
      validator = new SasRecordValidator(loadSchema(schemaDir));
    } catch (IllegalArgumentException | RemoteResolutionException e) {
      err.println("ERROR: cannot load schema: " + e.getMessage());
      return ERROR;
    }

    int status = OK;
    for (Path file : files) {
      status = Math.max(status, check(file, validator, checkPublicKey, out, err));
    }
    return status;
  }

  private static SasRecordSchema loadSchema(Path schemaDir) {
    if (schemaDir == null) {
      return SasRecordSchema.bundled();
    }
    if (!Files.isDirectory(schemaDir)) {
      throw new IllegalArgumentException("not a directory: " + schemaDir);
    }
    return SasRecordSchema.builder().subSchemaFetcher(new FileFetcher(schemaDir)).build();
  }

  private static int check(Path file, SasRecordValidator validator, boolean checkPublicKey,
                           PrintStream out, PrintStream err) {
    final byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (IOException e) {
      err.println("ERROR: cannot read " + file + ": " + e.getMessage());
      return ERROR;
    }

    final JsonNode candidate;
    try {
      candidate = SchemaJson.parse(bytes);
    } catch (IllegalArgumentException e) {
      out.println(file + ": " + e.getMessage());
      return INVALID;
    }

    RecordValidationReport report = validator.validate(candidate);
    if (!report.valid()) {
      for (SchemaViolation violation : report.violations()) {
        out.println(file + ": " + violation.describe());
      }
      return INVALID;
    }

    if (checkPublicKey) {
      try {
        X509PublicKeys.parse(candidate.get("publicKey").textValue());
      } catch (InvalidPublicKeyException e) {
        out.println(file + ": publicKey: " + e.getMessage());
        return INVALID;
      }
    }

    out.println("OK " + file);
    return OK;
  }
}
