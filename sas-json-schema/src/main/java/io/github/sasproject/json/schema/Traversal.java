package io.github.sasproject.json.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.github.sasproject.json.schema.JsonSchema.LOG;

/// Drives one validation over an explicit work stack
///
/// Used for whole documents and for the isolated branches of `anyOf`, `oneOf` and `not`,
/// whose failures must not reach the caller's error list directly.
final class Traversal {
  private final Deque<JsonSchema.ValidationFrame> pending = new ArrayDeque<>();
  private final Set<JsonSchema.ValidationKey> seen = new HashSet<>();
  private final List<JsonSchema.ValidationError> errors = new ArrayList<>();
  private int frames;

  private Traversal() {}

  /// Every error `schema` reports for `json`, which sits at `path`
  static List<JsonSchema.ValidationError> run(InstancePath path, JsonSchema schema, JsonNode json) {
    Traversal traversal = new Traversal();
    traversal.pending.push(new JsonSchema.ValidationFrame(path, schema, json));
    traversal.drain();
    return traversal.errors;
  }

  /// Errors of a top-level run, with a summary line at FINE
  static List<JsonSchema.ValidationError> root(JsonSchema schema, JsonNode json) {
    Traversal traversal = new Traversal();
    traversal.pending.push(new JsonSchema.ValidationFrame(InstancePath.ROOT, schema, json));
    traversal.drain();
    StructuredLog.fine(LOG, "validate.done", "frames", traversal.frames, "errors", traversal.errors.size());
    return traversal.errors;
  }

  private void drain() {
    while (!pending.isEmpty()) {
      JsonSchema.ValidationFrame frame = pending.pop();
      // A $ref cycle revisits the same schema at the same instance node
      if (!seen.add(new JsonSchema.ValidationKey(frame.schema(), frame.json(), frame.path()))) {
        continue;
      }
      frames++;
      LOG.finest(() -> "visit path=" + frame.path() + " schema=" + frame.schema().getClass().getSimpleName());
      errors.addAll(frame.schema().validateAt(frame.path(), frame.json(), pending).errors());
    }
  }

  /// First few messages joined for a combinator's summary error
  static String summarize(List<JsonSchema.ValidationError> errors) {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < Math.min(3, errors.size()); i++) {
      text.append(i == 0 ? "" : "; ").append(errors.get(i).message());
    }
    return errors.size() > 3 ? text.append("; ...").toString() : text.toString();
  }
}
