package io.github.sasproject.json.schema;

import com.fasterxml.jackson.core.JsonPointer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/// Location of a value inside the instance being validated
///
/// Each step is either an object member or an array index. Member names are kept as
/// given, so a name containing `.` or `[` stays one step. [#toString()] renders
/// `a.b[0].c`, falling back to `['na.me']` for names that would read ambiguously; the
/// root renders as the empty string.
public record InstancePath(InstancePath parent, String member, int index) {

  public static final InstancePath ROOT = new InstancePath(null, null, -1);

  public InstancePath {
    if (parent == null) {
      if (member != null || index != -1) {
        throw new IllegalArgumentException("The root has no member or index");
      }
    } else if ((member == null) == (index < 0)) {
      throw new IllegalArgumentException("A step is either a member or an index: " + member + ", " + index);
    }
  }

  public InstancePath member(String name) {
    return new InstancePath(this, Objects.requireNonNull(name, "name"), -1);
  }

  public InstancePath index(int i) {
    if (i < 0) {
      throw new IllegalArgumentException("Negative index " + i);
    }
    return new InstancePath(this, null, i);
  }

  public boolean isRoot() {
    return parent == null;
  }

  /// Number of steps from the root
  public int depth() {
    int depth = 0;
    for (InstancePath p = this; p.parent != null; p = p.parent) {
      depth++;
    }
    return depth;
  }

  /// The root object member this path starts with, empty at the root or under a root array
  public Optional<String> rootMember() {
    if (isRoot()) {
      return Optional.empty();
    }
    InstancePath first = this;
    while (first.parent.parent != null) {
      first = first.parent;
    }
    return Optional.ofNullable(first.member);
  }

  /// The same location as an RFC 6901 pointer
  public JsonPointer toJsonPointer() {
    JsonPointer pointer = JsonPointer.empty();
    for (InstancePath step : steps()) {
      pointer = step.member != null ? pointer.appendProperty(step.member) : pointer.appendIndex(step.index);
    }
    return pointer;
  }

  private Deque<InstancePath> steps() {
    Deque<InstancePath> steps = new ArrayDeque<>();
    for (InstancePath p = this; p.parent != null; p = p.parent) {
      steps.push(p);
    }
    return steps;
  }

  @Override
  public String toString() {
    StringBuilder text = new StringBuilder();
    for (InstancePath step : steps()) {
      if (step.member == null) {
        text.append('[').append(step.index).append(']');
      } else if (isPlainName(step.member)) {
        text.append(text.length() == 0 ? "" : ".").append(step.member);
      } else {
        text.append("['").append(step.member.replace("\\", "\\\\").replace("'", "\\'")).append("']");
      }
    }
    return text.toString();
  }

  private static boolean isPlainName(String name) {
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c == '.' || c == '[' || c == ']' || c == '\'' || c == '\\') {
        return false;
      }
    }
    return true;
  }
}
