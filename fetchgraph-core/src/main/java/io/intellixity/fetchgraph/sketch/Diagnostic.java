package io.intellixity.fetchgraph.sketch;

import java.util.Objects;

/** One recoverable issue found while reading a sketch. {@code path} points into the input, e.g. {@code where[1]}. */
public record Diagnostic(String code, String message, String path, Severity severity) {
  public Diagnostic {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(severity, "severity");
  }

  public boolean isError() { return severity == Severity.ERROR; }

  @Override
  public String toString() {
    return code + ": " + message + (path == null ? "" : " (path=" + path + ")");
  }
}
