package io.intellixity.fetchgraph.sketch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulator for diagnostics produced along the sketch pipeline.
 * <p>
 * Not thread-safe; one instance belongs to one request.
 */
public final class Diagnostics {
  private final List<Diagnostic> items = new ArrayList<>();

  public Diagnostics error(String code, String message, String path) {
    items.add(new Diagnostic(code, message, path, Severity.ERROR));
    return this;
  }

  public Diagnostics warning(String code, String message, String path) {
    items.add(new Diagnostic(code, message, path, Severity.WARNING));
    return this;
  }

  public Diagnostics addAll(Diagnostics other) {
    if (other != null) items.addAll(other.items);
    return this;
  }

  public List<Diagnostic> items() { return Collections.unmodifiableList(items); }

  public List<Diagnostic> errors() {
    return items.stream().filter(Diagnostic::isError).toList();
  }

  public List<Diagnostic> warnings() {
    return items.stream().filter(d -> !d.isError()).toList();
  }

  public boolean hasErrors() {
    return items.stream().anyMatch(Diagnostic::isError);
  }

  public boolean hasCode(String code) {
    return items.stream().anyMatch(d -> d.code().equals(code));
  }

  public boolean isEmpty() { return items.isEmpty(); }

  /** {@code CODE: message (path=..); ...} over the error-level entries. */
  public String errorSummary() {
    return errors().stream().map(Diagnostic::toString).collect(Collectors.joining("; "));
  }

  @Override
  public String toString() { return items.toString(); }
}
