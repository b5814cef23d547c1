package io.intellixity.fetchgraph.bind;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** How one field reference was resolved. */
public record BindingTrace(String input, String output, String entity,
                           @JsonProperty("join_path") List<String> joinPath, BindingReason reason) {
  public BindingTrace {
    joinPath = List.copyOf(joinPath);
  }
}
