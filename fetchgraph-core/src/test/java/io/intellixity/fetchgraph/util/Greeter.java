package io.intellixity.fetchgraph.util;

public interface Greeter {
  String greet(String name);
}
