package io.intellixity.fetchgraph.util;

public class HelloGreeter implements Greeter {
  @Override
  public String greet(String name) { return "hello " + name; }
}
