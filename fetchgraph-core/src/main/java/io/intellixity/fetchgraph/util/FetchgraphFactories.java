package io.intellixity.fetchgraph.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * Discovers SPI implementations listed in {@code META-INF/fetchgraph.factories}.
 * <p>
 * Every such resource on the classpath is a properties file mapping an SPI interface name to a
 * comma-separated list of implementation classes with public no-arg constructors:
 * <pre>
 * io.intellixity.fetchgraph.jdbc.dialect.SqlDialect=io.intellixity.fetchgraph.jdbc.dialect.AnsiSqlDialect
 * </pre>
 * Duplicates across resources are instantiated once, in first-seen order.
 */
public final class FetchgraphFactories {
  public static final String RESOURCE = "META-INF/fetchgraph.factories";

  private FetchgraphFactories() {}

  public static <T> List<T> load(Class<T> spi) {
    return load(spi, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spi, ClassLoader classLoader) {
    Objects.requireNonNull(spi, "spi");
    ClassLoader cl = (classLoader == null) ? FetchgraphFactories.class.getClassLoader() : classLoader;

    LinkedHashSet<String> names = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String listed = read(url).getProperty(spi.getName());
      if (listed == null) continue;
      Arrays.stream(listed.split(","))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .forEach(names::add);
    }

    List<T> out = new ArrayList<>(names.size());
    for (String name : names) out.add(instantiate(name, spi, cl));
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(String name, Class<T> spi, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(name, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Factory class not found: " + name + " (for " + spi.getName() + ")", e);
    }
    if (!spi.isAssignableFrom(raw)) {
      throw new IllegalStateException(name + " does not implement " + spi.getName());
    }
    try {
      return spi.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + name + " for " + spi.getName(), e);
    }
  }
}
