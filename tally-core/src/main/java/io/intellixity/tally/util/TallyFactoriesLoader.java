package io.intellixity.tally.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Plugin loader reading {@code META-INF/tally.factories} resources from the classpath.\n
 *
 * Each resource is a Properties file mapping an SPI interface name to implementation classes:\n
 *
 * <pre>
 * io.intellixity.tally.jdbc.dialect.SqlDialect=io.intellixity.tally.jdbc.postgres.PostgresDialect
 * </pre>
 *
 * Values may be comma-separated; duplicates across jars are instantiated once.\n
 */
public final class TallyFactoriesLoader {
  public static final String RESOURCE = "META-INF/tally.factories";

  private TallyFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = TallyFactoriesLoader.class.getClassLoader();

    LinkedHashSet<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(newInstance(implName, spiType, cl));
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
      }
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
