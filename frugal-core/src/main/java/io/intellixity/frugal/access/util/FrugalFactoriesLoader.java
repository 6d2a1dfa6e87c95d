package io.intellixity.frugal.access.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * Loads SPI implementations listed in {@code META-INF/frugal.factories} resources.
 * <p>
 * Each resource is a Java Properties file keyed by SPI interface name:
 * <pre>
 * io.intellixity.frugal.access.registry.ResourceFactory=com.acme.OrdersDbFactory,com.acme.CacheFactory
 * </pre>
 * Values may be comma-separated; implementations need a public no-arg constructor.
 */
public final class FrugalFactoriesLoader {
  public static final String RESOURCE = "META-INF/frugal.factories";

  private FrugalFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = FrugalFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to load " + RESOURCE + " from " + url, e);
      }
      String v = p.getProperty(spiType.getName());
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
