package io.intellixity.schemata.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Loads SPI implementations listed in every {@code META-INF/schemata.factories} on the classpath.
 * <p>
 * Each resource is a properties file keyed by the SPI interface name:
 * <pre>
 * io.intellixity.schemata.schema.SchemaProvider=com.acme.AppSchemas,com.acme.PluginSchemas
 * </pre>
 * Implementations are instantiated once each, in discovery order.
 */
public final class SchemataFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(SchemataFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/schemata.factories";

  private SchemataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = SchemataFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
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
    log.debug("schemata.factories_loaded spi={} implementations={}", spiType.getName(), implNames);
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      List<URL> urls = new ArrayList<>();
      Enumeration<URL> e = cl.getResources(RESOURCE);
      while (e.hasMoreElements()) urls.add(e.nextElement());
      return urls;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed in " + RESOURCE + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
