package io.intellixity.schemata.yaml;

import java.nio.file.Path;
import java.util.Locale;

public enum DocumentFormat {
  YAML,
  JSON;

  /** Format by file extension: {@code .yaml}/{@code .yml} or {@code .json}. */
  public static DocumentFormat of(Path file) {
    String name = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".yaml") || name.endsWith(".yml")) return YAML;
    if (name.endsWith(".json")) return JSON;
    throw new DocumentException("Unknown document format for " + file + " (expected .yaml, .yml or .json)");
  }
}
