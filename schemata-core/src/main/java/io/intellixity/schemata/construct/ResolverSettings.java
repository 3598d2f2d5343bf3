package io.intellixity.schemata.construct;

/**
 * @param maxDepth deepest container/schema nesting a document may have before construction is refused
 */
public record ResolverSettings(int maxDepth) {
  public static final int DEFAULT_MAX_DEPTH = 256;
  public static final ResolverSettings DEFAULTS = new ResolverSettings(DEFAULT_MAX_DEPTH);

  public ResolverSettings {
    if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
  }
}
