package io.intellixity.schemata.types;

/** Scalar kinds a field may declare. */
public enum PrimitiveKind {
  INTEGER("int", NativeKind.INTEGER),
  FLOAT("float", NativeKind.FLOAT),
  STRING("string", NativeKind.STRING),
  BOOLEAN("bool", NativeKind.BOOLEAN);

  private final String id;
  private final NativeKind nativeKind;

  PrimitiveKind(String id, NativeKind nativeKind) {
    this.id = id;
    this.nativeKind = nativeKind;
  }

  public String id() { return id; }
  public NativeKind nativeKind() { return nativeKind; }

  /** True for the kinds a map key may resolve to. */
  public boolean isKeyKind() { return this != BOOLEAN; }
}
