package io.intellixity.schemata.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic Java type for {@link Types#of(Type)}:
 * <pre>
 * TypeDescriptor t = new TypeToken&lt;Map&lt;String, List&lt;Integer&gt;&gt;&gt;() {}.descriptor();
 * </pre>
 */
public abstract class TypeToken<T> {
  private final Type type;

  protected TypeToken() {
    Type superclass = getClass().getGenericSuperclass();
    if (!(superclass instanceof ParameterizedType pt)) {
      throw new IllegalStateException("TypeToken must be created with a type argument");
    }
    this.type = pt.getActualTypeArguments()[0];
  }

  public Type type() { return type; }

  public TypeDescriptor descriptor() { return Types.of(type); }
}
