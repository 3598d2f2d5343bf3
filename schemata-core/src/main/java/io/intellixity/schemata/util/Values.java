package io.intellixity.schemata.util;

import io.intellixity.schemata.types.NativeKind;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Objects;

/** Equality of raw document values. */
public final class Values {
  private Values() {}

  /**
   * Exact equality within a native kind. Integers compare by value across {@code Integer}/{@code Long}/
   * {@code BigInteger}, floats across {@code Double}/{@code Float}/{@code BigDecimal}; an integer never
   * equals a float. {@code -0.0} equals {@code 0.0} and NaN equals NaN. Everything else uses {@link Object#equals}.
   */
  public static boolean sameValue(Object a, Object b) {
    NativeKind ka = NativeKind.of(a);
    NativeKind kb = NativeKind.of(b);
    if (ka != kb) return false;
    if (ka == NativeKind.INTEGER) return toBigInteger(a).equals(toBigInteger(b));
    if (ka == NativeKind.FLOAT) return sameFloat((Number) a, (Number) b);
    return Objects.equals(a, b);
  }

  public static boolean isOneOf(Object value, Collection<?> options) {
    for (Object o : options) {
      if (sameValue(value, o)) return true;
    }
    return false;
  }

  private static BigInteger toBigInteger(Object n) {
    if (n instanceof BigInteger b) return b;
    return BigInteger.valueOf(((Number) n).longValue());
  }

  private static boolean sameFloat(Number a, Number b) {
    if (!(a instanceof BigDecimal) && !(b instanceof BigDecimal)) {
      double da = a.doubleValue();
      double db = b.doubleValue();
      return da == db || (Double.isNaN(da) && Double.isNaN(db));
    }
    BigDecimal da = toBigDecimal(a);
    BigDecimal db = toBigDecimal(b);
    return da != null && db != null && da.compareTo(db) == 0;
  }

  /** Null for NaN and infinities, which have no decimal form. */
  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal b) return b;
    double d = n.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) return null;
    return new BigDecimal(Double.toString(d));
  }
}
