package io.intellixity.frugal.access.spi.exec;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Normalizes join-key values so that {@code 7}, {@code 7L} and {@code BigDecimal("7")} stitch together. */
public final class JoinKeys {
  private JoinKeys() {}

  public static Object normalize(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    if (v instanceof BigDecimal bd) {
      BigDecimal s = bd.stripTrailingZeros();
      if (s.scale() <= 0 && s.precision() - s.scale() < 19) return s.longValueExact();
      return s;
    }
    return v;
  }
}
