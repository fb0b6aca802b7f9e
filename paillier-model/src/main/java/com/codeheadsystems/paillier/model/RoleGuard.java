package com.codeheadsystems.paillier.model;

import com.codeheadsystems.paillier.exception.PaillierException;
import java.math.BigInteger;

/**
 * Runtime role checks applied at the public entry points. The typed API already rules most mistakes out at compile
 * time; these checks catch nulls and values that arrive as {@link Object}.
 */
public class RoleGuard {

  private RoleGuard() {
  }

  /**
   * Returns the value as the required type, or fails with a type mismatch.
   *
   * @param <T>     the required type
   * @param value   the value
   * @param type    the required type
   * @param message the failure message
   * @return the value, cast
   */
  public static <T> T require(final Object value, final Class<T> type, final String message) {
    if (!type.isInstance(value)) {
      throw PaillierException.typeMismatch(message);
    }
    return type.cast(value);
  }

  /**
   * Converts an integral number to a {@link BigInteger}. Floating point values, strings and nulls fail with a type
   * mismatch.
   *
   * @param value   the value
   * @param message the failure message
   * @return the big integer
   */
  public static BigInteger requireInteger(final Object value, final String message) {
    if (value instanceof BigInteger bigInteger) {
      return bigInteger;
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return BigInteger.valueOf(((Number) value).longValue());
    }
    throw PaillierException.typeMismatch(message);
  }

  static void requireNonNull(final Object value, final String message) {
    if (value == null) {
      throw PaillierException.typeMismatch(message);
    }
  }
}
