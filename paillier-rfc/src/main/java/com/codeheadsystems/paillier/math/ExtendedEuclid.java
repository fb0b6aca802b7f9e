package com.codeheadsystems.paillier.math;

import java.math.BigInteger;

/**
 * Computes the greatest common divisor of two integers together with their Bezout coefficients.
 */
public interface ExtendedEuclid {

  /**
   * Extended gcd of a and b.
   *
   * @param a the a
   * @param b the b
   * @return gcd, x and y with a * x + b * y = gcd
   */
  EuclidResult egcd(BigInteger a, BigInteger b);

}
