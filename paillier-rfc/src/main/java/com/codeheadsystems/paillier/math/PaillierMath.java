package com.codeheadsystems.paillier.math;

import java.math.BigInteger;

/**
 * Number-theoretic helpers shared by key generation and decryption.
 */
public class PaillierMath {

  private PaillierMath() {
  }

  /**
   * The Paillier L function: L(x) = (x - 1) / n, integer division.
   *
   * @param x the value, normally x = 1 mod n
   * @param n the modulus
   * @return L(x)
   */
  public static BigInteger lTransform(final BigInteger x, final BigInteger n) {
    return x.subtract(BigInteger.ONE).divide(n);
  }

  /**
   * Least common multiple of two positive integers.
   *
   * @param a the a
   * @param b the b
   * @return lcm(a, b)
   */
  public static BigInteger lcm(final BigInteger a, final BigInteger b) {
    return a.multiply(b).divide(a.gcd(b));
  }
}
