package com.codeheadsystems.paillier.math;

import java.math.BigInteger;

/**
 * Iterative extended Euclidean algorithm over non-negative operands.
 */
public class IterativeExtendedEuclid implements ExtendedEuclid {

  @Override
  public EuclidResult egcd(final BigInteger a, final BigInteger b) {
    BigInteger oldR = a;
    BigInteger r = b;
    BigInteger oldX = BigInteger.ONE;
    BigInteger x = BigInteger.ZERO;
    BigInteger oldY = BigInteger.ZERO;
    BigInteger y = BigInteger.ONE;

    while (r.signum() != 0) {
      BigInteger[] qr = oldR.divideAndRemainder(r);
      BigInteger quotient = qr[0];

      oldR = r;
      r = qr[1];

      BigInteger nextX = oldX.subtract(quotient.multiply(x));
      oldX = x;
      x = nextX;

      BigInteger nextY = oldY.subtract(quotient.multiply(y));
      oldY = y;
      y = nextY;
    }
    return new EuclidResult(oldR, oldX, oldY);
  }
}
