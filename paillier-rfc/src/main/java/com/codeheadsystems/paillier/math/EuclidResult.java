package com.codeheadsystems.paillier.math;

import java.math.BigInteger;

/**
 * Result of the extended Euclidean algorithm on (a, b).
 *
 * @param gcd the greatest common divisor of a and b
 * @param x   Bezout coefficient of a
 * @param y   Bezout coefficient of b, so that a * x + b * y = gcd
 */
public record EuclidResult(BigInteger gcd, BigInteger x, BigInteger y) {
}
