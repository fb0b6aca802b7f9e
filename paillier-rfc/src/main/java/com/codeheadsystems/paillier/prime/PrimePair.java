package com.codeheadsystems.paillier.prime;

import java.math.BigInteger;

/**
 * Two distinct primes of the same bit length. Only lives for the duration of key generation.
 *
 * @param p the first prime
 * @param q the second prime
 */
public record PrimePair(BigInteger p, BigInteger q) {

  @Override
  public String toString() {
    return "PrimePair[bitLength=" + p.bitLength() + "]";
  }
}
