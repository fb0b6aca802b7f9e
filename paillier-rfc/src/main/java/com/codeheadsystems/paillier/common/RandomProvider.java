package com.codeheadsystems.paillier.common;

import com.codeheadsystems.paillier.exception.PaillierException;
import java.math.BigInteger;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import org.bouncycastle.util.BigIntegers;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random integer generation.
 * Used for Miller-Rabin witnesses, prime candidates, generator candidates and encryption blinding factors.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Creates a deterministic RandomProvider. SHA1PRNG seeded before its first use always yields the same stream, so
   * two providers built from the same seed generate the same primes and keys. For tests only.
   *
   * @param seed the seed
   * @return the random provider
   */
  public static RandomProvider seeded(long seed) {
    try {
      SecureRandom random = SecureRandom.getInstance("SHA1PRNG");
      random.setSeed(seed);
      return new RandomProvider(random);
    } catch (NoSuchAlgorithmException e) {
      throw new RuntimeException("SHA1PRNG not available", e);
    }
  }

  /**
   * Uniformly distributed integer in [0, bound).
   *
   * @param bound the exclusive upper bound, must be positive
   * @return the random integer
   */
  public BigInteger randomBelow(BigInteger bound) {
    if (bound.signum() <= 0) {
      throw PaillierException.invalidArgument("random bound must be positive: " + bound);
    }
    return BigIntegers.createRandomInRange(BigInteger.ZERO, bound.subtract(BigInteger.ONE), random);
  }

  /**
   * Uniformly distributed integer in [0, 2^bitCount).
   *
   * @param bitCount the number of random bits, at least one
   * @return the random integer
   */
  public BigInteger randomBits(int bitCount) {
    if (bitCount < 1) {
      throw PaillierException.invalidArgument("bit count must be positive: " + bitCount);
    }
    return BigIntegers.createRandomBigInteger(bitCount, random);
  }

  /**
   * Uniformly distributed unit modulo the given modulus: nonzero, below the modulus and coprime to it. Used for the
   * key generator g and the encryption blinding factor r.
   *
   * @param modulus the modulus, greater than one
   * @return the random unit
   */
  public BigInteger randomUnit(BigInteger modulus) {
    if (modulus.compareTo(BigInteger.ONE) <= 0) {
      throw PaillierException.invalidArgument("modulus must be greater than one: " + modulus);
    }
    BigInteger candidate;
    do {
      candidate = randomBelow(modulus);
    } while (candidate.signum() == 0 || !candidate.gcd(modulus).equals(BigInteger.ONE));
    return candidate;
  }
}
