package com.codeheadsystems.paillier.config;

import com.codeheadsystems.paillier.common.RandomProvider;
import com.codeheadsystems.paillier.math.ExtendedEuclid;
import com.codeheadsystems.paillier.math.IterativeExtendedEuclid;

/**
 * Configuration for the Paillier cryptosystem.
 * Holds the random source, the extended Euclid provider and the default prime size for key generation.
 * The number of Miller-Rabin rounds is not configurable.
 *
 * @param randomProvider the random provider
 * @param extendedEuclid the extended Euclid provider
 * @param primeBitLength bit length of each prime when no size is given, the modulus has twice as many bits
 */
public record PaillierConfig(
    RandomProvider randomProvider,
    ExtendedEuclid extendedEuclid,
    int primeBitLength
) {

  /**
   * Default prime size; gives a 2048-bit modulus.
   */
  public static final int DEFAULT_PRIME_BIT_LENGTH = 1024;

  /**
   * Prime size used by the testing configurations.
   */
  public static final int TESTING_PRIME_BIT_LENGTH = 128;

  /**
   * Default configuration for production use: fresh {@link java.security.SecureRandom}, 1024-bit primes.
   */
  public static final PaillierConfig DEFAULT = new PaillierConfig(
      new RandomProvider(),
      new IterativeExtendedEuclid(),
      DEFAULT_PRIME_BIT_LENGTH
  );

  /**
   * Creates a test configuration with a deterministic random source and small primes.
   *
   * @return the paillier config
   */
  public static PaillierConfig forTesting() {
    return forTesting(0L);
  }

  /**
   * Creates a test configuration with a random source seeded from the given value and small primes.
   *
   * @param seed the seed
   * @return the paillier config
   */
  public static PaillierConfig forTesting(long seed) {
    return new PaillierConfig(
        RandomProvider.seeded(seed),
        new IterativeExtendedEuclid(),
        TESTING_PRIME_BIT_LENGTH
    );
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   */
  public PaillierConfig withRandomProvider(RandomProvider randomProvider) {
    return new PaillierConfig(randomProvider, extendedEuclid, primeBitLength);
  }

  /**
   * Returns a new config identical to this one but with the given default prime size.
   */
  public PaillierConfig withPrimeBitLength(int primeBitLength) {
    return new PaillierConfig(randomProvider, extendedEuclid, primeBitLength);
  }
}
