package com.codeheadsystems.paillier.prime;

import com.codeheadsystems.paillier.common.RandomProvider;
import com.codeheadsystems.paillier.exception.PaillierException;
import java.math.BigInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates pairs of distinct primes of an exact bit length by rejection sampling odd candidates.
 * <p>
 * There is no cap on the number of candidates drawn. By the prime number theorem roughly one odd candidate in
 * (bitLength * ln 2) / 2 is prime, so the search ends quickly, but callers needing a latency bound must impose their
 * own timeout and abandon the call. Nothing is retained between calls.
 */
@Singleton
public class PrimeGenerator {

  /**
   * Smallest bit length at which two distinct odd primes exist (5 and 7).
   */
  public static final int MIN_BIT_LENGTH = 3;

  private static final Logger log = LoggerFactory.getLogger(PrimeGenerator.class);

  private final RandomProvider randomProvider;
  private final PrimalityTester primalityTester;

  /**
   * Instantiates a new Prime generator.
   *
   * @param randomProvider  the random provider
   * @param primalityTester the primality tester
   */
  @Inject
  public PrimeGenerator(final RandomProvider randomProvider, final PrimalityTester primalityTester) {
    this.randomProvider = randomProvider;
    this.primalityTester = primalityTester;
  }

  /**
   * Returns two distinct primes, each with exactly the given number of bits (top bit set).
   *
   * @param bitLength the bit length of each prime
   * @return the prime pair
   */
  public PrimePair generatePrimePair(final int bitLength) {
    if (bitLength < MIN_BIT_LENGTH) {
      throw PaillierException.invalidArgument("bit length must be at least " + MIN_BIT_LENGTH + ": " + bitLength);
    }
    final BigInteger p = generatePrime(bitLength, null);
    final BigInteger q = generatePrime(bitLength, p);
    return new PrimePair(p, q);
  }

  /**
   * Draws odd candidates uniformly from [2^(bitLength-1), 2^bitLength - 1] until one is probably prime and differs
   * from {@code exclude}.
   */
  private BigInteger generatePrime(final int bitLength, final BigInteger exclude) {
    final BigInteger lower = BigInteger.ONE.shiftLeft(bitLength - 1);
    int attempts = 0;
    while (true) {
      attempts++;
      // lower is even, so lower + 1 + 2k walks the 2^(bitLength-2) odd values of the range.
      final BigInteger candidate = lower.add(BigInteger.ONE).add(randomProvider.randomBits(bitLength - 2).shiftLeft(1));
      if (candidate.equals(exclude)) {
        continue;
      }
      if (primalityTester.isProbablyPrime(candidate)) {
        log.debug("generatePrime(bitLength={}, attempts={})", bitLength, attempts);
        return candidate;
      }
    }
  }
}
