package com.codeheadsystems.paillier.prime;

import com.codeheadsystems.paillier.common.RandomProvider;
import com.codeheadsystems.paillier.exception.PaillierException;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.LongStream;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Miller-Rabin probable-prime test, preceded by trial division against the primes below 32.
 * <p>
 * A composite passes all rounds with probability at most 4^-{@value #ROUNDS}. The round count is fixed and does not
 * scale with the size of the input.
 */
@Singleton
public class PrimalityTester {

  /**
   * Number of Miller-Rabin rounds, each with an independent random witness.
   */
  public static final int ROUNDS = 8;

  private static final BigInteger THREE = BigInteger.valueOf(3);
  private static final List<BigInteger> SMALL_PRIMES = LongStream.of(2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31)
      .mapToObj(BigInteger::valueOf)
      .toList();

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Primality tester.
   *
   * @param randomProvider source of the Miller-Rabin witnesses
   */
  @Inject
  public PrimalityTester(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Convenience overload of {@link #isProbablyPrime(BigInteger)}.
   *
   * @param number the number to test
   * @return true if the number is probably prime
   */
  public boolean isProbablyPrime(final long number) {
    return isProbablyPrime(BigInteger.valueOf(number));
  }

  /**
   * Decides whether the number is probably prime. Zero and one are not prime.
   *
   * @param number the number to test, must be nonnegative
   * @return true if the number is probably prime, false if it is certainly composite (or 0, or 1)
   * @throws PaillierException INVALID_ARGUMENT for a negative number, TYPE_MISMATCH for null
   */
  public boolean isProbablyPrime(final BigInteger number) {
    if (number == null) {
      throw PaillierException.typeMismatch("input must be an integer");
    }
    if (number.signum() < 0) {
      throw PaillierException.invalidArgument("input must be a nonnegative integer");
    }
    if (number.compareTo(BigInteger.ONE) <= 0) {
      return false;
    }

    for (BigInteger prime : SMALL_PRIMES) {
      if (number.equals(prime)) {
        return true;
      }
      if (number.mod(prime).signum() == 0) {
        return false;
      }
    }

    // number - 1 = 2^exponent * odd
    final BigInteger numberMinusOne = number.subtract(BigInteger.ONE);
    final int exponent = numberMinusOne.getLowestSetBit();
    final BigInteger odd = numberMinusOne.shiftRight(exponent);

    for (int round = 0; round < ROUNDS; round++) {
      // witness in [2, number - 2]
      final BigInteger witness = BigInteger.TWO.add(randomProvider.randomBelow(number.subtract(THREE)));
      if (!passes(witness, odd, exponent, number, numberMinusOne)) {
        return false;
      }
    }
    return true;
  }

  private boolean passes(final BigInteger witness,
                         final BigInteger odd,
                         final int exponent,
                         final BigInteger number,
                         final BigInteger numberMinusOne) {
    BigInteger x = witness.modPow(odd, number);
    if (x.equals(BigInteger.ONE)) {
      return true;
    }
    for (int i = 0; i < exponent; i++) {
      if (x.equals(numberMinusOne)) {
        return true;
      }
      x = x.modPow(BigInteger.TWO, number);
    }
    return false;
  }
}
