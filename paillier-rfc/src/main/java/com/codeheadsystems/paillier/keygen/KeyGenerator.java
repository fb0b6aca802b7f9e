package com.codeheadsystems.paillier.keygen;

import com.codeheadsystems.paillier.common.RandomProvider;
import com.codeheadsystems.paillier.math.EuclidResult;
import com.codeheadsystems.paillier.math.ExtendedEuclid;
import com.codeheadsystems.paillier.math.PaillierMath;
import com.codeheadsystems.paillier.model.KeyPair;
import com.codeheadsystems.paillier.model.PublicKey;
import com.codeheadsystems.paillier.model.SecretKey;
import com.codeheadsystems.paillier.prime.PrimeGenerator;
import com.codeheadsystems.paillier.prime.PrimePair;
import java.math.BigInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives Paillier key pairs.
 * <ol>
 *   <li>Obtain distinct primes p, q and set n = p * q, lambda = lcm(p - 1, q - 1).</li>
 *   <li>Draw g uniformly from the units modulo n^2.</li>
 *   <li>Set u = L(g^lambda mod n^2) with L(x) = (x - 1) / n. If u has no inverse modulo n, draw another g.</li>
 *   <li>mu = u^-1 mod n.</li>
 * </ol>
 * The generator search has no iteration cap; a non-invertible u is a vanishingly rare event.
 */
@Singleton
public class KeyGenerator {

  private static final Logger log = LoggerFactory.getLogger(KeyGenerator.class);

  private final RandomProvider randomProvider;
  private final PrimeGenerator primeGenerator;
  private final ExtendedEuclid extendedEuclid;

  /**
   * Instantiates a new Key generator.
   *
   * @param randomProvider the random provider, used to draw the generator g
   * @param primeGenerator the prime generator
   * @param extendedEuclid the extended Euclid provider, used to invert u modulo n
   */
  @Inject
  public KeyGenerator(final RandomProvider randomProvider,
                      final PrimeGenerator primeGenerator,
                      final ExtendedEuclid extendedEuclid) {
    this.randomProvider = randomProvider;
    this.primeGenerator = primeGenerator;
    this.extendedEuclid = extendedEuclid;
  }

  /**
   * Generates a key pair whose primes each have the given bit length.
   *
   * @param bitLength the bit length of each prime
   * @return the key pair
   */
  public KeyPair generateKeyPair(final int bitLength) {
    log.info("generateKeyPair(bitLength={})", bitLength);
    final PrimePair primes = primeGenerator.generatePrimePair(bitLength);
    return deriveKeyPair(primes);
  }

  /**
   * Derives a key pair from two distinct primes.
   *
   * @param primes the primes
   * @return the key pair
   */
  public KeyPair deriveKeyPair(final PrimePair primes) {
    final BigInteger n = primes.p().multiply(primes.q());
    final BigInteger nSquared = n.multiply(n);
    final BigInteger lambda = PaillierMath.lcm(primes.p().subtract(BigInteger.ONE), primes.q().subtract(BigInteger.ONE));

    while (true) {
      final BigInteger g = randomProvider.randomUnit(nSquared);
      final BigInteger u = PaillierMath.lTransform(g.modPow(lambda, nSquared), n);
      final EuclidResult result = extendedEuclid.egcd(u, n);
      if (result.gcd().equals(BigInteger.ONE)) {
        final BigInteger mu = result.x().mod(n);
        return new KeyPair(new SecretKey(lambda, mu), new PublicKey(n, g));
      }
      log.debug("deriveKeyPair: generator rejected, L(g^lambda) shares factor with n");
    }
  }
}
