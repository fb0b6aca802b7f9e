package com.codeheadsystems.paillier.cipher;

import com.codeheadsystems.paillier.common.RandomProvider;
import com.codeheadsystems.paillier.exception.ErrorKind;
import com.codeheadsystems.paillier.exception.PaillierException;
import com.codeheadsystems.paillier.math.PaillierMath;
import com.codeheadsystems.paillier.model.Ciphertext;
import com.codeheadsystems.paillier.model.Plaintext;
import com.codeheadsystems.paillier.model.PublicKey;
import com.codeheadsystems.paillier.model.RoleGuard;
import com.codeheadsystems.paillier.model.SecretKey;
import java.math.BigInteger;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encryption, decryption and the two homomorphic operations. Stateless apart from the random provider, so a single
 * instance may be shared between threads.
 * <p>
 * Every argument is role-checked before any arithmetic happens. Mixing ciphertexts from different public keys is not
 * detected and gives meaningless results.
 */
@Singleton
public class PaillierCryptosystem {

  public static final String ENCRYPT_KEY_MESSAGE = "can only encrypt using a public key";
  public static final String ENCRYPT_PLAINTEXT_MESSAGE = "can only encrypt a plaintext";
  public static final String DECRYPT_KEY_MESSAGE = "can only decrypt using a secret key and its corresponding public key";
  public static final String DECRYPT_CIPHERTEXT_MESSAGE = "can only decrypt a ciphertext";
  public static final String OPERATION_KEY_MESSAGE = "can only perform operation using a public key";
  public static final String ADD_MESSAGE = "can only add two ciphertexts";
  public static final String MULTIPLY_CIPHERTEXT_MESSAGE = "can only multiply a ciphertext";
  public static final String MULTIPLY_SCALAR_MESSAGE = "can only multiply by an integer scalar";

  private static final Logger log = LoggerFactory.getLogger(PaillierCryptosystem.class);

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Paillier cryptosystem.
   *
   * @param randomProvider source of the blinding factors
   */
  @Inject
  public PaillierCryptosystem(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * c = g^(m mod n) * r^n mod n^2 for a fresh random unit r modulo n. Two encryptions of the same plaintext differ
   * with overwhelming probability.
   *
   * @param publicKey the public key
   * @param plaintext the plaintext; negative values and values above n are reduced modulo n
   * @return the ciphertext
   */
  public Ciphertext encrypt(final PublicKey publicKey, final Plaintext plaintext) {
    RoleGuard.require(publicKey, PublicKey.class, ENCRYPT_KEY_MESSAGE);
    RoleGuard.require(plaintext, Plaintext.class, ENCRYPT_PLAINTEXT_MESSAGE);
    log.trace("encrypt()");

    final BigInteger n = publicKey.n();
    final BigInteger nSquared = publicKey.nSquared();
    final BigInteger r = randomProvider.randomUnit(n);
    final BigInteger gm = publicKey.g().modPow(plaintext.value().mod(n), nSquared);
    final BigInteger rn = r.modPow(n, nSquared);
    return new Ciphertext(gm.multiply(rn).mod(nSquared));
  }

  /**
   * m = L(c^lambda mod n^2) * mu mod n. The secret key must belong to the given public key; that pairing is the
   * caller's responsibility.
   *
   * @param secretKey  the secret key
   * @param publicKey  the matching public key
   * @param ciphertext the ciphertext
   * @return the plaintext in [0, n)
   */
  public Plaintext decrypt(final SecretKey secretKey, final PublicKey publicKey, final Ciphertext ciphertext) {
    RoleGuard.require(secretKey, SecretKey.class, DECRYPT_KEY_MESSAGE);
    RoleGuard.require(publicKey, PublicKey.class, DECRYPT_KEY_MESSAGE);
    RoleGuard.require(ciphertext, Ciphertext.class, DECRYPT_CIPHERTEXT_MESSAGE);
    log.trace("decrypt()");

    final BigInteger n = publicKey.n();
    final BigInteger u = ciphertext.value().modPow(secretKey.lambda(), publicKey.nSquared());
    return new Plaintext(PaillierMath.lTransform(u, n).multiply(secretKey.mu()).mod(n));
  }

  /**
   * Homomorphic addition: decrypting c * d mod n^2 yields (a + b) mod n.
   *
   * @param publicKey the public key both ciphertexts were produced under
   * @param c         the first ciphertext
   * @param d         the second ciphertext
   * @return the ciphertext of the sum
   */
  public Ciphertext add(final PublicKey publicKey, final Ciphertext c, final Ciphertext d) {
    RoleGuard.require(publicKey, PublicKey.class, OPERATION_KEY_MESSAGE);
    RoleGuard.require(c, Ciphertext.class, ADD_MESSAGE);
    RoleGuard.require(d, Ciphertext.class, ADD_MESSAGE);
    log.trace("add()");

    return new Ciphertext(c.value().multiply(d.value()).mod(publicKey.nSquared()));
  }

  /**
   * Homomorphic sum of any number of ciphertexts. An empty collection gives 1, the trivial encryption of zero.
   *
   * @param publicKey   the public key all ciphertexts were produced under
   * @param ciphertexts the ciphertexts
   * @return the ciphertext of the sum
   */
  public Ciphertext sum(final PublicKey publicKey, final Iterable<Ciphertext> ciphertexts) {
    RoleGuard.require(publicKey, PublicKey.class, OPERATION_KEY_MESSAGE);
    RoleGuard.require(ciphertexts, Iterable.class, ADD_MESSAGE);
    log.trace("sum()");

    final BigInteger nSquared = publicKey.nSquared();
    BigInteger result = BigInteger.ONE;
    for (Object ciphertext : ciphertexts) {
      final Ciphertext c = RoleGuard.require(ciphertext, Ciphertext.class, ADD_MESSAGE);
      result = result.multiply(c.value()).mod(nSquared);
    }
    return new Ciphertext(result);
  }

  /**
   * Homomorphic scaling: decrypting c^s mod n^2 yields (a * s) mod n. A negative scalar inverts the ciphertext
   * modulo n^2 first.
   *
   * @param publicKey the public key the ciphertext was produced under
   * @param c         the ciphertext
   * @param scalar    the integer scalar
   * @return the ciphertext of the product
   */
  public Ciphertext mul(final PublicKey publicKey, final Ciphertext c, final BigInteger scalar) {
    RoleGuard.require(publicKey, PublicKey.class, OPERATION_KEY_MESSAGE);
    RoleGuard.require(c, Ciphertext.class, MULTIPLY_CIPHERTEXT_MESSAGE);
    RoleGuard.require(scalar, BigInteger.class, MULTIPLY_SCALAR_MESSAGE);
    log.trace("mul()");

    try {
      return new Ciphertext(c.value().modPow(scalar, publicKey.nSquared()));
    } catch (ArithmeticException e) {
      throw new PaillierException(ErrorKind.INVALID_ARGUMENT,
          "ciphertext is not invertible modulo n^2, cannot multiply by a negative scalar", e);
    }
  }
}
