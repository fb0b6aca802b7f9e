package com.codeheadsystems.paillier;

import com.codeheadsystems.paillier.cipher.PaillierCryptosystem;
import com.codeheadsystems.paillier.config.PaillierConfig;
import com.codeheadsystems.paillier.keygen.KeyGenerator;
import com.codeheadsystems.paillier.model.Ciphertext;
import com.codeheadsystems.paillier.model.KeyPair;
import com.codeheadsystems.paillier.model.Plaintext;
import com.codeheadsystems.paillier.model.PublicKey;
import com.codeheadsystems.paillier.model.RoleGuard;
import com.codeheadsystems.paillier.model.SecretKey;
import com.codeheadsystems.paillier.prime.PrimalityTester;
import com.codeheadsystems.paillier.prime.PrimeGenerator;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paillier public API. Stateless; takes PaillierConfig at construction time and is safe to share between threads.
 */
public class Paillier {

  private static final Logger log = LoggerFactory.getLogger(Paillier.class);

  private final PaillierConfig config;
  private final KeyGenerator keyGenerator;
  private final PaillierCryptosystem cryptosystem;

  /**
   * Instantiates a new Paillier with the default configuration.
   */
  public Paillier() {
    this(PaillierConfig.DEFAULT);
  }

  /**
   * Instantiates a new Paillier.
   *
   * @param config the config
   */
  public Paillier(final PaillierConfig config) {
    this(config,
        new KeyGenerator(
            config.randomProvider(),
            new PrimeGenerator(config.randomProvider(), new PrimalityTester(config.randomProvider())),
            config.extendedEuclid()),
        new PaillierCryptosystem(config.randomProvider()));
  }

  /**
   * Instantiates a new Paillier from already wired components.
   *
   * @param config       the config
   * @param keyGenerator the key generator
   * @param cryptosystem the cryptosystem
   */
  public Paillier(final PaillierConfig config,
                  final KeyGenerator keyGenerator,
                  final PaillierCryptosystem cryptosystem) {
    log.info("Paillier(primeBitLength={})", config.primeBitLength());
    this.config = config;
    this.keyGenerator = keyGenerator;
    this.cryptosystem = cryptosystem;
  }

  // ─── Key generation ────────────────────────────────────────────────────────

  /**
   * Generates a key pair using the configured prime size.
   *
   * @return the key pair
   */
  public KeyPair generateKeyPair() {
    return generateKeyPair(config.primeBitLength());
  }

  /**
   * Generates a key pair from two distinct primes of the given bit length.
   *
   * @param bitLength the bit length of each prime
   * @return the key pair
   */
  public KeyPair generateKeyPair(final int bitLength) {
    return keyGenerator.generateKeyPair(bitLength);
  }

  // ─── Encryption ────────────────────────────────────────────────────────────

  /**
   * Encrypts the plaintext under the public key.
   *
   * @param publicKey the public key
   * @param plaintext the plaintext
   * @return the ciphertext
   */
  public Ciphertext encrypt(final PublicKey publicKey, final Plaintext plaintext) {
    return cryptosystem.encrypt(publicKey, plaintext);
  }

  /**
   * Encrypts the integer under the public key.
   *
   * @param publicKey the public key
   * @param plaintext the plaintext
   * @return the ciphertext
   */
  public Ciphertext encrypt(final PublicKey publicKey, final BigInteger plaintext) {
    return cryptosystem.encrypt(publicKey, new Plaintext(plaintext));
  }

  /**
   * Encrypts the integer under the public key.
   *
   * @param publicKey the public key
   * @param plaintext the plaintext
   * @return the ciphertext
   */
  public Ciphertext encrypt(final PublicKey publicKey, final long plaintext) {
    return cryptosystem.encrypt(publicKey, Plaintext.of(plaintext));
  }

  /**
   * Decrypts the ciphertext with a secret key and its corresponding public key.
   *
   * @param secretKey  the secret key
   * @param publicKey  the public key
   * @param ciphertext the ciphertext
   * @return the plaintext
   */
  public Plaintext decrypt(final SecretKey secretKey, final PublicKey publicKey, final Ciphertext ciphertext) {
    return cryptosystem.decrypt(secretKey, publicKey, ciphertext);
  }

  /**
   * Decrypts the ciphertext with the key pair.
   *
   * @param keyPair    the key pair
   * @param ciphertext the ciphertext
   * @return the plaintext
   */
  public Plaintext decrypt(final KeyPair keyPair, final Ciphertext ciphertext) {
    RoleGuard.require(keyPair, KeyPair.class, PaillierCryptosystem.DECRYPT_KEY_MESSAGE);
    return cryptosystem.decrypt(keyPair.secretKey(), keyPair.publicKey(), ciphertext);
  }

  // ─── Homomorphic operations ────────────────────────────────────────────────

  /**
   * Adds two encrypted values.
   *
   * @param publicKey the public key
   * @param c         the c
   * @param d         the d
   * @return the encrypted sum
   */
  public Ciphertext add(final PublicKey publicKey, final Ciphertext c, final Ciphertext d) {
    return cryptosystem.add(publicKey, c, d);
  }

  /**
   * Adds any number of encrypted values.
   *
   * @param publicKey   the public key
   * @param ciphertexts the ciphertexts
   * @return the encrypted sum
   */
  public Ciphertext sum(final PublicKey publicKey, final Iterable<Ciphertext> ciphertexts) {
    return cryptosystem.sum(publicKey, ciphertexts);
  }

  /**
   * Multiplies an encrypted value by a scalar.
   *
   * @param publicKey the public key
   * @param c         the c
   * @param scalar    the scalar
   * @return the encrypted product
   */
  public Ciphertext mul(final PublicKey publicKey, final Ciphertext c, final BigInteger scalar) {
    return cryptosystem.mul(publicKey, c, scalar);
  }

  /**
   * Multiplies an encrypted value by a scalar.
   *
   * @param publicKey the public key
   * @param c         the c
   * @param scalar    the scalar
   * @return the encrypted product
   */
  public Ciphertext mul(final PublicKey publicKey, final Ciphertext c, final long scalar) {
    return cryptosystem.mul(publicKey, c, BigInteger.valueOf(scalar));
  }

  /**
   * The configuration.
   *
   * @return the config
   */
  public PaillierConfig config() {
    return config;
  }
}
